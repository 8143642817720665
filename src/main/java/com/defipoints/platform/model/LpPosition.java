package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Concentrated-liquidity position. Only time spent in range earns points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LpPosition {
    private String positionId;
    private String userId;
    private BigInteger valueUsdE8;
    private boolean inRange;
    private long lastSettledAt;
    private BigInteger points;
}
