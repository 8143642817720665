package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * New state of a liquidity position. {@code valueUsdE8} is the position value with 8 decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LpPositionParams {
    private String positionId;
    private String user;
    private BigInteger valueUsdE8;
    private Boolean inRange;
}
