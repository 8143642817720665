package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Manual award or removal. {@code points} is scaled by 1e18.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointsAdjustmentParams {
    private String user;
    private BigInteger points;
    private String reason;
    private Long timestamp;
}
