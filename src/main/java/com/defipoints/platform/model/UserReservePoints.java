package com.defipoints.platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Per user-reserve settlement baseline. Balances are raw token units, points are scaled by 1e18.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserReservePoints {
    private String userId;
    private String reserveId;
    private BigInteger lastDepositBalance;
    private BigInteger lastBorrowBalance;
    private double lastDepositUsd;
    private double lastBorrowUsd;
    private long lastUpdateTimestamp;
    private BigInteger lastPriceIndex;
    private BigInteger depositPoints;
    private BigInteger borrowPoints;

    public static String key(String userId, String reserveId) {
        return userId + ":" + reserveId;
    }

    public static UserReservePoints empty(String userId, String reserveId) {
        return UserReservePoints.builder()
            .userId(userId)
            .reserveId(reserveId)
            .lastDepositBalance(BigInteger.ZERO)
            .lastBorrowBalance(BigInteger.ZERO)
            .lastUpdateTimestamp(0)
            .depositPoints(BigInteger.ZERO)
            .borrowPoints(BigInteger.ZERO)
            .build();
    }

    @JsonIgnore
    public BigInteger getTotalPoints() {
        return depositPoints.add(borrowPoints);
    }
}
