package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserReserve {
    private String userId;
    private String reserveId;
    private BigInteger scaledATokenBalance;
    private BigInteger currentATokenBalance;
    private BigInteger scaledVariableDebt;
    private BigInteger currentVariableDebt;
    private long lastUpdateTimestamp;

    public static String key(String userId, String reserveId) {
        return userId + "-" + reserveId;
    }

    public static UserReserve empty(String userId, String reserveId, long timestamp) {
        return UserReserve.builder()
            .userId(userId)
            .reserveId(reserveId)
            .scaledATokenBalance(BigInteger.ZERO)
            .currentATokenBalance(BigInteger.ZERO)
            .scaledVariableDebt(BigInteger.ZERO)
            .currentVariableDebt(BigInteger.ZERO)
            .lastUpdateTimestamp(timestamp)
            .build();
    }
}
