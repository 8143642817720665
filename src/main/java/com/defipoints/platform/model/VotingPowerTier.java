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
public class VotingPowerTier {
    private int tierIndex;
    private BigInteger minVotingPower;
    private long multiplierBps;
    private boolean active;
    private long createdAt;
    private long updatedAt;

    public static String key(int tierIndex) {
        return Integer.toString(tierIndex);
    }
}
