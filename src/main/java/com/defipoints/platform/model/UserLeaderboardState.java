package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Denormalized multiplier inputs and lifetime totals of a single user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserLeaderboardState {
    private String userId;
    private long nftCount;
    private long nftMultiplierBps;
    private BigInteger votingPower;
    private long vpTierIndex;
    private long vpMultiplierBps;
    private long combinedMultiplierBps;
    private BigInteger lifetimePoints;
    private BigInteger lifetimePointsWithMultiplier;
    private List<Long> epochsParticipated;
    private long lastUpdate;

    public static UserLeaderboardState initial(String userId, long timestamp) {
        return UserLeaderboardState.builder()
            .userId(userId)
            .nftCount(0)
            .nftMultiplierBps(10_000L)
            .votingPower(BigInteger.ZERO)
            .vpTierIndex(0)
            .vpMultiplierBps(10_000L)
            .combinedMultiplierBps(10_000L)
            .lifetimePoints(BigInteger.ZERO)
            .lifetimePointsWithMultiplier(BigInteger.ZERO)
            .epochsParticipated(new ArrayList<>())
            .lastUpdate(timestamp)
            .build();
    }
}
