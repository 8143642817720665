package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Singleton pointer to the scoring epoch in force plus the cursor of the last applied event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardState {
    public static final String KEY = "current";

    private long currentEpochNumber;
    private boolean active;
    private long lastBlockNumber;
    private int lastLogIndex;

    public static LeaderboardState initial() {
        return LeaderboardState.builder()
            .currentEpochNumber(0)
            .active(false)
            .lastBlockNumber(-1)
            .lastLogIndex(-1)
            .build();
    }

    public boolean hasEpoch() {
        return currentEpochNumber > 0;
    }
}
