package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEpoch {
    private long epochNumber;
    private long startBlock;
    private long startTime;
    private Long endBlock;
    private Long endTime;
    private boolean active;
    private long scheduledStartTime;
    private long scheduledEndTime;

    public static String key(long epochNumber) {
        return Long.toString(epochNumber);
    }

    public boolean hasEnded() {
        return !active && endTime != null && endTime > 0;
    }

    public static LeaderboardEpoch unscheduled(long epochNumber) {
        return LeaderboardEpoch.builder()
            .epochNumber(epochNumber)
            .build();
    }
}
