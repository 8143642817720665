package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardTotals {
    public static final String GLOBAL_KEY = "global";

    private String id;
    private long epochNumber;
    private int totalUsers;
    private long updatedAt;

    public static String key(long epochNumber) {
        return "epoch:" + epochNumber;
    }
}
