package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Position of one user in a leaderboard scope. {@code rank} is null for users without a positive
 * score; {@code exact} is false when the rank was estimated from the histogram.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRanking {
    private String userId;
    private long epochNumber;
    private double points;
    private int bucketIndex;
    private Long rank;
    private boolean exact;
}
