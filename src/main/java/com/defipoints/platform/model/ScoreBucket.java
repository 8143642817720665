package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Histogram band {@code [lower, upper)} and the number of positive-score users inside it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBucket {
    private String id;
    private long epochNumber;
    private int index;
    private double lower;
    private double upper;
    private int count;
    private long updatedAt;

    public static String key(long epochNumber, int index) {
        return "epoch:" + epochNumber + ":b:" + index;
    }

    public static String globalKey(int index) {
        return "b:" + index;
    }
}
