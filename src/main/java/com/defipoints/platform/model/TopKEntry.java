package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TopKEntry {
    private String id;
    private long epochNumber;
    private String userId;
    private double points;
    private int rank;

    public static String key(long epochNumber, String userId) {
        return "epoch:" + epochNumber + ":" + userId;
    }

    public static String globalKey(String userId) {
        return "global:" + userId;
    }
}
