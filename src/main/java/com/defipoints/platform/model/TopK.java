package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered entry ids of the exactly ranked head of a scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopK {
    public static final String GLOBAL_KEY = "global";

    private String id;
    private long epochNumber;
    private int k;
    private List<String> entries;
    private long updatedAt;

    public static String key(long epochNumber) {
        return "epoch:" + epochNumber;
    }

    public static TopK empty(String id, long epochNumber, int k) {
        return TopK.builder()
            .id(id)
            .epochNumber(epochNumber)
            .k(k)
            .entries(new ArrayList<>())
            .updatedAt(0)
            .build();
    }
}
