package com.defipoints.platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserIndex {
    public static final int NO_BUCKET = -1;

    private String id;
    private String userId;
    private long epochNumber;
    private double points;
    private int bucketIndex;
    private long updatedAt;

    public static String key(String userId, long epochNumber) {
        return userId + ":" + epochNumber;
    }

    @JsonIgnore
    public boolean isRanked() {
        return bucketIndex >= 0;
    }
}
