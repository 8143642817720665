package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserNftOwnership {
    private String userId;
    private String collection;
    private long balance;
    private boolean hasNft;
    private long lastCheckedAt;

    public static String key(String userId, String collection) {
        return userId + ":" + collection;
    }
}
