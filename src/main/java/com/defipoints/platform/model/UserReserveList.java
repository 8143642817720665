package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reserves, LP positions and voting locks a user has touched, in first-touch order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserReserveList {
    private String userId;
    private List<String> reserveIds;
    private List<String> lpPositionIds;
    private List<String> lockTokenIds;

    public static UserReserveList empty(String userId) {
        return UserReserveList.builder()
            .userId(userId)
            .reserveIds(new ArrayList<>())
            .lpPositionIds(new ArrayList<>())
            .lockTokenIds(new ArrayList<>())
            .build();
    }
}
