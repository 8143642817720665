package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NftPartnership {
    private String collection;
    private String name;
    private boolean active;
    private long startTimestamp;
    private Long endTimestamp;
    private long createdAt;
    private long updatedAt;

    /**
     * Whether the partnership counts towards multipliers at {@code timestamp}.
     */
    public boolean isLiveAt(long timestamp) {
        if (!active || timestamp < startTimestamp) {
            return false;
        }
        return endTimestamp == null || endTimestamp == 0 || timestamp < endTimestamp;
    }
}
