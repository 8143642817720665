package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistEntry {
    private String userId;
    private boolean blacklisted;
    private long updatedAt;
}
