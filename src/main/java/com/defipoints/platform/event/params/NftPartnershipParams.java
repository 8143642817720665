package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partnership registration. The multiplier parameters, when present, replace the global ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NftPartnershipParams {
    private String collection;
    private String name;
    private Boolean active;
    private Long startTimestamp;
    private Long endTimestamp;
    private Long firstBonusBps;
    private Long decayRatioBps;
    private Long timestamp;
}
