package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NftMultiplierParams {
    private Long firstBonusBps;
    private Long decayRatioBps;
    private Long timestamp;
}
