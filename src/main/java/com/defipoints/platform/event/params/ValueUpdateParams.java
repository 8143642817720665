package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single numeric config change: a rate in bps, a cooldown in seconds or a USD minimum.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValueUpdateParams {
    private Double value;
    private Long timestamp;
}
