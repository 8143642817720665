package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpochParams {
    private Long epochNumber;
    private Long scheduledTime;
}
