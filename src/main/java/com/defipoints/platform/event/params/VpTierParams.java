package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VpTierParams {
    private Integer tierIndex;
    private BigInteger minVotingPower;
    private Long multiplierBps;
    private Long timestamp;
}
