package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * New daily bonuses, wad encoded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyBonusParams {
    private BigInteger supplyBonus;
    private BigInteger borrowBonus;
    private BigInteger repayBonus;
    private BigInteger withdrawBonus;
    private Long timestamp;
}
