package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Full config broadcast. Daily bonuses are wad encoded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigSnapshotParams {
    private Long depositRateBps;
    private Long borrowRateBps;
    private Long vpRateBps;
    private BigInteger supplyDailyBonus;
    private BigInteger borrowDailyBonus;
    private BigInteger repayDailyBonus;
    private BigInteger withdrawDailyBonus;
    private Long cooldownSeconds;
    private Double minDailyBonusUsd;
    private Long timestamp;
}
