package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Global points parameters. Rates are basis points per day; bonuses are whole points.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardConfig {
    public static final String KEY = "global";

    private long depositRateBps;
    private long borrowRateBps;
    private long vpRateBps;
    private long lpRateBps;
    private double supplyDailyBonus;
    private double borrowDailyBonus;
    private double repayDailyBonus;
    private double withdrawDailyBonus;
    private double minDailyBonusUsd;
    private long cooldownSeconds;
    private long lastUpdate;

    public double dailyBonusFor(DailyAction action) {
        switch (action) {
            case SUPPLY:
                return supplyDailyBonus;
            case BORROW:
                return borrowDailyBonus;
            case REPAY:
                return repayDailyBonus;
            case WITHDRAW:
                return withdrawDailyBonus;
            default:
                throw new IllegalArgumentException("Unknown daily action: " + action);
        }
    }

    public void setDailyBonus(DailyAction action, double bonus) {
        switch (action) {
            case SUPPLY:
                supplyDailyBonus = bonus;
                break;
            case BORROW:
                borrowDailyBonus = bonus;
                break;
            case REPAY:
                repayDailyBonus = bonus;
                break;
            case WITHDRAW:
                withdrawDailyBonus = bonus;
                break;
            default:
                throw new IllegalArgumentException("Unknown daily action: " + action);
        }
    }
}
