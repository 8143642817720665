package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Running point totals of one user within one epoch. All point amounts are scaled by 1e18.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserEpochStats {
    private static final long BASIS_POINTS = 10_000L;

    private String userId;
    private long epochNumber;

    private BigInteger depositPoints;
    private BigInteger borrowPoints;
    private BigInteger lpPoints;
    private BigInteger dailySupplyPoints;
    private BigInteger dailyBorrowPoints;
    private BigInteger dailyRepayPoints;
    private BigInteger dailyWithdrawPoints;
    private BigInteger dailyVpPoints;
    private BigInteger manualAwardPoints;

    private BigInteger depositPointsWithMultiplier;
    private BigInteger borrowPointsWithMultiplier;
    private BigInteger vpPointsWithMultiplier;
    private BigInteger lpPointsWithMultiplier;

    private long depositMultiplierBps;
    private long borrowMultiplierBps;
    private long vpMultiplierBps;
    private long lpMultiplierBps;
    private long lastAppliedMultiplierBps;

    private long lastSupplyPointsDay;
    private long lastBorrowPointsDay;
    private long lastRepayPointsDay;
    private long lastWithdrawPointsDay;

    private BigInteger totalPoints;
    private BigInteger totalPointsWithMultiplier;

    private long firstSeenAt;
    private long lastUpdatedAt;

    public static String key(String userId, long epochNumber) {
        return userId + ":" + epochNumber;
    }

    public static UserEpochStats empty(String userId, long epochNumber, long timestamp) {
        return UserEpochStats.builder()
            .userId(userId)
            .epochNumber(epochNumber)
            .depositPoints(BigInteger.ZERO)
            .borrowPoints(BigInteger.ZERO)
            .lpPoints(BigInteger.ZERO)
            .dailySupplyPoints(BigInteger.ZERO)
            .dailyBorrowPoints(BigInteger.ZERO)
            .dailyRepayPoints(BigInteger.ZERO)
            .dailyWithdrawPoints(BigInteger.ZERO)
            .dailyVpPoints(BigInteger.ZERO)
            .manualAwardPoints(BigInteger.ZERO)
            .depositPointsWithMultiplier(BigInteger.ZERO)
            .borrowPointsWithMultiplier(BigInteger.ZERO)
            .vpPointsWithMultiplier(BigInteger.ZERO)
            .lpPointsWithMultiplier(BigInteger.ZERO)
            .depositMultiplierBps(BASIS_POINTS)
            .borrowMultiplierBps(BASIS_POINTS)
            .vpMultiplierBps(BASIS_POINTS)
            .lpMultiplierBps(BASIS_POINTS)
            .lastAppliedMultiplierBps(BASIS_POINTS)
            .lastSupplyPointsDay(-1)
            .lastBorrowPointsDay(-1)
            .lastRepayPointsDay(-1)
            .lastWithdrawPointsDay(-1)
            .totalPoints(BigInteger.ZERO)
            .totalPointsWithMultiplier(BigInteger.ZERO)
            .firstSeenAt(timestamp)
            .lastUpdatedAt(0)
            .build();
    }

    public long lastPointsDayFor(DailyAction action) {
        switch (action) {
            case SUPPLY:
                return lastSupplyPointsDay;
            case BORROW:
                return lastBorrowPointsDay;
            case REPAY:
                return lastRepayPointsDay;
            case WITHDRAW:
                return lastWithdrawPointsDay;
            default:
                throw new IllegalArgumentException("Unknown daily action: " + action);
        }
    }

    /**
     * Credits a daily bonus for {@code action} and marks {@code day} as consumed.
     */
    public void creditDailyBonus(DailyAction action, BigInteger points, long day) {
        switch (action) {
            case SUPPLY:
                dailySupplyPoints = dailySupplyPoints.add(points);
                lastSupplyPointsDay = day;
                break;
            case BORROW:
                dailyBorrowPoints = dailyBorrowPoints.add(points);
                lastBorrowPointsDay = day;
                break;
            case REPAY:
                dailyRepayPoints = dailyRepayPoints.add(points);
                lastRepayPointsDay = day;
                break;
            case WITHDRAW:
                dailyWithdrawPoints = dailyWithdrawPoints.add(points);
                lastWithdrawPointsDay = day;
                break;
            default:
                throw new IllegalArgumentException("Unknown daily action: " + action);
        }
    }

    /**
     * Recomputes {@code totalPoints} and {@code totalPointsWithMultiplier} from the components.
     * Daily bonuses and manual points are never multiplied.
     */
    public void recomputeTotals() {
        BigInteger unmultiplied = dailySupplyPoints
            .add(dailyBorrowPoints)
            .add(dailyRepayPoints)
            .add(dailyWithdrawPoints)
            .add(manualAwardPoints);

        totalPoints = depositPoints
            .add(borrowPoints)
            .add(lpPoints)
            .add(dailyVpPoints)
            .add(unmultiplied);

        totalPointsWithMultiplier = depositPointsWithMultiplier
            .add(borrowPointsWithMultiplier)
            .add(vpPointsWithMultiplier)
            .add(lpPointsWithMultiplier)
            .add(unmultiplied);
    }
}
