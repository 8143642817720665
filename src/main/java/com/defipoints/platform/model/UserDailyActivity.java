package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per UTC day activity of a user within an epoch. High-water marks are USD values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDailyActivity {
    private String userId;
    private long epochNumber;
    private long day;
    private boolean supplied;
    private boolean borrowed;
    private boolean repaid;
    private boolean withdrawn;
    private double dailySupplyUsdHighwater;
    private double dailyBorrowUsdHighwater;
    private double dailyRepayUsdHighwater;
    private double dailyWithdrawUsdHighwater;
    private long updatedAt;

    public static String key(String userId, long epochNumber, long day) {
        return userId + ":" + epochNumber + ":" + day;
    }

    public static UserDailyActivity empty(String userId, long epochNumber, long day, long timestamp) {
        return UserDailyActivity.builder()
            .userId(userId)
            .epochNumber(epochNumber)
            .day(day)
            .updatedAt(timestamp)
            .build();
    }

    public double highwaterFor(DailyAction action) {
        switch (action) {
            case SUPPLY:
                return dailySupplyUsdHighwater;
            case BORROW:
                return dailyBorrowUsdHighwater;
            case REPAY:
                return dailyRepayUsdHighwater;
            case WITHDRAW:
                return dailyWithdrawUsdHighwater;
            default:
                throw new IllegalArgumentException("Unknown daily action: " + action);
        }
    }

    public void addToHighwater(DailyAction action, double amountUsd) {
        switch (action) {
            case SUPPLY:
                dailySupplyUsdHighwater += amountUsd;
                break;
            case BORROW:
                dailyBorrowUsdHighwater += amountUsd;
                break;
            case REPAY:
                dailyRepayUsdHighwater += amountUsd;
                break;
            case WITHDRAW:
                dailyWithdrawUsdHighwater += amountUsd;
                break;
            default:
                throw new IllegalArgumentException("Unknown daily action: " + action);
        }
    }

    public void markActive(DailyAction action) {
        switch (action) {
            case SUPPLY:
                supplied = true;
                break;
            case BORROW:
                borrowed = true;
                break;
            case REPAY:
                repaid = true;
                break;
            case WITHDRAW:
                withdrawn = true;
                break;
            default:
                throw new IllegalArgumentException("Unknown daily action: " + action);
        }
    }
}
