package com.defipoints.platform.math;

import com.defipoints.platform.model.EpochEndIndexSnapshot;
import com.defipoints.platform.model.Reserve;
import com.defipoints.platform.model.UserReserve;

import java.math.BigInteger;

/**
 * Projects reserve indices and scaled user balances to a point in time.
 */
public final class ReserveMath {

    private ReserveMath() {
    }

    /**
     * Supply index at {@code timestamp}, accrued linearly from the last reserve update.
     */
    public static BigInteger normalizedIncome(Reserve reserve, long timestamp) {
        BigInteger index = nullToZero(reserve.getLiquidityIndex());
        if (index.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (timestamp <= reserve.getLastUpdateTimestamp()) {
            return index;
        }
        BigInteger cumulated = FixedPointMath.linearInterest(
            nullToZero(reserve.getLiquidityRate()), reserve.getLastUpdateTimestamp(), timestamp);
        return FixedPointMath.rayMul(FixedPointMath.RAY.add(cumulated), index);
    }

    /**
     * Variable debt index at {@code timestamp}, compounded from the last reserve update.
     */
    public static BigInteger normalizedVariableDebt(Reserve reserve, long timestamp) {
        BigInteger index = nullToZero(reserve.getVariableBorrowIndex());
        if (index.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (timestamp <= reserve.getLastUpdateTimestamp()) {
            return index;
        }
        BigInteger cumulated = FixedPointMath.compoundedInterest(
            nullToZero(reserve.getVariableBorrowRate()), reserve.getLastUpdateTimestamp(), timestamp);
        return FixedPointMath.rayMul(cumulated, index);
    }

    /**
     * Token balances of {@code userReserve} at {@code timestamp}. When an epoch-end snapshot is
     * supplied its frozen indices replace the live ones.
     */
    public static CurrentBalances currentBalances(Reserve reserve, UserReserve userReserve, long timestamp,
                                                  EpochEndIndexSnapshot indexOverride) {
        BigInteger storedSupply = nullToZero(userReserve.getCurrentATokenBalance());
        BigInteger storedDebt = nullToZero(userReserve.getCurrentVariableDebt());

        if (timestamp < reserve.getLastUpdateTimestamp() && indexOverride == null) {
            return new CurrentBalances(storedSupply, storedDebt);
        }

        BigInteger liquidityIndex = indexOverride != null
            ? indexOverride.getLiquidityIndex()
            : normalizedIncome(reserve, timestamp);
        BigInteger borrowIndex = indexOverride != null
            ? indexOverride.getVariableBorrowIndex()
            : normalizedVariableDebt(reserve, timestamp);

        BigInteger scaledSupply = nullToZero(userReserve.getScaledATokenBalance());
        BigInteger scaledDebt = nullToZero(userReserve.getScaledVariableDebt());

        BigInteger supply = scaledSupply.signum() > 0 && liquidityIndex.signum() > 0
            ? FixedPointMath.rayMul(scaledSupply, liquidityIndex)
            : storedSupply;
        BigInteger debt = scaledDebt.signum() > 0 && borrowIndex.signum() > 0
            ? FixedPointMath.rayMul(scaledDebt, borrowIndex)
            : storedDebt;

        return new CurrentBalances(supply, debt);
    }

    private static BigInteger nullToZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
