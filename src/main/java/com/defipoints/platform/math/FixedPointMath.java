package com.defipoints.platform.math;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Ray (1e27) and wad (1e18) fixed-point arithmetic used by lending-protocol interest math.
 * All operations round half up the way the on-chain libraries do.
 */
public final class FixedPointMath {

    public static final BigInteger RAY = BigInteger.TEN.pow(27);
    public static final BigInteger HALF_RAY = RAY.divide(BigInteger.TWO);
    public static final BigInteger WAD = BigInteger.TEN.pow(18);
    public static final BigInteger WAD_RAY_RATIO = BigInteger.TEN.pow(9);
    public static final long SECONDS_PER_YEAR = 31_556_952L;

    private static final BigInteger SECONDS_PER_YEAR_BI = BigInteger.valueOf(SECONDS_PER_YEAR);

    private FixedPointMath() {
    }

    public static BigInteger rayMul(BigInteger a, BigInteger b) {
        if (a.signum() == 0 || b.signum() == 0) {
            return BigInteger.ZERO;
        }
        return a.multiply(b).add(HALF_RAY).divide(RAY);
    }

    public static BigInteger rayDiv(BigInteger a, BigInteger b) {
        if (a.signum() == 0 || b.signum() == 0) {
            return BigInteger.ZERO;
        }
        return a.multiply(RAY).add(b.divide(BigInteger.TWO)).divide(b);
    }

    public static BigInteger rayToWad(BigInteger a) {
        return a.add(WAD_RAY_RATIO.divide(BigInteger.TWO)).divide(WAD_RAY_RATIO);
    }

    public static BigInteger wadToRay(BigInteger a) {
        return a.multiply(WAD_RAY_RATIO);
    }

    /**
     * Simple interest accumulated between two timestamps, in ray. A zero-length or
     * backwards interval yields zero.
     */
    public static BigInteger linearInterest(BigInteger rate, long lastUpdate, long now) {
        if (now <= lastUpdate) {
            return BigInteger.ZERO;
        }
        BigInteger elapsed = BigInteger.valueOf(now - lastUpdate);
        BigInteger yearFraction = rayDiv(wadToRay(elapsed), wadToRay(SECONDS_PER_YEAR_BI));
        return rayMul(rate, yearFraction);
    }

    /**
     * Compounded interest factor approximated with the first three terms of the binomial
     * expansion. Returns {@link #RAY} (1.0) when no time has passed.
     */
    public static BigInteger compoundedInterest(BigInteger rate, long lastUpdate, long now) {
        if (now <= lastUpdate) {
            return RAY;
        }
        BigInteger exp = BigInteger.valueOf(now - lastUpdate);
        BigInteger expMinusOne = exp.subtract(BigInteger.ONE);
        BigInteger expMinusTwo = exp.compareTo(BigInteger.TWO) > 0 ? exp.subtract(BigInteger.TWO) : BigInteger.ZERO;

        BigInteger ratePerSecond = rate.divide(SECONDS_PER_YEAR_BI);
        BigInteger basePowerTwo = rayMul(ratePerSecond, ratePerSecond);
        BigInteger basePowerThree = rayMul(basePowerTwo, ratePerSecond);

        BigInteger secondTerm = exp.multiply(expMinusOne).multiply(basePowerTwo).divide(BigInteger.TWO);
        BigInteger thirdTerm = exp.multiply(expMinusOne).multiply(expMinusTwo).multiply(basePowerThree)
            .divide(BigInteger.valueOf(6));

        return RAY.add(ratePerSecond.multiply(exp)).add(secondTerm).add(thirdTerm);
    }

    /**
     * Interest earned by a wad principal at a linear ray rate over the interval.
     */
    public static BigInteger growth(BigInteger principal, BigInteger rate, long previous, long current) {
        if (current <= previous) {
            return BigInteger.ZERO;
        }
        BigInteger interest = linearInterest(rate, previous, current);
        return rayToWad(rayMul(wadToRay(principal), interest));
    }

    /**
     * Share of total liquidity currently borrowed, in ray.
     */
    public static BigInteger utilizationRate(BigInteger totalDebt, BigInteger availableLiquidity) {
        BigInteger totalLiquidity = totalDebt.add(availableLiquidity);
        if (totalLiquidity.signum() <= 0) {
            return BigInteger.ZERO;
        }
        return rayDiv(totalDebt, totalLiquidity);
    }

    /**
     * Converts an integer amount with {@code decimals} implied fraction digits to a double.
     * Sign is preserved and trailing zero fraction digits are dropped without rounding.
     */
    public static double toDecimal(BigInteger value, int decimals) {
        if (value == null || value.signum() == 0) {
            return 0d;
        }
        if (decimals <= 0) {
            return value.doubleValue();
        }
        boolean negative = value.signum() < 0;
        String digits = value.abs().toString();
        if (digits.length() <= decimals) {
            digits = "0".repeat(decimals - digits.length() + 1) + digits;
        }
        String whole = digits.substring(0, digits.length() - decimals);
        String fraction = stripTrailingZeros(digits.substring(digits.length() - decimals));
        String text = fraction.isEmpty() ? whole : whole + "." + fraction;
        double parsed = new BigDecimal(text).doubleValue();
        return negative ? -parsed : parsed;
    }

    private static String stripTrailingZeros(String fraction) {
        int end = fraction.length();
        while (end > 0 && fraction.charAt(end - 1) == '0') {
            end--;
        }
        return fraction.substring(0, end);
    }
}
