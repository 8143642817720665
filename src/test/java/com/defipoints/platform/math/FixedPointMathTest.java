package com.defipoints.platform.math;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class FixedPointMathTest {

    @Test
    void testRayMul_RoundsHalfUp() {
        // Arrange
        BigInteger half = FixedPointMath.HALF_RAY;

        // Act
        BigInteger result = FixedPointMath.rayMul(BigInteger.ONE, half);

        // Assert
        assertEquals(BigInteger.ONE, result);
    }

    @Test
    void testRayMul_ZeroOperand() {
        assertEquals(BigInteger.ZERO, FixedPointMath.rayMul(BigInteger.ZERO, FixedPointMath.RAY));
        assertEquals(BigInteger.ZERO, FixedPointMath.rayMul(FixedPointMath.RAY, BigInteger.ZERO));
    }

    @Test
    void testRayDiv_InvertsRayMul() {
        // Arrange
        BigInteger amount = new BigInteger("1000000000000000000000");
        BigInteger index = new BigInteger("1050000000000000000000000000");

        // Act
        BigInteger scaled = FixedPointMath.rayDiv(amount, index);
        BigInteger restored = FixedPointMath.rayMul(scaled, index);

        // Assert
        assertTrue(restored.subtract(amount).abs().compareTo(BigInteger.ONE) <= 0);
    }

    @Test
    void testRayDiv_ByZeroReturnsZero() {
        assertEquals(BigInteger.ZERO, FixedPointMath.rayDiv(BigInteger.TEN, BigInteger.ZERO));
    }

    @Test
    void testLinearInterest_FullYear() {
        // Arrange
        BigInteger tenPercent = FixedPointMath.RAY.divide(BigInteger.TEN);

        // Act
        BigInteger interest = FixedPointMath.linearInterest(tenPercent, 0, FixedPointMath.SECONDS_PER_YEAR);

        // Assert
        assertEquals(tenPercent, interest);
    }

    @Test
    void testLinearInterest_BackwardsIntervalIsZero() {
        assertEquals(BigInteger.ZERO, FixedPointMath.linearInterest(FixedPointMath.RAY, 100, 50));
    }

    @Test
    void testCompoundedInterest_NoElapsedTimeIsOne() {
        assertEquals(FixedPointMath.RAY, FixedPointMath.compoundedInterest(FixedPointMath.RAY, 100, 100));
    }

    @Test
    void testCompoundedInterest_ExceedsLinear() {
        // Arrange
        BigInteger rate = FixedPointMath.RAY.divide(BigInteger.TEN);
        long year = FixedPointMath.SECONDS_PER_YEAR;

        // Act
        BigInteger compounded = FixedPointMath.compoundedInterest(rate, 0, year);
        BigInteger linear = FixedPointMath.RAY.add(FixedPointMath.linearInterest(rate, 0, year));

        // Assert
        assertTrue(compounded.compareTo(linear) > 0);
    }

    @Test
    void testUtilizationRate_EmptyPool() {
        assertEquals(BigInteger.ZERO, FixedPointMath.utilizationRate(BigInteger.ZERO, BigInteger.ZERO));
    }

    @Test
    void testUtilizationRate_HalfBorrowed() {
        assertEquals(FixedPointMath.HALF_RAY,
            FixedPointMath.utilizationRate(BigInteger.valueOf(50), BigInteger.valueOf(50)));
    }

    @Test
    void testToDecimal() {
        assertEquals(1.5, FixedPointMath.toDecimal(new BigInteger("1500000000000000000"), 18));
        assertEquals(0.000001, FixedPointMath.toDecimal(BigInteger.valueOf(1_000_000_000_000L), 18));
        assertEquals(-2.25, FixedPointMath.toDecimal(BigInteger.valueOf(-225), 2));
        assertEquals(0.0, FixedPointMath.toDecimal(null, 18));
        assertEquals(42.0, FixedPointMath.toDecimal(BigInteger.valueOf(42), 0));
    }

    @Test
    void testWadRayConversion() {
        assertEquals(FixedPointMath.RAY, FixedPointMath.wadToRay(FixedPointMath.WAD));
        assertEquals(FixedPointMath.WAD, FixedPointMath.rayToWad(FixedPointMath.RAY));
        // half a wad unit rounds up
        assertEquals(BigInteger.ONE, FixedPointMath.rayToWad(BigInteger.valueOf(500_000_000L)));
        assertEquals(BigInteger.ZERO, FixedPointMath.rayToWad(BigInteger.valueOf(499_999_999L)));
    }

    @Test
    void testGrowth_FullYearAtFullRate() {
        // Arrange
        BigInteger principal = FixedPointMath.WAD.multiply(BigInteger.valueOf(100));

        // Act
        BigInteger earned = FixedPointMath.growth(principal, FixedPointMath.RAY, 0, FixedPointMath.SECONDS_PER_YEAR);

        // Assert
        assertEquals(principal, earned);
    }

    @Test
    void testGrowth_BackwardsInterval() {
        assertEquals(BigInteger.ZERO, FixedPointMath.growth(FixedPointMath.WAD, FixedPointMath.RAY, 100, 50));
    }
}
