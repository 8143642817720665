package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Interest-bearing market state. Indices and rates are ray values; the price has 8 decimals.
 * {@code priceIndex} is the running sum of price times seconds, advanced up to
 * {@code priceIndexTimestamp}. {@code priceIndexAtReset} is its value at the start of the epoch
 * recorded in {@code priceIndexResetTimestamp}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reserve {
    private String id;
    private int decimals;
    private BigInteger priceUsdE8;
    private BigInteger liquidityIndex;
    private BigInteger liquidityRate;
    private BigInteger variableBorrowIndex;
    private BigInteger variableBorrowRate;
    private long lastUpdateTimestamp;
    private BigInteger priceIndex;
    private long priceIndexTimestamp;
    private BigInteger priceIndexAtReset;
    private long priceIndexResetTimestamp;
}
