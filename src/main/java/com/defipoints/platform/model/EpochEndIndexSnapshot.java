package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Reserve indices frozen at an epoch's end time, used to value balances for gap settlements.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpochEndIndexSnapshot {
    private long epochNumber;
    private String reserveId;
    private BigInteger liquidityIndex;
    private BigInteger variableBorrowIndex;
    private long timestamp;

    public static String key(long epochNumber, String reserveId) {
        return "epochEnd:" + epochNumber + ":" + reserveId;
    }
}
