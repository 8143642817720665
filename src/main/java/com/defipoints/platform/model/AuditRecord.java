package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecord {
    private String id;
    private AuditType type;
    private String userId;
    private BigInteger amount;
    private String detail;
    private long blockNumber;
    private long timestamp;

    public static String key(String transactionHash, int logIndex) {
        return transactionHash + "-" + logIndex;
    }
}
