package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Voting lock change. {@code amount} is the locked delta for deposits and withdrawals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockParams {
    private String tokenId;
    private String owner;
    private BigInteger amount;
    private Long lockEnd;
    private Long timestamp;
}
