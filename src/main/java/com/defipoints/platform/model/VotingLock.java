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
public class VotingLock {
    private String tokenId;
    private String owner;
    private BigInteger lockedAmount;
    private long lockEnd;
    private boolean permanent;
    private long updatedAt;
}
