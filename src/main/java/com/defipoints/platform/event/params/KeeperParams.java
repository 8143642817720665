package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Keeper sync. {@code collection} and {@code balance} apply to NFT balance syncs,
 * {@code votingPower} to voting power syncs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeeperParams {
    private String user;
    private String collection;
    private Long balance;
    private BigInteger votingPower;
    private Long timestamp;
}
