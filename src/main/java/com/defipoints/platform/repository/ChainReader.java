package com.defipoints.platform.repository;

import java.util.Optional;

/**
 * Read-only view of on-chain ownership used to baseline NFT balances.
 */
public interface ChainReader {
    Optional<Long> readBalance(String collection, String userId);
}
