package com.defipoints.platform.repository.impl;

import com.defipoints.platform.repository.ChainReader;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Chain reader used when no RPC endpoint is configured. Every balance is unknown.
 */
@Component
public class NoopChainReader implements ChainReader {

    @Override
    public Optional<Long> readBalance(String collection, String userId) {
        return Optional.empty();
    }
}
