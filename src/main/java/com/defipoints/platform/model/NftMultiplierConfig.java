package com.defipoints.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Diminishing NFT bonus parameters. The i-th owned collection adds
 * {@code firstBonusBps * (decayRatioBps / 10000)^i}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NftMultiplierConfig {
    public static final String KEY = "current";

    private long firstBonusBps;
    private long decayRatioBps;
    private long lastUpdate;
}
