package com.defipoints.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Bound from the {@code points.*} block of application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "points")
@Data
public class PointsProperties {
    private Defaults defaults = new Defaults();
    private Replay replay = new Replay();
    private Snapshot snapshot = new Snapshot();
    private Mirror mirror = new Mirror();

    @Data
    public static class Defaults {
        private long depositRateBps = 100;
        private long borrowRateBps = 500;
        private long vpRateBps = 0;
        private long lpRateBps = 0;
        private long cooldownSeconds = 3600;
        // 1 USD with 8 decimals
        private long priceUsdE8 = 100_000_000L;
    }

    @Data
    public static class Replay {
        private boolean guardEnabled = true;
    }

    @Data
    public static class Snapshot {
        private boolean enabled = false;
        private String file = "./data/points-snapshot.json";
        private long flushIntervalMs = 30000;
    }

    @Data
    public static class Mirror {
        private boolean redisEnabled = true;
        private int topK = 100;
    }
}
