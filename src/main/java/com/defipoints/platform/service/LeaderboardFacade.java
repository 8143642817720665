package com.defipoints.platform.service;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.model.BlacklistEntry;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.model.RankedUser;
import com.defipoints.platform.model.TopK;
import com.defipoints.platform.model.TopKEntry;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for every points change that must be reflected in the rankings.
 */
@Service
public class LeaderboardFacade {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardFacade.class);

    public static final String GLOBAL_MIRROR_ID = "global";

    private final PointsStore store;
    private final RankingStructure rankingStructure;
    private final RedisRepository redisRepository;
    private final PointsProperties properties;
    private final AtomicBoolean mirrorDirty = new AtomicBoolean(false);

    @Autowired
    public LeaderboardFacade(
            PointsStore store,
            RankingStructure rankingStructure,
            RedisRepository redisRepository,
            PointsProperties properties) {
        this.store = store;
        this.rankingStructure = rankingStructure;
        this.redisRepository = redisRepository;
        this.properties = properties;
    }

    public boolean isBlacklisted(String userId) {
        return store.findBlacklistEntry(userId)
            .map(BlacklistEntry::isBlacklisted)
            .orElse(false);
    }

    /**
     * Ranks {@code points} in the current epoch and its global mirror.
     */
    public void updateLeaderboard(String userId, double points, long timestamp) {
        if (isBlacklisted(userId)) {
            logger.debug("Skipping leaderboard update for blacklisted user {}", userId);
            return;
        }
        LeaderboardState state = store.findState().orElse(null);
        if (state == null || !state.hasEpoch()) {
            return;
        }
        if (store.findEpoch(state.getCurrentEpochNumber()).isEmpty()) {
            return;
        }

        boolean headChanged = rankingStructure.upsert(state.getCurrentEpochNumber(), userId, points, timestamp, true);
        if (headChanged) {
            publishGlobalTopK();
        }
    }

    public void updateAllTimeLeaderboard(String userId, double lifetimePoints, long timestamp) {
        if (isBlacklisted(userId)) {
            return;
        }
        rankingStructure.upsert(RankingStructure.ALL_TIME_SCOPE, userId, lifetimePoints, timestamp, false);
    }

    public void removeUserFromLeaderboards(String userId, long timestamp) {
        LeaderboardState state = store.findState().orElse(null);
        boolean headChanged = false;
        if (state != null && state.hasEpoch()) {
            headChanged = rankingStructure.remove(state.getCurrentEpochNumber(), userId, timestamp, true);
        }
        rankingStructure.remove(RankingStructure.ALL_TIME_SCOPE, userId, timestamp, false);
        logger.info("Removed user {} from leaderboards", userId);

        if (headChanged) {
            publishGlobalTopK();
        }
    }

    public void resetGlobalMirror(long epochNumber, long timestamp) {
        rankingStructure.resetGlobalMirror(epochNumber, timestamp);
        publishGlobalTopK();
    }

    /**
     * Retries a publish that previously failed.
     */
    public void republishIfDirty() {
        if (mirrorDirty.get()) {
            logger.info("Republishing global leaderboard mirror to Redis");
            publishGlobalTopK();
        }
    }

    public boolean isMirrorDirty() {
        return mirrorDirty.get();
    }

    private void publishGlobalTopK() {
        if (!properties.getMirror().isRedisEnabled()) {
            return;
        }
        if (!redisRepository.isAvailable()) {
            logger.warn("Redis is not available, global leaderboard mirror marked for republish");
            mirrorDirty.set(true);
            return;
        }

        try {
            List<RankedUser> entries = rankingStructure.topEntries(TopK.GLOBAL_KEY).stream()
                .limit(properties.getMirror().getTopK())
                .map(this::toRankedUser)
                .toList();
            redisRepository.publishTopK(GLOBAL_MIRROR_ID, entries);
            mirrorDirty.set(false);
            logger.debug("Published {} global leaderboard entries to Redis", entries.size());
        } catch (Exception e) {
            logger.warn("Failed to publish global leaderboard to Redis, will retry", e);
            mirrorDirty.set(true);
        }
    }

    private RankedUser toRankedUser(TopKEntry entry) {
        return RankedUser.builder()
            .userId(entry.getUserId())
            .rank(entry.getRank())
            .points(entry.getPoints())
            .build();
    }
}
