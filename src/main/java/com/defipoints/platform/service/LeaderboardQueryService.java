package com.defipoints.platform.service;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.exception.InvalidRequestException;
import com.defipoints.platform.exception.LeaderboardNotFoundException;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.model.LeaderboardTotals;
import com.defipoints.platform.model.RankedUser;
import com.defipoints.platform.model.ScoreBucket;
import com.defipoints.platform.model.TopK;
import com.defipoints.platform.model.TopKEntry;
import com.defipoints.platform.model.UserEpochStats;
import com.defipoints.platform.model.UserIndex;
import com.defipoints.platform.model.UserLeaderboardState;
import com.defipoints.platform.model.UserRanking;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Read side of the rankings. A scope is {@code global} (the epoch in force), {@code all-time}
 * or an epoch number.
 */
@Service
public class LeaderboardQueryService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardQueryService.class);

    public static final String GLOBAL_SCOPE = "global";
    public static final String ALL_TIME_SCOPE = "all-time";

    private final PointsStore store;
    private final RankingStructure rankingStructure;
    private final RedisRepository redisRepository;
    private final LeaderboardFacade leaderboardFacade;
    private final PointsProperties properties;

    @Autowired
    public LeaderboardQueryService(
            PointsStore store,
            RankingStructure rankingStructure,
            RedisRepository redisRepository,
            LeaderboardFacade leaderboardFacade,
            PointsProperties properties) {
        this.store = store;
        this.rankingStructure = rankingStructure;
        this.redisRepository = redisRepository;
        this.leaderboardFacade = leaderboardFacade;
        this.properties = properties;
    }

    /**
     * Epoch number that {@code scope} reads from; 0 for all-time.
     */
    public long resolveEpoch(String scope) {
        if (scope == null || scope.trim().isEmpty()) {
            throw new InvalidRequestException("Scope cannot be null or empty");
        }
        String normalized = scope.trim().toLowerCase();
        if (GLOBAL_SCOPE.equals(normalized)) {
            long current = currentEpochNumber();
            if (current == 0) {
                throw new LeaderboardNotFoundException("No epoch has started yet");
            }
            return current;
        }
        if (ALL_TIME_SCOPE.equals(normalized)) {
            return RankingStructure.ALL_TIME_SCOPE;
        }

        long epochNumber;
        try {
            epochNumber = Long.parseLong(normalized);
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Unknown leaderboard scope: " + scope, e);
        }
        if (epochNumber <= 0 || store.findEpoch(epochNumber).isEmpty()) {
            throw new LeaderboardNotFoundException("Leaderboard not found for epoch: " + scope);
        }
        return epochNumber;
    }

    public List<RankedUser> getTopN(String scope, int limit) {
        validateLimit(limit);
        long epochNumber = resolveEpoch(scope);

        if (isGlobal(scope)) {
            List<RankedUser> result = tryGetTopNFromRedis(limit);
            if (result != null) {
                return result;
            }
            return topFromStore(TopK.GLOBAL_KEY, limit);
        }
        return topFromStore(TopK.key(epochNumber), limit);
    }

    public long getTotalUsers(String scope) {
        long epochNumber = resolveEpoch(scope);
        String key = isGlobal(scope) ? LeaderboardTotals.GLOBAL_KEY : LeaderboardTotals.key(epochNumber);
        return store.findTotals(key)
            .filter(totals -> totals.getEpochNumber() == epochNumber)
            .map(LeaderboardTotals::getTotalUsers)
            .orElse(0);
    }

    public List<ScoreBucket> getBuckets(String scope) {
        long epochNumber = resolveEpoch(scope);
        if (isGlobal(scope)) {
            return rankingStructure.buckets(epochNumber, true).stream()
                .filter(bucket -> bucket.getEpochNumber() == epochNumber)
                .toList();
        }
        return rankingStructure.buckets(epochNumber, false);
    }

    /**
     * Rank of {@code userId} in {@code scope}. The global mirror ranks exactly like the epoch it
     * mirrors, so global lookups are answered from that epoch.
     */
    public UserRanking getUserRank(String scope, String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidRequestException("User ID cannot be null or empty");
        }
        String user = userId.trim().toLowerCase();
        long epochNumber = resolveEpoch(scope);

        Optional<UserIndex> userIndex = store.findUserIndex(UserIndex.key(user, epochNumber));
        OptionalLong rank = rankingStructure.estimateRank(epochNumber, user);
        boolean exact = rankingStructure.topEntries(TopK.key(epochNumber)).stream()
            .anyMatch(entry -> entry.getUserId().equals(user));

        return UserRanking.builder()
            .userId(user)
            .epochNumber(epochNumber)
            .points(userIndex.map(UserIndex::getPoints).orElse(0.0))
            .bucketIndex(userIndex.map(UserIndex::getBucketIndex).orElse(UserIndex.NO_BUCKET))
            .rank(rank.isPresent() ? rank.getAsLong() : null)
            .exact(exact)
            .build();
    }

    public long currentEpochNumber() {
        return store.findState()
            .filter(LeaderboardState::hasEpoch)
            .map(LeaderboardState::getCurrentEpochNumber)
            .orElse(0L);
    }

    public Optional<UserEpochStats> getCurrentEpochStats(String userId) {
        long epochNumber = currentEpochNumber();
        if (epochNumber == 0) {
            return Optional.empty();
        }
        return store.findUserEpochStats(normalizeUser(userId), epochNumber);
    }

    public Optional<UserLeaderboardState> getUserState(String userId) {
        return store.findUserState(normalizeUser(userId));
    }

    private static String normalizeUser(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidRequestException("User ID cannot be null or empty");
        }
        return userId.trim().toLowerCase();
    }

    private static boolean isGlobal(String scope) {
        return GLOBAL_SCOPE.equalsIgnoreCase(scope.trim());
    }

    private static void validateLimit(int limit) {
        if (limit <= 0) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }
        if (limit > RankingStructure.MAX_TOP_K) {
            throw new InvalidRequestException("Limit cannot exceed " + RankingStructure.MAX_TOP_K);
        }
    }

    private List<RankedUser> tryGetTopNFromRedis(int limit) {
        if (!properties.getMirror().isRedisEnabled() || leaderboardFacade.isMirrorDirty()) {
            return null;
        }
        if (!redisRepository.isAvailable()) {
            return null;
        }

        try {
            List<RankedUser> topN = redisRepository.getTopN(LeaderboardFacade.GLOBAL_MIRROR_ID, limit);
            logger.debug("Retrieved top {} users from Redis - found {} users", limit, topN.size());
            return topN;
        } catch (Exception e) {
            logger.warn("Failed to retrieve from Redis, falling back to the store", e);
            return null;
        }
    }

    private List<RankedUser> topFromStore(String topKKey, int limit) {
        List<RankedUser> rankedUsers = rankingStructure.topEntries(topKKey).stream()
            .limit(limit)
            .map(LeaderboardQueryService::toRankedUser)
            .toList();
        logger.debug("Retrieved {} users from {} (requested limit: {})", rankedUsers.size(), topKKey, limit);
        return rankedUsers;
    }

    private static RankedUser toRankedUser(TopKEntry entry) {
        return RankedUser.builder()
            .userId(entry.getUserId())
            .rank(entry.getRank())
            .points(entry.getPoints())
            .build();
    }
}
