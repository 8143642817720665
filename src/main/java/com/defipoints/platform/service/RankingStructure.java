package com.defipoints.platform.service;

import com.defipoints.platform.model.LeaderboardTotals;
import com.defipoints.platform.model.ScoreBucket;
import com.defipoints.platform.model.TopK;
import com.defipoints.platform.model.TopKEntry;
import com.defipoints.platform.model.UserIndex;
import com.defipoints.platform.repository.PointsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Per-scope leaderboard: an exact TopK head plus a histogram of score buckets. Scope 0 is the
 * all-time leaderboard; any other scope is an epoch. The epoch in force is additionally mirrored
 * under the {@code global} keys.
 */
@Component
public class RankingStructure {

    private static final Logger logger = LoggerFactory.getLogger(RankingStructure.class);

    public static final int MAX_TOP_K = 100;
    public static final int MAX_BUCKETS = 120;
    public static final long ALL_TIME_SCOPE = 0L;

    private static final int MAX_COUNT = Integer.MAX_VALUE;

    static final Comparator<TopKEntry> RANKING_ORDER = Comparator
        .comparingDouble(TopKEntry::getPoints).reversed()
        .thenComparing(TopKEntry::getUserId);

    private final PointsStore store;

    @Autowired
    public RankingStructure(PointsStore store) {
        this.store = store;
    }

    /**
     * Linear head {@code [0,0.1) [0.1,0.5) [0.5,1)} followed by doubling bands from {@code [1,2)},
     * capped at the last bucket.
     */
    public static int bucketIndexFor(double points) {
        if (!(points >= 0.1)) {
            return 0;
        }
        if (points < 0.5) {
            return 1;
        }
        if (points < 1) {
            return 2;
        }
        int index = 3;
        double bound = 1;
        while (index < MAX_BUCKETS - 1 && points >= bound * 2) {
            bound *= 2;
            index++;
        }
        return index;
    }

    public static double[] bucketBounds(int index) {
        if (index == 0) {
            return new double[]{0, 0.1};
        }
        if (index == 1) {
            return new double[]{0.1, 0.5};
        }
        if (index == 2) {
            return new double[]{0.5, 1};
        }
        double lower = Math.pow(2, index - 3);
        return new double[]{lower, lower * 2};
    }

    /**
     * Records {@code points} for the user in {@code scope}. Returns whether the TopK head changed.
     */
    public boolean upsert(long scope, String userId, double points, long timestamp, boolean syncGlobal) {
        double newPoints = normalize(points);
        String indexKey = UserIndex.key(userId, scope);
        Optional<UserIndex> existing = store.findUserIndex(indexKey);
        int oldBucket = existing.map(UserIndex::getBucketIndex).orElse(UserIndex.NO_BUCKET);
        boolean hadPoints = oldBucket >= 0;

        UserIndex userIndex = existing.orElseGet(() -> UserIndex.builder()
            .id(indexKey)
            .userId(userId)
            .epochNumber(scope)
            .bucketIndex(UserIndex.NO_BUCKET)
            .build());

        if (newPoints == 0) {
            if (hadPoints) {
                adjustBucket(scope, oldBucket, -1, timestamp, syncGlobal);
                adjustTotals(scope, -1, timestamp, syncGlobal);
            }
            userIndex.setPoints(0);
            userIndex.setBucketIndex(UserIndex.NO_BUCKET);
            userIndex.setUpdatedAt(timestamp);
            store.saveUserIndex(userIndex);
            if (syncGlobal) {
                saveGlobalIndex(scope, userId, 0, UserIndex.NO_BUCKET, timestamp);
            }
            logger.debug("User {} dropped to zero in scope {}", userId, scope);
            return removeFromTopK(scope, userId, timestamp, syncGlobal);
        }

        int newBucket = bucketIndexFor(newPoints);
        if (oldBucket != newBucket) {
            if (hadPoints) {
                adjustBucket(scope, oldBucket, -1, timestamp, syncGlobal);
            }
            adjustBucket(scope, newBucket, 1, timestamp, syncGlobal);
        }
        if (!hadPoints) {
            adjustTotals(scope, 1, timestamp, syncGlobal);
        }

        userIndex.setPoints(newPoints);
        userIndex.setBucketIndex(newBucket);
        userIndex.setUpdatedAt(timestamp);
        store.saveUserIndex(userIndex);

        if (syncGlobal) {
            saveGlobalIndex(scope, userId, newPoints, newBucket, timestamp);
        }

        return upsertTopK(scope, userId, newPoints, timestamp, syncGlobal);
    }

    /**
     * Tears the user out of the bucket, TopK and totals of {@code scope} and deletes its index.
     */
    public boolean remove(long scope, String userId, long timestamp, boolean syncGlobal) {
        String indexKey = UserIndex.key(userId, scope);
        Optional<UserIndex> existing = store.findUserIndex(indexKey);
        if (existing.isPresent()) {
            UserIndex userIndex = existing.get();
            if (userIndex.isRanked()) {
                adjustBucket(scope, userIndex.getBucketIndex(), -1, timestamp, syncGlobal);
                adjustTotals(scope, -1, timestamp, syncGlobal);
            }
            store.deleteUserIndex(indexKey);
        }
        if (syncGlobal) {
            store.deleteUserIndex(userId);
        }
        return removeFromTopK(scope, userId, timestamp, syncGlobal);
    }

    /**
     * Empties the global mirror when a new epoch takes over. Global user indexes keep the epoch
     * they were written for and are ignored by readers once stale.
     */
    public void resetGlobalMirror(long scope, long timestamp) {
        store.findTopK(TopK.GLOBAL_KEY).ifPresent(global -> {
            global.getEntries().forEach(store::deleteTopKEntry);
            global.setEntries(new ArrayList<>());
            global.setEpochNumber(scope);
            global.setUpdatedAt(timestamp);
            store.saveTopK(global);
        });
        for (int i = 0; i < MAX_BUCKETS; i++) {
            store.findBucket(ScoreBucket.globalKey(i)).ifPresent(bucket -> {
                bucket.setCount(0);
                bucket.setEpochNumber(scope);
                bucket.setUpdatedAt(timestamp);
                store.saveBucket(bucket);
            });
        }
        store.findTotals(LeaderboardTotals.GLOBAL_KEY).ifPresent(totals -> {
            totals.setTotalUsers(0);
            totals.setEpochNumber(scope);
            totals.setUpdatedAt(timestamp);
            store.saveTotals(totals);
        });
    }

    public List<TopKEntry> topEntries(String topKKey) {
        return store.findTopK(topKKey)
            .map(topK -> topK.getEntries().stream()
                .map(store::findTopKEntry)
                .flatMap(Optional::stream)
                .toList())
            .orElse(List.of());
    }

    /**
     * Non-empty buckets of {@code scope}, or of the global mirror when {@code global} is set.
     */
    public List<ScoreBucket> buckets(long scope, boolean global) {
        List<ScoreBucket> result = new ArrayList<>();
        for (int i = 0; i < MAX_BUCKETS; i++) {
            String key = global ? ScoreBucket.globalKey(i) : ScoreBucket.key(scope, i);
            store.findBucket(key)
                .filter(bucket -> bucket.getCount() > 0)
                .ifPresent(result::add);
        }
        return result;
    }

    /**
     * Exact rank for TopK members, otherwise {@code 1 + |TopK| + users in higher buckets that are
     * not in the TopK}. Empty when the user has no positive score in the scope.
     */
    public OptionalLong estimateRank(long scope, String userId) {
        Optional<UserIndex> userIndex = store.findUserIndex(UserIndex.key(userId, scope))
            .filter(UserIndex::isRanked);
        if (userIndex.isEmpty()) {
            return OptionalLong.empty();
        }

        List<TopKEntry> head = topEntries(TopK.key(scope));
        for (TopKEntry entry : head) {
            if (entry.getUserId().equals(userId)) {
                return OptionalLong.of(entry.getRank());
            }
        }

        int bucket = userIndex.get().getBucketIndex();
        long higher = 0;
        for (int i = bucket + 1; i < MAX_BUCKETS; i++) {
            higher += store.findBucket(ScoreBucket.key(scope, i)).map(ScoreBucket::getCount).orElse(0);
        }
        long headInHigherBuckets = head.stream()
            .filter(entry -> bucketIndexFor(entry.getPoints()) > bucket)
            .count();
        return OptionalLong.of(1 + head.size() + Math.max(0, higher - headInHigherBuckets));
    }

    private void saveGlobalIndex(long scope, String userId, double points, int bucketIndex, long timestamp) {
        store.saveUserIndex(UserIndex.builder()
            .id(userId)
            .userId(userId)
            .epochNumber(scope)
            .points(points)
            .bucketIndex(bucketIndex)
            .updatedAt(timestamp)
            .build());
    }

    private boolean upsertTopK(long scope, String userId, double points, long timestamp, boolean syncGlobal) {
        TopK topK = getOrInitTopK(TopK.key(scope), scope);
        Map<String, TopKEntry> byUser = loadEntries(topK);
        List<String> previousIds = new ArrayList<>(topK.getEntries());

        byUser.put(userId, TopKEntry.builder()
            .id(TopKEntry.key(scope, userId))
            .epochNumber(scope)
            .userId(userId)
            .points(points)
            .build());

        List<TopKEntry> head = rankAndTruncate(byUser);
        writeTopK(topK, head, timestamp);
        if (syncGlobal) {
            syncGlobalTopK(scope, head, timestamp);
        }
        return !previousIds.equals(topK.getEntries()) || topK.getEntries().contains(TopKEntry.key(scope, userId));
    }

    private boolean removeFromTopK(long scope, String userId, long timestamp, boolean syncGlobal) {
        Optional<TopK> stored = store.findTopK(TopK.key(scope));
        if (stored.isEmpty() || stored.get().getEntries().isEmpty()) {
            return false;
        }
        TopK topK = stored.get();
        Map<String, TopKEntry> byUser = loadEntries(topK);
        if (byUser.remove(userId) == null) {
            return false;
        }

        List<TopKEntry> head = rankAndTruncate(byUser);
        writeTopK(topK, head, timestamp);
        if (syncGlobal) {
            syncGlobalTopK(scope, head, timestamp);
        }
        return true;
    }

    private Map<String, TopKEntry> loadEntries(TopK topK) {
        Map<String, TopKEntry> byUser = new LinkedHashMap<>();
        for (String entryId : topK.getEntries()) {
            store.findTopKEntry(entryId).ifPresent(entry -> byUser.put(entry.getUserId(),
                entry.toBuilder().points(normalize(entry.getPoints())).build()));
        }
        return byUser;
    }

    private static List<TopKEntry> rankAndTruncate(Map<String, TopKEntry> byUser) {
        List<TopKEntry> sorted = new ArrayList<>(byUser.values());
        sorted.sort(RANKING_ORDER);
        List<TopKEntry> head = new ArrayList<>(sorted.subList(0, Math.min(MAX_TOP_K, sorted.size())));
        for (int i = 0; i < head.size(); i++) {
            head.get(i).setRank(i + 1);
        }
        return head;
    }

    private void writeTopK(TopK topK, List<TopKEntry> head, long timestamp) {
        List<String> nextIds = new ArrayList<>();
        for (TopKEntry entry : head) {
            nextIds.add(entry.getId());
            store.saveTopKEntry(entry);
        }
        for (String entryId : topK.getEntries()) {
            if (!nextIds.contains(entryId)) {
                store.deleteTopKEntry(entryId);
            }
        }
        topK.setEntries(nextIds);
        topK.setUpdatedAt(timestamp);
        store.saveTopK(topK);
    }

    private void syncGlobalTopK(long scope, List<TopKEntry> head, long timestamp) {
        List<TopKEntry> mirrored = new ArrayList<>();
        for (TopKEntry entry : head) {
            mirrored.add(entry.toBuilder().id(TopKEntry.globalKey(entry.getUserId())).build());
        }
        TopK global = getOrInitTopK(TopK.GLOBAL_KEY, scope);
        global.setEpochNumber(scope);
        writeTopK(global, mirrored, timestamp);
    }

    private TopK getOrInitTopK(String key, long scope) {
        return store.findTopK(key).orElseGet(() -> {
            TopK topK = TopK.empty(key, scope, MAX_TOP_K);
            store.saveTopK(topK);
            return topK;
        });
    }

    private void adjustBucket(long scope, int index, int delta, long timestamp, boolean syncGlobal) {
        ScoreBucket bucket = getOrInitBucket(ScoreBucket.key(scope, index), scope, index, timestamp);
        bucket.setCount(saturatingAdd(bucket.getCount(), delta));
        bucket.setUpdatedAt(timestamp);
        store.saveBucket(bucket);

        if (syncGlobal) {
            ScoreBucket global = getOrInitBucket(ScoreBucket.globalKey(index), scope, index, timestamp);
            global.setEpochNumber(scope);
            global.setCount(bucket.getCount());
            global.setUpdatedAt(timestamp);
            store.saveBucket(global);
        }
    }

    private ScoreBucket getOrInitBucket(String key, long scope, int index, long timestamp) {
        return store.findBucket(key).orElseGet(() -> {
            double[] bounds = bucketBounds(index);
            return ScoreBucket.builder()
                .id(key)
                .epochNumber(scope)
                .index(index)
                .lower(bounds[0])
                .upper(bounds[1])
                .count(0)
                .updatedAt(timestamp)
                .build();
        });
    }

    private void adjustTotals(long scope, int delta, long timestamp, boolean syncGlobal) {
        String key = LeaderboardTotals.key(scope);
        LeaderboardTotals totals = store.findTotals(key).orElseGet(() -> LeaderboardTotals.builder()
            .id(key)
            .epochNumber(scope)
            .build());
        totals.setTotalUsers(saturatingAdd(totals.getTotalUsers(), delta));
        totals.setUpdatedAt(timestamp);
        store.saveTotals(totals);

        if (syncGlobal) {
            store.saveTotals(LeaderboardTotals.builder()
                .id(LeaderboardTotals.GLOBAL_KEY)
                .epochNumber(scope)
                .totalUsers(totals.getTotalUsers())
                .updatedAt(timestamp)
                .build());
        }
    }

    static int saturatingAdd(int count, int delta) {
        long next = (long) count + delta;
        if (next < 0) {
            return 0;
        }
        return next > MAX_COUNT ? MAX_COUNT : (int) next;
    }

    private static double normalize(double points) {
        if (!Double.isFinite(points) || points < 0) {
            return 0;
        }
        return points;
    }
}
