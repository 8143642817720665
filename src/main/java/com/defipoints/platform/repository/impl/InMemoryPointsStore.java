package com.defipoints.platform.repository.impl;

import com.defipoints.platform.model.AuditRecord;
import com.defipoints.platform.model.BlacklistEntry;
import com.defipoints.platform.model.EpochEndIndexSnapshot;
import com.defipoints.platform.model.LeaderboardConfig;
import com.defipoints.platform.model.LeaderboardEpoch;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.model.LeaderboardTotals;
import com.defipoints.platform.model.LpPosition;
import com.defipoints.platform.model.NftMultiplierConfig;
import com.defipoints.platform.model.NftPartnership;
import com.defipoints.platform.model.Reserve;
import com.defipoints.platform.model.ScoreBucket;
import com.defipoints.platform.model.TopK;
import com.defipoints.platform.model.TopKEntry;
import com.defipoints.platform.model.UserDailyActivity;
import com.defipoints.platform.model.UserEpochStats;
import com.defipoints.platform.model.UserIndex;
import com.defipoints.platform.model.UserLeaderboardState;
import com.defipoints.platform.model.UserNftOwnership;
import com.defipoints.platform.model.UserReserve;
import com.defipoints.platform.model.UserReserveList;
import com.defipoints.platform.model.UserReservePoints;
import com.defipoints.platform.model.VotingLock;
import com.defipoints.platform.model.VotingPowerTier;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.repository.StoreSnapshot;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store. Entities are held by reference, so a read after a save observes the write.
 */
@Repository
public class InMemoryPointsStore implements PointsStore {

    private final Map<String, LeaderboardState> states = new ConcurrentHashMap<>();
    private final Map<String, LeaderboardConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, NftMultiplierConfig> nftMultiplierConfigs = new ConcurrentHashMap<>();
    private final Map<String, LeaderboardEpoch> epochs = new ConcurrentHashMap<>();
    private final Map<String, Reserve> reserves = new ConcurrentHashMap<>();
    private final Map<String, UserReserve> userReserves = new ConcurrentHashMap<>();
    private final Map<String, UserReserveList> userReserveLists = new ConcurrentHashMap<>();
    private final Map<String, UserReservePoints> userReservePoints = new ConcurrentHashMap<>();
    private final Map<String, EpochEndIndexSnapshot> epochEndSnapshots = new ConcurrentHashMap<>();
    private final Map<String, UserEpochStats> userEpochStats = new ConcurrentHashMap<>();
    private final Map<String, UserDailyActivity> dailyActivities = new ConcurrentHashMap<>();
    private final Map<String, UserLeaderboardState> userStates = new ConcurrentHashMap<>();
    private final Map<String, UserIndex> userIndexes = new ConcurrentHashMap<>();
    private final Map<String, ScoreBucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, TopK> topKs = new ConcurrentHashMap<>();
    private final Map<String, TopKEntry> topKEntries = new ConcurrentHashMap<>();
    private final Map<String, LeaderboardTotals> totals = new ConcurrentHashMap<>();
    private final Map<String, VotingPowerTier> votingPowerTiers = new ConcurrentHashMap<>();
    private final Map<String, NftPartnership> nftPartnerships = new ConcurrentHashMap<>();
    private final Map<String, UserNftOwnership> nftOwnerships = new ConcurrentHashMap<>();
    private final Map<String, VotingLock> votingLocks = new ConcurrentHashMap<>();
    private final Map<String, LpPosition> lpPositions = new ConcurrentHashMap<>();
    private final Map<String, BlacklistEntry> blacklist = new ConcurrentHashMap<>();
    private final Map<String, AuditRecord> auditRecords = new ConcurrentHashMap<>();

    @Override
    public Optional<LeaderboardState> findState() {
        return Optional.ofNullable(states.get(LeaderboardState.KEY));
    }

    @Override
    public void saveState(LeaderboardState state) {
        states.put(LeaderboardState.KEY, state);
    }

    @Override
    public Optional<LeaderboardEpoch> findEpoch(long epochNumber) {
        return Optional.ofNullable(epochs.get(LeaderboardEpoch.key(epochNumber)));
    }

    @Override
    public void saveEpoch(LeaderboardEpoch epoch) {
        epochs.put(LeaderboardEpoch.key(epoch.getEpochNumber()), epoch);
    }

    @Override
    public Optional<LeaderboardConfig> findConfig() {
        return Optional.ofNullable(configs.get(LeaderboardConfig.KEY));
    }

    @Override
    public void saveConfig(LeaderboardConfig config) {
        configs.put(LeaderboardConfig.KEY, config);
    }

    @Override
    public Optional<Reserve> findReserve(String reserveId) {
        return Optional.ofNullable(reserves.get(reserveId));
    }

    @Override
    public List<Reserve> findAllReserves() {
        return new ArrayList<>(reserves.values());
    }

    @Override
    public void saveReserve(Reserve reserve) {
        reserves.put(reserve.getId(), reserve);
    }

    @Override
    public Optional<UserReserve> findUserReserve(String userId, String reserveId) {
        return Optional.ofNullable(userReserves.get(UserReserve.key(userId, reserveId)));
    }

    @Override
    public void saveUserReserve(UserReserve userReserve) {
        userReserves.put(UserReserve.key(userReserve.getUserId(), userReserve.getReserveId()), userReserve);
    }

    @Override
    public Optional<UserReserveList> findUserReserveList(String userId) {
        return Optional.ofNullable(userReserveLists.get(userId));
    }

    @Override
    public void saveUserReserveList(UserReserveList list) {
        userReserveLists.put(list.getUserId(), list);
    }

    @Override
    public Optional<UserReservePoints> findUserReservePoints(String userId, String reserveId) {
        return Optional.ofNullable(userReservePoints.get(UserReservePoints.key(userId, reserveId)));
    }

    @Override
    public void saveUserReservePoints(UserReservePoints points) {
        userReservePoints.put(UserReservePoints.key(points.getUserId(), points.getReserveId()), points);
    }

    @Override
    public Optional<EpochEndIndexSnapshot> findEpochEndSnapshot(long epochNumber, String reserveId) {
        return Optional.ofNullable(epochEndSnapshots.get(EpochEndIndexSnapshot.key(epochNumber, reserveId)));
    }

    @Override
    public void saveEpochEndSnapshot(EpochEndIndexSnapshot snapshot) {
        epochEndSnapshots.put(EpochEndIndexSnapshot.key(snapshot.getEpochNumber(), snapshot.getReserveId()), snapshot);
    }

    @Override
    public Optional<UserEpochStats> findUserEpochStats(String userId, long epochNumber) {
        return Optional.ofNullable(userEpochStats.get(UserEpochStats.key(userId, epochNumber)));
    }

    @Override
    public void saveUserEpochStats(UserEpochStats stats) {
        userEpochStats.put(UserEpochStats.key(stats.getUserId(), stats.getEpochNumber()), stats);
    }

    @Override
    public Optional<UserDailyActivity> findDailyActivity(String userId, long epochNumber, long day) {
        return Optional.ofNullable(dailyActivities.get(UserDailyActivity.key(userId, epochNumber, day)));
    }

    @Override
    public void saveDailyActivity(UserDailyActivity activity) {
        dailyActivities.put(
            UserDailyActivity.key(activity.getUserId(), activity.getEpochNumber(), activity.getDay()), activity);
    }

    @Override
    public Optional<UserLeaderboardState> findUserState(String userId) {
        return Optional.ofNullable(userStates.get(userId));
    }

    @Override
    public void saveUserState(UserLeaderboardState state) {
        userStates.put(state.getUserId(), state);
    }

    @Override
    public Optional<UserIndex> findUserIndex(String key) {
        return Optional.ofNullable(userIndexes.get(key));
    }

    @Override
    public void saveUserIndex(UserIndex userIndex) {
        userIndexes.put(userIndex.getId(), userIndex);
    }

    @Override
    public void deleteUserIndex(String key) {
        userIndexes.remove(key);
    }

    @Override
    public Optional<ScoreBucket> findBucket(String key) {
        return Optional.ofNullable(buckets.get(key));
    }

    @Override
    public void saveBucket(ScoreBucket bucket) {
        buckets.put(bucket.getId(), bucket);
    }

    @Override
    public Optional<TopK> findTopK(String key) {
        return Optional.ofNullable(topKs.get(key));
    }

    @Override
    public void saveTopK(TopK topK) {
        topKs.put(topK.getId(), topK);
    }

    @Override
    public Optional<TopKEntry> findTopKEntry(String key) {
        return Optional.ofNullable(topKEntries.get(key));
    }

    @Override
    public void saveTopKEntry(TopKEntry entry) {
        topKEntries.put(entry.getId(), entry);
    }

    @Override
    public void deleteTopKEntry(String key) {
        topKEntries.remove(key);
    }

    @Override
    public Optional<LeaderboardTotals> findTotals(String key) {
        return Optional.ofNullable(totals.get(key));
    }

    @Override
    public void saveTotals(LeaderboardTotals leaderboardTotals) {
        totals.put(leaderboardTotals.getId(), leaderboardTotals);
    }

    @Override
    public Optional<VotingPowerTier> findVotingPowerTier(int tierIndex) {
        return Optional.ofNullable(votingPowerTiers.get(VotingPowerTier.key(tierIndex)));
    }

    @Override
    public List<VotingPowerTier> findAllVotingPowerTiers() {
        return new ArrayList<>(votingPowerTiers.values());
    }

    @Override
    public void saveVotingPowerTier(VotingPowerTier tier) {
        votingPowerTiers.put(VotingPowerTier.key(tier.getTierIndex()), tier);
    }

    @Override
    public Optional<NftPartnership> findNftPartnership(String collection) {
        return Optional.ofNullable(nftPartnerships.get(collection));
    }

    @Override
    public List<NftPartnership> findAllNftPartnerships() {
        return new ArrayList<>(nftPartnerships.values());
    }

    @Override
    public void saveNftPartnership(NftPartnership partnership) {
        nftPartnerships.put(partnership.getCollection(), partnership);
    }

    @Override
    public Optional<NftMultiplierConfig> findNftMultiplierConfig() {
        return Optional.ofNullable(nftMultiplierConfigs.get(NftMultiplierConfig.KEY));
    }

    @Override
    public void saveNftMultiplierConfig(NftMultiplierConfig config) {
        nftMultiplierConfigs.put(NftMultiplierConfig.KEY, config);
    }

    @Override
    public Optional<UserNftOwnership> findNftOwnership(String userId, String collection) {
        return Optional.ofNullable(nftOwnerships.get(UserNftOwnership.key(userId, collection)));
    }

    @Override
    public void saveNftOwnership(UserNftOwnership ownership) {
        nftOwnerships.put(UserNftOwnership.key(ownership.getUserId(), ownership.getCollection()), ownership);
    }

    @Override
    public Optional<VotingLock> findVotingLock(String tokenId) {
        return Optional.ofNullable(votingLocks.get(tokenId));
    }

    @Override
    public void saveVotingLock(VotingLock lock) {
        votingLocks.put(lock.getTokenId(), lock);
    }

    @Override
    public Optional<LpPosition> findLpPosition(String positionId) {
        return Optional.ofNullable(lpPositions.get(positionId));
    }

    @Override
    public List<LpPosition> findAllLpPositions() {
        return new ArrayList<>(lpPositions.values());
    }

    @Override
    public void saveLpPosition(LpPosition position) {
        lpPositions.put(position.getPositionId(), position);
    }

    @Override
    public Optional<BlacklistEntry> findBlacklistEntry(String userId) {
        return Optional.ofNullable(blacklist.get(userId));
    }

    @Override
    public void saveBlacklistEntry(BlacklistEntry entry) {
        blacklist.put(entry.getUserId(), entry);
    }

    @Override
    public Optional<AuditRecord> findAuditRecord(String id) {
        return Optional.ofNullable(auditRecords.get(id));
    }

    @Override
    public void saveAuditRecord(AuditRecord record) {
        auditRecords.put(record.getId(), record);
    }

    /**
     * Copies every map into a snapshot. Callers must hold the event processing lock.
     */
    public StoreSnapshot exportSnapshot() {
        StoreSnapshot snapshot = new StoreSnapshot();
        snapshot.setState(states.get(LeaderboardState.KEY));
        snapshot.setConfig(configs.get(LeaderboardConfig.KEY));
        snapshot.setNftMultiplierConfig(nftMultiplierConfigs.get(NftMultiplierConfig.KEY));
        snapshot.setEpochs(new HashMap<>(epochs));
        snapshot.setReserves(new HashMap<>(reserves));
        snapshot.setUserReserves(new HashMap<>(userReserves));
        snapshot.setUserReserveLists(new HashMap<>(userReserveLists));
        snapshot.setUserReservePoints(new HashMap<>(userReservePoints));
        snapshot.setEpochEndSnapshots(new HashMap<>(epochEndSnapshots));
        snapshot.setUserEpochStats(new HashMap<>(userEpochStats));
        snapshot.setDailyActivities(new HashMap<>(dailyActivities));
        snapshot.setUserStates(new HashMap<>(userStates));
        snapshot.setUserIndexes(new HashMap<>(userIndexes));
        snapshot.setBuckets(new HashMap<>(buckets));
        snapshot.setTopKs(new HashMap<>(topKs));
        snapshot.setTopKEntries(new HashMap<>(topKEntries));
        snapshot.setTotals(new HashMap<>(totals));
        snapshot.setVotingPowerTiers(new HashMap<>(votingPowerTiers));
        snapshot.setNftPartnerships(new HashMap<>(nftPartnerships));
        snapshot.setNftOwnerships(new HashMap<>(nftOwnerships));
        snapshot.setVotingLocks(new HashMap<>(votingLocks));
        snapshot.setLpPositions(new HashMap<>(lpPositions));
        snapshot.setBlacklist(new HashMap<>(blacklist));
        snapshot.setAuditRecords(new HashMap<>(auditRecords));
        return snapshot;
    }

    /**
     * Replaces the current contents with {@code snapshot}.
     */
    public void importSnapshot(StoreSnapshot snapshot) {
        replaceSingleton(states, LeaderboardState.KEY, snapshot.getState());
        replaceSingleton(configs, LeaderboardConfig.KEY, snapshot.getConfig());
        replaceSingleton(nftMultiplierConfigs, NftMultiplierConfig.KEY, snapshot.getNftMultiplierConfig());
        replace(epochs, snapshot.getEpochs());
        replace(reserves, snapshot.getReserves());
        replace(userReserves, snapshot.getUserReserves());
        replace(userReserveLists, snapshot.getUserReserveLists());
        replace(userReservePoints, snapshot.getUserReservePoints());
        replace(epochEndSnapshots, snapshot.getEpochEndSnapshots());
        replace(userEpochStats, snapshot.getUserEpochStats());
        replace(dailyActivities, snapshot.getDailyActivities());
        replace(userStates, snapshot.getUserStates());
        replace(userIndexes, snapshot.getUserIndexes());
        replace(buckets, snapshot.getBuckets());
        replace(topKs, snapshot.getTopKs());
        replace(topKEntries, snapshot.getTopKEntries());
        replace(totals, snapshot.getTotals());
        replace(votingPowerTiers, snapshot.getVotingPowerTiers());
        replace(nftPartnerships, snapshot.getNftPartnerships());
        replace(nftOwnerships, snapshot.getNftOwnerships());
        replace(votingLocks, snapshot.getVotingLocks());
        replace(lpPositions, snapshot.getLpPositions());
        replace(blacklist, snapshot.getBlacklist());
        replace(auditRecords, snapshot.getAuditRecords());
    }

    private static <T> void replace(Map<String, T> target, Map<String, T> source) {
        target.clear();
        if (source != null) {
            target.putAll(source);
        }
    }

    private static <T> void replaceSingleton(Map<String, T> target, String key, T value) {
        target.clear();
        if (value != null) {
            target.put(key, value);
        }
    }
}
