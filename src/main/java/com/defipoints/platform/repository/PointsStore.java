package com.defipoints.platform.repository;

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

import java.util.List;
import java.util.Optional;

/**
 * Keyed entity store backing every points and ranking computation.
 * Implementations must offer read-your-writes consistency.
 */
public interface PointsStore {
    Optional<LeaderboardState> findState();
    void saveState(LeaderboardState state);

    Optional<LeaderboardEpoch> findEpoch(long epochNumber);
    void saveEpoch(LeaderboardEpoch epoch);

    Optional<LeaderboardConfig> findConfig();
    void saveConfig(LeaderboardConfig config);

    Optional<Reserve> findReserve(String reserveId);
    List<Reserve> findAllReserves();
    void saveReserve(Reserve reserve);

    Optional<UserReserve> findUserReserve(String userId, String reserveId);
    void saveUserReserve(UserReserve userReserve);

    Optional<UserReserveList> findUserReserveList(String userId);
    void saveUserReserveList(UserReserveList list);

    Optional<UserReservePoints> findUserReservePoints(String userId, String reserveId);
    void saveUserReservePoints(UserReservePoints points);

    Optional<EpochEndIndexSnapshot> findEpochEndSnapshot(long epochNumber, String reserveId);
    void saveEpochEndSnapshot(EpochEndIndexSnapshot snapshot);

    Optional<UserEpochStats> findUserEpochStats(String userId, long epochNumber);
    void saveUserEpochStats(UserEpochStats stats);

    Optional<UserDailyActivity> findDailyActivity(String userId, long epochNumber, long day);
    void saveDailyActivity(UserDailyActivity activity);

    Optional<UserLeaderboardState> findUserState(String userId);
    void saveUserState(UserLeaderboardState state);

    Optional<UserIndex> findUserIndex(String key);
    void saveUserIndex(UserIndex userIndex);
    void deleteUserIndex(String key);

    Optional<ScoreBucket> findBucket(String key);
    void saveBucket(ScoreBucket bucket);

    Optional<TopK> findTopK(String key);
    void saveTopK(TopK topK);

    Optional<TopKEntry> findTopKEntry(String key);
    void saveTopKEntry(TopKEntry entry);
    void deleteTopKEntry(String key);

    Optional<LeaderboardTotals> findTotals(String key);
    void saveTotals(LeaderboardTotals totals);

    Optional<VotingPowerTier> findVotingPowerTier(int tierIndex);
    List<VotingPowerTier> findAllVotingPowerTiers();
    void saveVotingPowerTier(VotingPowerTier tier);

    Optional<NftPartnership> findNftPartnership(String collection);
    List<NftPartnership> findAllNftPartnerships();
    void saveNftPartnership(NftPartnership partnership);

    Optional<NftMultiplierConfig> findNftMultiplierConfig();
    void saveNftMultiplierConfig(NftMultiplierConfig config);

    Optional<UserNftOwnership> findNftOwnership(String userId, String collection);
    void saveNftOwnership(UserNftOwnership ownership);

    Optional<VotingLock> findVotingLock(String tokenId);
    void saveVotingLock(VotingLock lock);

    Optional<LpPosition> findLpPosition(String positionId);
    List<LpPosition> findAllLpPositions();
    void saveLpPosition(LpPosition position);

    Optional<BlacklistEntry> findBlacklistEntry(String userId);
    void saveBlacklistEntry(BlacklistEntry entry);

    Optional<AuditRecord> findAuditRecord(String id);
    void saveAuditRecord(AuditRecord record);
}
