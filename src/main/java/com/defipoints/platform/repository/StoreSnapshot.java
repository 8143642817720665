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
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Serializable image of the whole store, keyed exactly as the store keys its entities.
 */
@Data
@NoArgsConstructor
public class StoreSnapshot {
    private LeaderboardState state;
    private LeaderboardConfig config;
    private NftMultiplierConfig nftMultiplierConfig;
    private Map<String, LeaderboardEpoch> epochs = new HashMap<>();
    private Map<String, Reserve> reserves = new HashMap<>();
    private Map<String, UserReserve> userReserves = new HashMap<>();
    private Map<String, UserReserveList> userReserveLists = new HashMap<>();
    private Map<String, UserReservePoints> userReservePoints = new HashMap<>();
    private Map<String, EpochEndIndexSnapshot> epochEndSnapshots = new HashMap<>();
    private Map<String, UserEpochStats> userEpochStats = new HashMap<>();
    private Map<String, UserDailyActivity> dailyActivities = new HashMap<>();
    private Map<String, UserLeaderboardState> userStates = new HashMap<>();
    private Map<String, UserIndex> userIndexes = new HashMap<>();
    private Map<String, ScoreBucket> buckets = new HashMap<>();
    private Map<String, TopK> topKs = new HashMap<>();
    private Map<String, TopKEntry> topKEntries = new HashMap<>();
    private Map<String, LeaderboardTotals> totals = new HashMap<>();
    private Map<String, VotingPowerTier> votingPowerTiers = new HashMap<>();
    private Map<String, NftPartnership> nftPartnerships = new HashMap<>();
    private Map<String, UserNftOwnership> nftOwnerships = new HashMap<>();
    private Map<String, VotingLock> votingLocks = new HashMap<>();
    private Map<String, LpPosition> lpPositions = new HashMap<>();
    private Map<String, BlacklistEntry> blacklist = new HashMap<>();
    private Map<String, AuditRecord> auditRecords = new HashMap<>();
}
