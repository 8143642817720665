package com.defipoints.platform.service;

import com.defipoints.platform.math.ReserveMath;
import com.defipoints.platform.model.EpochEndIndexSnapshot;
import com.defipoints.platform.model.LeaderboardEpoch;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.model.Reserve;
import com.defipoints.platform.repository.PointsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the scoring epoch lifecycle and the reserve indices frozen at each epoch end.
 */
@Service
public class EpochSettlementCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(EpochSettlementCoordinator.class);

    static final int MAX_SCHEDULED_TRANSITIONS = 5;

    private final PointsStore store;
    private final LeaderboardFacade leaderboardFacade;

    @Autowired
    public EpochSettlementCoordinator(PointsStore store, LeaderboardFacade leaderboardFacade) {
        this.store = store;
        this.leaderboardFacade = leaderboardFacade;
    }

    public LeaderboardState currentState() {
        return store.findState().orElseGet(LeaderboardState::initial);
    }

    /**
     * Epoch the next accrual is attributed to: the active one, or the one that just ended.
     */
    public Optional<LeaderboardEpoch> currentEpoch() {
        LeaderboardState state = currentState();
        if (!state.hasEpoch()) {
            return Optional.empty();
        }
        return store.findEpoch(state.getCurrentEpochNumber());
    }

    /**
     * {@code timestamp} capped at the end of an epoch that has already closed.
     */
    public static long balanceTimestamp(LeaderboardState state, LeaderboardEpoch epoch, long timestamp) {
        if (isPastEnd(state, epoch, timestamp)) {
            return epoch.getEndTime();
        }
        return timestamp;
    }

    public static boolean isPastEnd(LeaderboardState state, LeaderboardEpoch epoch, long timestamp) {
        return !state.isActive() && epoch.getEndTime() != null && epoch.getEndTime() > 0
            && timestamp > epoch.getEndTime();
    }

    /**
     * Frozen indices to value a balance at {@code balanceTimestamp}, only when the reserve has
     * moved past that point and a snapshot exists for exactly that instant.
     */
    public Optional<EpochEndIndexSnapshot> indexOverride(Reserve reserve, long epochNumber, long balanceTimestamp) {
        if (balanceTimestamp >= reserve.getLastUpdateTimestamp()) {
            return Optional.empty();
        }
        return store.findEpochEndSnapshot(epochNumber, reserve.getId())
            .filter(snapshot -> snapshot.getTimestamp() == balanceTimestamp);
    }

    /**
     * Takes the epoch-end snapshot of {@code reserve} if the current epoch has closed, the reserve
     * has not been updated past the end and no snapshot exists yet. Must run before the reserve's
     * new indices are applied.
     */
    public void snapshotIfMissing(Reserve reserve, long timestamp) {
        LeaderboardState state = currentState();
        if (!state.hasEpoch() || state.isActive()) {
            return;
        }
        LeaderboardEpoch epoch = store.findEpoch(state.getCurrentEpochNumber()).orElse(null);
        if (epoch == null || epoch.getEndTime() == null) {
            return;
        }
        long endTime = epoch.getEndTime();
        if (timestamp <= endTime || reserve.getLastUpdateTimestamp() > endTime) {
            return;
        }
        if (store.findEpochEndSnapshot(epoch.getEpochNumber(), reserve.getId()).isPresent()) {
            return;
        }
        snapshotReserve(epoch.getEpochNumber(), reserve, endTime);
    }

    /**
     * Records the scheduled start of {@code epochNumber} and applies any transition now due.
     */
    public List<LeaderboardEpoch> onEpochStart(long epochNumber, long scheduledStartTime, long timestamp, long blockNumber) {
        LeaderboardEpoch epoch = store.findEpoch(epochNumber).orElseGet(() -> LeaderboardEpoch.unscheduled(epochNumber));
        if (epoch.getStartBlock() <= 0 && scheduledStartTime > 0 && scheduledStartTime <= timestamp) {
            epoch.setStartBlock(blockNumber);
        }
        epoch.setScheduledStartTime(scheduledStartTime);
        store.saveEpoch(epoch);
        logger.info("Epoch {} scheduled to start at {}", epochNumber, scheduledStartTime);
        return applyScheduledTransitions(timestamp, blockNumber);
    }

    /**
     * Records the scheduled end of {@code epochNumber} and applies any transition now due.
     */
    public List<LeaderboardEpoch> onEpochEnd(long epochNumber, long scheduledEndTime, long timestamp, long blockNumber) {
        LeaderboardEpoch epoch = store.findEpoch(epochNumber).orElseGet(() -> {
            LeaderboardEpoch created = LeaderboardEpoch.unscheduled(epochNumber);
            created.setActive(true);
            return created;
        });
        if ((epoch.getEndBlock() == null || epoch.getEndBlock() <= 0)
                && scheduledEndTime > 0 && scheduledEndTime <= timestamp) {
            epoch.setEndBlock(blockNumber);
        }
        epoch.setScheduledEndTime(scheduledEndTime);
        store.saveEpoch(epoch);
        logger.info("Epoch {} scheduled to end at {}", epochNumber, scheduledEndTime);
        return applyScheduledTransitions(timestamp, blockNumber);
    }

    /**
     * Ends and starts epochs whose scheduled times have passed, at most
     * {@value #MAX_SCHEDULED_TRANSITIONS} steps per call. Returns the epochs that ended.
     */
    public List<LeaderboardEpoch> applyScheduledTransitions(long timestamp, long blockNumber) {
        LeaderboardState state = currentState();
        long currentEpochNumber = state.getCurrentEpochNumber();
        boolean active = state.hasEpoch() && state.isActive();
        boolean updated = false;
        List<LeaderboardEpoch> ended = new ArrayList<>();

        for (int i = 0; i < MAX_SCHEDULED_TRANSITIONS; i++) {
            if (active) {
                LeaderboardEpoch epoch = store.findEpoch(currentEpochNumber).orElse(null);
                if (epoch == null) {
                    break;
                }

                long scheduledEnd = epoch.getScheduledEndTime();
                if (scheduledEnd > 0 && scheduledEnd <= timestamp) {
                    endEpoch(epoch, scheduledEnd, blockNumber);
                    ended.add(epoch);
                    active = false;
                    updated = true;
                    continue;
                }

                LeaderboardEpoch next = store.findEpoch(currentEpochNumber + 1).orElse(null);
                long scheduledStart = next != null ? next.getScheduledStartTime() : 0;
                if (scheduledStart > 0 && scheduledStart <= timestamp) {
                    endEpoch(epoch, scheduledStart, blockNumber);
                    ended.add(epoch);
                    startEpoch(next, scheduledStart, blockNumber, timestamp);
                    currentEpochNumber = next.getEpochNumber();
                    updated = true;
                    continue;
                }
                break;
            }

            long nextNumber = currentEpochNumber == 0 ? 1 : currentEpochNumber + 1;
            LeaderboardEpoch next = store.findEpoch(nextNumber).orElse(null);
            if (next == null) {
                break;
            }
            long scheduledStart = next.getScheduledStartTime();
            if (scheduledStart > 0 && scheduledStart <= timestamp) {
                startEpoch(next, scheduledStart, blockNumber, timestamp);
                currentEpochNumber = nextNumber;
                active = true;
                updated = true;
                continue;
            }
            break;
        }

        if (updated) {
            state.setCurrentEpochNumber(currentEpochNumber);
            state.setActive(active);
            store.saveState(state);
        }
        return ended;
    }

    private void endEpoch(LeaderboardEpoch epoch, long scheduledEnd, long blockNumber) {
        long endTime = epoch.getEndTime() != null && epoch.getEndTime() > 0
            ? Math.min(epoch.getEndTime(), scheduledEnd)
            : scheduledEnd;
        if (epoch.getEndBlock() == null || epoch.getEndBlock() <= 0) {
            epoch.setEndBlock(blockNumber);
        }
        epoch.setEndTime(endTime);
        epoch.setActive(false);
        store.saveEpoch(epoch);

        for (Reserve reserve : store.findAllReserves()) {
            if (reserve.getLastUpdateTimestamp() <= endTime
                    && store.findEpochEndSnapshot(epoch.getEpochNumber(), reserve.getId()).isEmpty()) {
                snapshotReserve(epoch.getEpochNumber(), reserve, endTime);
            }
        }
        logger.info("Epoch {} ended at {} (block {})", epoch.getEpochNumber(), endTime, epoch.getEndBlock());
    }

    private void startEpoch(LeaderboardEpoch epoch, long scheduledStart, long blockNumber, long timestamp) {
        long startTime = epoch.getStartTime() > 0 ? Math.min(epoch.getStartTime(), scheduledStart) : scheduledStart;
        if (epoch.getStartBlock() <= 0) {
            epoch.setStartBlock(blockNumber);
        }
        epoch.setStartTime(startTime);
        epoch.setEndBlock(null);
        epoch.setEndTime(null);
        epoch.setActive(true);
        store.saveEpoch(epoch);
        leaderboardFacade.resetGlobalMirror(epoch.getEpochNumber(), timestamp);
        logger.info("Epoch {} started at {} (block {})", epoch.getEpochNumber(), startTime, epoch.getStartBlock());
    }

    private void snapshotReserve(long epochNumber, Reserve reserve, long endTime) {
        store.saveEpochEndSnapshot(EpochEndIndexSnapshot.builder()
            .epochNumber(epochNumber)
            .reserveId(reserve.getId())
            .liquidityIndex(ReserveMath.normalizedIncome(reserve, endTime))
            .variableBorrowIndex(ReserveMath.normalizedVariableDebt(reserve, endTime))
            .timestamp(endTime)
            .build());
        logger.debug("Snapshotted reserve {} indices at end of epoch {}", reserve.getId(), epochNumber);
    }
}
