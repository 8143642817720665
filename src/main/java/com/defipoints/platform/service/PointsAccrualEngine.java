package com.defipoints.platform.service;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.math.CurrentBalances;
import com.defipoints.platform.math.FixedPointMath;
import com.defipoints.platform.math.ReserveMath;
import com.defipoints.platform.model.DailyAction;
import com.defipoints.platform.model.EpochEndIndexSnapshot;
import com.defipoints.platform.model.LeaderboardConfig;
import com.defipoints.platform.model.LeaderboardEpoch;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.model.LpPosition;
import com.defipoints.platform.model.Reserve;
import com.defipoints.platform.model.UserDailyActivity;
import com.defipoints.platform.model.UserEpochStats;
import com.defipoints.platform.model.UserLeaderboardState;
import com.defipoints.platform.model.UserReserve;
import com.defipoints.platform.model.UserReserveList;
import com.defipoints.platform.model.UserReservePoints;
import com.defipoints.platform.repository.PointsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns balance history into points. Every mutation ends with the user's epoch total pushed to
 * {@link LeaderboardFacade} and the lifetime total pushed to the all-time scope.
 */
@Service
public class PointsAccrualEngine {

    private static final Logger logger = LoggerFactory.getLogger(PointsAccrualEngine.class);

    public static final long SECONDS_PER_DAY = 86_400L;
    static final int POINTS_DECIMALS = 18;

    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(MultiplierResolver.BASIS_POINTS);
    private static final BigInteger PRICE_SCALE = BigInteger.TEN.pow(8);
    private static final BigInteger DAY = BigInteger.valueOf(SECONDS_PER_DAY);

    private final PointsStore store;
    private final EpochSettlementCoordinator coordinator;
    private final UserMultiplierService userMultiplierService;
    private final LeaderboardFacade leaderboardFacade;
    private final PointsProperties properties;

    @Autowired
    public PointsAccrualEngine(
            PointsStore store,
            EpochSettlementCoordinator coordinator,
            UserMultiplierService userMultiplierService,
            LeaderboardFacade leaderboardFacade,
            PointsProperties properties) {
        this.store = store;
        this.coordinator = coordinator;
        this.userMultiplierService = userMultiplierService;
        this.leaderboardFacade = leaderboardFacade;
        this.properties = properties;
    }

    /**
     * Points for holding {@code tokens} raw units of an asset for {@code seconds}, scaled by 1e18.
     */
    public static BigInteger balancePoints(BigInteger tokens, int decimals, BigInteger priceUsdE8,
                                           long rateBps, long seconds) {
        if (priceUsdE8.signum() <= 0 || seconds <= 0) {
            return BigInteger.ZERO;
        }
        return indexedPoints(tokens, decimals, priceUsdE8.multiply(BigInteger.valueOf(seconds)), rateBps);
    }

    /**
     * Points for holding {@code tokens} raw units while the reserve's price index moved by
     * {@code priceSeconds} (price with 8 decimals times seconds), scaled by 1e18.
     */
    public static BigInteger indexedPoints(BigInteger tokens, int decimals, BigInteger priceSeconds, long rateBps) {
        if (tokens.signum() <= 0 || priceSeconds.signum() <= 0 || rateBps <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger numerator = tokens
            .multiply(priceSeconds)
            .multiply(BigInteger.valueOf(rateBps))
            .multiply(FixedPointMath.WAD);
        BigInteger denominator = BigInteger.TEN.pow(Math.max(decimals, 0))
            .multiply(PRICE_SCALE)
            .multiply(BASIS_POINTS)
            .multiply(DAY);
        return numerator.divide(denominator);
    }

    /**
     * Points for a USD value with 8 decimals held for {@code seconds}, scaled by 1e18.
     */
    public static BigInteger usdValuePoints(BigInteger valueUsdE8, long rateBps, long seconds) {
        return balancePoints(valueUsdE8, 8, PRICE_SCALE, rateBps, seconds);
    }

    /**
     * Points for {@code votingPower} (wad) held for {@code seconds}, scaled by 1e18.
     */
    public static BigInteger votingPowerPoints(BigInteger votingPower, long rateBps, long seconds) {
        return balancePoints(votingPower, POINTS_DECIMALS, PRICE_SCALE, rateBps, seconds);
    }

    public static BigInteger toScaledPoints(double points) {
        if (!(points > 0) || Double.isInfinite(points)) {
            return BigInteger.ZERO;
        }
        return BigDecimal.valueOf(points).movePointRight(POINTS_DECIMALS).toBigInteger();
    }

    public static double toPoints(BigInteger scaledPoints) {
        return FixedPointMath.toDecimal(scaledPoints, POINTS_DECIMALS);
    }

    public static long dayOf(long timestamp) {
        return Math.floorDiv(timestamp, SECONDS_PER_DAY);
    }

    public LeaderboardConfig config() {
        return store.findConfig().orElseGet(this::defaultConfig);
    }

    public BigInteger priceOf(Reserve reserve) {
        BigInteger price = reserve.getPriceUsdE8();
        if (price == null || price.signum() <= 0) {
            return BigInteger.valueOf(properties.getDefaults().getPriceUsdE8());
        }
        return price;
    }

    /**
     * Advances the cumulative price index of {@code reserve} to {@code timestamp} at its current
     * price. The first advance at or after the active epoch's start also records the index value
     * at that start. The caller saves the reserve.
     */
    public void advancePriceIndex(Reserve reserve, long timestamp) {
        BigInteger index = nullToZero(reserve.getPriceIndex());
        BigInteger price = priceOf(reserve);
        long last = reserve.getPriceIndexTimestamp();

        LeaderboardState state = coordinator.currentState();
        LeaderboardEpoch epoch = state.hasEpoch() && state.isActive()
            ? store.findEpoch(state.getCurrentEpochNumber()).orElse(null)
            : null;
        if (epoch != null && last > 0 && reserve.getPriceIndexResetTimestamp() < epoch.getStartTime()
                && timestamp >= epoch.getStartTime()) {
            BigInteger atStart = index.add(price.multiply(BigInteger.valueOf(epoch.getStartTime() - last)));
            reserve.setPriceIndexAtReset(atStart.max(BigInteger.ZERO));
            reserve.setPriceIndexResetTimestamp(epoch.getStartTime());
        }

        if (last > 0 && timestamp > last) {
            index = index.add(price.multiply(BigInteger.valueOf(timestamp - last)));
        }
        reserve.setPriceIndex(index);
        reserve.setPriceIndexTimestamp(Math.max(last, timestamp));
    }

    /**
     * Index value at {@code balanceTimestamp}, for an index already advanced to {@code timestamp}.
     * The time past {@code balanceTimestamp} is removed at the current price.
     */
    private BigInteger priceIndexAt(Reserve reserve, long timestamp, long balanceTimestamp) {
        BigInteger index = nullToZero(reserve.getPriceIndex());
        if (timestamp <= balanceTimestamp) {
            return index;
        }
        BigInteger gap = priceOf(reserve).multiply(BigInteger.valueOf(timestamp - balanceTimestamp));
        return index.subtract(gap).max(BigInteger.ZERO);
    }

    private static BigInteger epochStartPriceIndex(Reserve reserve, LeaderboardEpoch epoch) {
        if (reserve.getPriceIndexAtReset() == null || reserve.getPriceIndexResetTimestamp() != epoch.getStartTime()) {
            return null;
        }
        return reserve.getPriceIndexAtReset();
    }

    public double usdValue(Reserve reserve, BigInteger tokens) {
        if (tokens == null || tokens.signum() <= 0) {
            return 0d;
        }
        return FixedPointMath.toDecimal(tokens.multiply(priceOf(reserve)), reserve.getDecimals() + 8);
    }

    public void accrue(String userId, String reserveId, long timestamp, long blockNumber) {
        accrue(userId, reserveId, timestamp, blockNumber, false);
    }

    /**
     * Moves the baseline to {@code timestamp} without awarding points for the elapsed interval.
     */
    public void syncBaseline(String userId, String reserveId, long timestamp, long blockNumber) {
        accrue(userId, reserveId, timestamp, blockNumber, true);
    }

    private void accrue(String userId, String reserveId, long timestamp, long blockNumber, boolean skipPoints) {
        Reserve reserve = store.findReserve(reserveId).orElse(null);
        UserReserve userReserve = store.findUserReserve(userId, reserveId).orElse(null);
        if (reserve == null || userReserve == null) {
            return;
        }

        UserReservePoints baseline = store.findUserReservePoints(userId, reserveId)
            .orElseGet(() -> UserReservePoints.empty(userId, reserveId));

        advancePriceIndex(reserve, timestamp);
        store.saveReserve(reserve);

        LeaderboardState state = coordinator.currentState();
        LeaderboardEpoch epoch = state.hasEpoch() ? store.findEpoch(state.getCurrentEpochNumber()).orElse(null) : null;
        if (epoch == null) {
            updateBaseline(baseline, reserve, ReserveMath.currentBalances(reserve, userReserve, timestamp, null),
                reserve.getPriceIndex(), timestamp);
            return;
        }
        if (!state.isActive() && epoch.getEndTime() == null) {
            return;
        }

        long balanceTimestamp = skipPoints ? timestamp : EpochSettlementCoordinator.balanceTimestamp(state, epoch, timestamp);
        boolean epochOver = !state.isActive() && epoch.getEndTime() != null;
        if (!skipPoints && epochOver && baseline.getLastUpdateTimestamp() >= epoch.getEndTime()) {
            return;
        }

        EpochEndIndexSnapshot override = coordinator.indexOverride(reserve, epoch.getEpochNumber(), balanceTimestamp)
            .orElse(null);
        CurrentBalances current = ReserveMath.currentBalances(reserve, userReserve, balanceTimestamp, override);
        BigInteger priceIndex = priceIndexAt(reserve, timestamp, balanceTimestamp);

        boolean fromEpochStart = baseline.getLastUpdateTimestamp() < epoch.getStartTime();
        BigInteger depositTokens = fromEpochStart ? current.getSupply() : baseline.getLastDepositBalance();
        BigInteger borrowTokens = fromEpochStart ? current.getVariableDebt() : baseline.getLastBorrowBalance();
        long start = fromEpochStart ? epoch.getStartTime() : baseline.getLastUpdateTimestamp();
        long seconds = Math.max(0L, balanceTimestamp - start);

        boolean beforeStartBlock = epoch.getStartBlock() > 0 && blockNumber < epoch.getStartBlock();
        if (!skipPoints && !beforeStartBlock && seconds > 0) {
            LeaderboardConfig config = config();
            BigInteger lastIndex = fromEpochStart ? epochStartPriceIndex(reserve, epoch) : baseline.getLastPriceIndex();
            BigInteger priceSeconds = lastIndex != null
                ? priceIndex.subtract(lastIndex).max(BigInteger.ZERO)
                : priceOf(reserve).multiply(BigInteger.valueOf(seconds));
            BigInteger depositPoints = indexedPoints(depositTokens, reserve.getDecimals(), priceSeconds,
                config.getDepositRateBps());
            BigInteger borrowPoints = indexedPoints(borrowTokens, reserve.getDecimals(), priceSeconds,
                config.getBorrowRateBps());

            if (depositPoints.signum() > 0 || borrowPoints.signum() > 0) {
                baseline.setDepositPoints(baseline.getDepositPoints().add(depositPoints));
                baseline.setBorrowPoints(baseline.getBorrowPoints().add(borrowPoints));

                UserEpochStats stats = getOrCreateStats(userId, epoch.getEpochNumber(), timestamp);
                long multiplier = balanceTimestamp > start
                    ? userMultiplierService.averageCombinedMultiplierBps(userId, start, balanceTimestamp)
                    : userMultiplierService.getOrCreateState(userId, timestamp).getCombinedMultiplierBps();

                stats.setDepositPoints(stats.getDepositPoints().add(depositPoints));
                stats.setBorrowPoints(stats.getBorrowPoints().add(borrowPoints));
                stats.setDepositPointsWithMultiplier(stats.getDepositPointsWithMultiplier()
                    .add(MultiplierResolver.applyMultiplier(depositPoints, multiplier)));
                stats.setBorrowPointsWithMultiplier(stats.getBorrowPointsWithMultiplier()
                    .add(MultiplierResolver.applyMultiplier(borrowPoints, multiplier)));
                stats.setDepositMultiplierBps(multiplier);
                stats.setBorrowMultiplierBps(multiplier);
                stats.setLastAppliedMultiplierBps(multiplier);
                stats.setLastUpdatedAt(timestamp);

                logger.debug("Accrued {} deposit and {} borrow points for user {} on reserve {} over {}s",
                    depositPoints, borrowPoints, userId, reserveId, seconds);
                commitStats(stats, timestamp);
            }
        }

        updateBaseline(baseline, reserve, current, priceIndex, balanceTimestamp);
    }

    private void updateBaseline(UserReservePoints baseline, Reserve reserve, CurrentBalances current,
                                BigInteger priceIndex, long timestamp) {
        baseline.setLastPriceIndex(priceIndex);
        baseline.setLastDepositBalance(current.getSupply());
        baseline.setLastBorrowBalance(current.getVariableDebt());
        baseline.setLastDepositUsd(usdValue(reserve, current.getSupply()));
        baseline.setLastBorrowUsd(usdValue(reserve, current.getVariableDebt()));
        baseline.setLastUpdateTimestamp(Math.max(baseline.getLastUpdateTimestamp(), timestamp));
        store.saveUserReservePoints(baseline);
    }

    /**
     * Settles every reserve the user holds, their LP positions and their voting-power points.
     * {@code triggeringReserveId} may be null; when set, that reserve settles regardless of cooldown.
     */
    public void settleUser(String userId, String triggeringReserveId, long timestamp, long blockNumber,
                           boolean ignoreCooldown) {
        LeaderboardState state = coordinator.currentState();
        LeaderboardEpoch epoch = state.hasEpoch() ? store.findEpoch(state.getCurrentEpochNumber()).orElse(null) : null;
        if (epoch == null) {
            if (triggeringReserveId != null) {
                trackReserve(userId, triggeringReserveId);
            }
            userMultiplierService.refreshState(userId, timestamp);
            return;
        }

        long balanceTimestamp = EpochSettlementCoordinator.balanceTimestamp(state, epoch, timestamp);
        userMultiplierService.syncNftOwnershipFromChain(userId, timestamp);
        settleUserLpPositions(userId, timestamp);
        UserLeaderboardState userState = userMultiplierService.refreshState(userId, timestamp);
        LeaderboardConfig config = config();

        long previousUpdatedAt = getOrCreateStats(userId, epoch.getEpochNumber(), timestamp).getLastUpdatedAt();
        if (triggeringReserveId != null) {
            trackReserve(userId, triggeringReserveId);
        }

        double totalSupplyUsd = 0d;
        double totalBorrowUsd = 0d;
        List<String> reserveIds = new ArrayList<>(userMultiplierService.getOrCreatePositions(userId).getReserveIds());
        for (String reserveId : reserveIds) {
            Reserve reserve = store.findReserve(reserveId).orElse(null);
            UserReserve userReserve = store.findUserReserve(userId, reserveId).orElse(null);
            if (reserve == null || userReserve == null) {
                continue;
            }

            EpochEndIndexSnapshot override = coordinator.indexOverride(reserve, epoch.getEpochNumber(), balanceTimestamp)
                .orElse(null);
            CurrentBalances current = ReserveMath.currentBalances(reserve, userReserve, balanceTimestamp, override);
            if (current.isEmpty()) {
                continue;
            }

            boolean triggering = reserveId.equals(triggeringReserveId);
            if (ignoreCooldown || triggering || !inCooldown(userId, reserveId, timestamp, config)) {
                accrue(userId, reserveId, timestamp, blockNumber);
            }
            totalSupplyUsd += usdValue(reserve, current.getSupply());
            totalBorrowUsd += usdValue(reserve, current.getVariableDebt());
        }

        if (state.isActive()) {
            UserDailyActivity activity = getOrCreateActivity(userId, epoch.getEpochNumber(), dayOf(timestamp), timestamp);
            activity.setDailySupplyUsdHighwater(Math.max(totalSupplyUsd, activity.getDailySupplyUsdHighwater()));
            activity.setDailyBorrowUsdHighwater(Math.max(totalBorrowUsd, activity.getDailyBorrowUsdHighwater()));
            activity.setUpdatedAt(timestamp);
            store.saveDailyActivity(activity);
        }

        accrueVotingPowerPoints(userId, epoch, userState, config, previousUpdatedAt, balanceTimestamp, timestamp);
    }

    private void accrueVotingPowerPoints(String userId, LeaderboardEpoch epoch, UserLeaderboardState userState,
                                         LeaderboardConfig config, long previousUpdatedAt, long balanceTimestamp,
                                         long timestamp) {
        if (config.getVpRateBps() <= 0) {
            return;
        }
        long start = Math.max(epoch.getStartTime(), previousUpdatedAt);
        if (balanceTimestamp <= start) {
            return;
        }

        BigInteger averageVotingPower = userMultiplierService.averageVotingPower(userId, start, balanceTimestamp);
        BigInteger vpPoints = votingPowerPoints(averageVotingPower, config.getVpRateBps(), balanceTimestamp - start);
        if (vpPoints.signum() <= 0) {
            return;
        }

        long multiplier = userMultiplierService.averageCombinedMultiplierBps(userId, start, balanceTimestamp);
        UserEpochStats stats = getOrCreateStats(userId, epoch.getEpochNumber(), timestamp);
        stats.setDailyVpPoints(stats.getDailyVpPoints().add(vpPoints));
        stats.setVpPointsWithMultiplier(stats.getVpPointsWithMultiplier()
            .add(MultiplierResolver.applyMultiplier(vpPoints, multiplier)));
        stats.setVpMultiplierBps(multiplier);
        stats.setLastAppliedMultiplierBps(userState.getCombinedMultiplierBps());
        stats.setLastUpdatedAt(timestamp);

        logger.debug("Accrued {} voting power points for user {} over {}s", vpPoints, userId, balanceTimestamp - start);
        commitStats(stats, timestamp);
    }

    private boolean inCooldown(String userId, String reserveId, long timestamp, LeaderboardConfig config) {
        long cooldown = config.getCooldownSeconds();
        if (cooldown <= 0) {
            return false;
        }
        return store.findUserReservePoints(userId, reserveId)
            .map(baseline -> baseline.getLastUpdateTimestamp() > 0
                && timestamp - baseline.getLastUpdateTimestamp() < cooldown)
            .orElse(false);
    }

    /**
     * Keeper settlement of every reserve the user holds, ignoring cooldowns.
     */
    public void settleAllReserves(String userId, long timestamp, long blockNumber) {
        settleUser(userId, null, timestamp, blockNumber, true);
    }

    /**
     * Adds {@code amountUsd} to the user's running total for {@code action} today.
     */
    public void recordDailyAmount(String userId, DailyAction action, double amountUsd, long timestamp) {
        LeaderboardState state = coordinator.currentState();
        if (!state.hasEpoch() || !(amountUsd > 0)) {
            return;
        }
        UserDailyActivity activity = getOrCreateActivity(userId, state.getCurrentEpochNumber(), dayOf(timestamp), timestamp);
        activity.addToHighwater(action, amountUsd);
        activity.setUpdatedAt(timestamp);
        store.saveDailyActivity(activity);
    }

    /**
     * Awards the fixed bonus for {@code action} at most once per UTC day, once the day's USD
     * volume for that action reaches the configured minimum.
     */
    public void awardDailyBonus(String userId, DailyAction action, long timestamp) {
        LeaderboardState state = coordinator.currentState();
        if (!state.hasEpoch() || !state.isActive()) {
            return;
        }
        long epochNumber = state.getCurrentEpochNumber();
        if (store.findEpoch(epochNumber).isEmpty()) {
            return;
        }

        LeaderboardConfig config = config();
        double bonus = config.dailyBonusFor(action);
        if (bonus <= 0) {
            return;
        }

        long day = dayOf(timestamp);
        UserEpochStats stats = getOrCreateStats(userId, epochNumber, timestamp);
        UserDailyActivity activity = getOrCreateActivity(userId, epochNumber, day, timestamp);
        activity.markActive(action);
        activity.setUpdatedAt(timestamp);
        store.saveDailyActivity(activity);

        if (stats.lastPointsDayFor(action) == day) {
            return;
        }
        if (activity.highwaterFor(action) < config.getMinDailyBonusUsd()) {
            return;
        }

        stats.creditDailyBonus(action, toScaledPoints(bonus), day);
        stats.setLastAppliedMultiplierBps(userMultiplierService.getOrCreateState(userId, timestamp).getCombinedMultiplierBps());
        stats.setLastUpdatedAt(timestamp);
        logger.debug("Awarded {} daily bonus of {} points to user {} for day {}", action, bonus, userId, day);
        commitStats(stats, timestamp);
    }

    /**
     * Adds (or removes, when negative) unmultiplied manual points in the current epoch. The
     * manual total never drops below zero.
     */
    public void applyManualPoints(String userId, BigInteger scaledPoints, long timestamp) {
        LeaderboardState state = coordinator.currentState();
        if (!state.hasEpoch() || store.findEpoch(state.getCurrentEpochNumber()).isEmpty()) {
            return;
        }
        UserEpochStats stats = getOrCreateStats(userId, state.getCurrentEpochNumber(), timestamp);
        BigInteger manual = stats.getManualAwardPoints().add(scaledPoints);
        stats.setManualAwardPoints(manual.max(BigInteger.ZERO));
        commitStats(stats, timestamp);
    }

    public void settleUserLpPositions(String userId, long timestamp) {
        LeaderboardState state = coordinator.currentState();
        LeaderboardEpoch epoch = state.hasEpoch() ? store.findEpoch(state.getCurrentEpochNumber()).orElse(null) : null;
        List<String> positionIds = store.findUserReserveList(userId)
            .map(UserReserveList::getLpPositionIds)
            .orElse(List.of());
        for (String positionId : positionIds) {
            store.findLpPosition(positionId).ifPresent(position -> {
                if (epoch == null) {
                    position.setLastSettledAt(Math.max(position.getLastSettledAt(), timestamp));
                    store.saveLpPosition(position);
                } else {
                    long end = EpochSettlementCoordinator.balanceTimestamp(state, epoch, timestamp);
                    settleLpPosition(position, epoch, end, timestamp);
                }
            });
        }
    }

    /**
     * Closes out every LP position of an epoch that has just ended.
     */
    public void settleAllLpPositions(LeaderboardEpoch endedEpoch) {
        if (endedEpoch.getEndTime() == null) {
            return;
        }
        long endTime = endedEpoch.getEndTime();
        for (LpPosition position : store.findAllLpPositions()) {
            settleLpPosition(position, endedEpoch, endTime, endTime);
        }
        logger.info("Settled LP positions at end of epoch {}", endedEpoch.getEpochNumber());
    }

    /**
     * Accrues LP points for the in-range time of {@code position} inside {@code epoch}, up to
     * {@code end}, and advances its settlement cursor.
     */
    public void settleLpPosition(LpPosition position, LeaderboardEpoch epoch, long end, long timestamp) {
        long start = Math.max(position.getLastSettledAt(), epoch.getStartTime());
        if (epoch.getEndTime() != null) {
            end = Math.min(end, epoch.getEndTime());
        }
        LeaderboardConfig config = config();
        BigInteger value = position.getValueUsdE8() != null ? position.getValueUsdE8() : BigInteger.ZERO;

        if (position.isInRange() && end > start) {
            BigInteger lpPoints = usdValuePoints(value, config.getLpRateBps(), end - start);
            if (lpPoints.signum() > 0) {
                String userId = position.getUserId();
                long multiplier = userMultiplierService.averageCombinedMultiplierBps(userId, start, end);
                UserEpochStats stats = getOrCreateStats(userId, epoch.getEpochNumber(), timestamp);
                stats.setLpPoints(stats.getLpPoints().add(lpPoints));
                stats.setLpPointsWithMultiplier(stats.getLpPointsWithMultiplier()
                    .add(MultiplierResolver.applyMultiplier(lpPoints, multiplier)));
                stats.setLpMultiplierBps(multiplier);
                position.setPoints(nullToZero(position.getPoints()).add(lpPoints));

                logger.debug("Accrued {} LP points for position {} over {}s", lpPoints, position.getPositionId(), end - start);
                commitStats(stats, timestamp);
            }
        }

        position.setLastSettledAt(Math.max(position.getLastSettledAt(), end));
        store.saveLpPosition(position);
    }

    /**
     * Re-sums the user's lifetime totals over every epoch they took part in and ranks the
     * multiplied lifetime total in the all-time scope.
     */
    public void rollUpLifetime(String userId, long epochNumber, long timestamp) {
        UserLeaderboardState userState = userMultiplierService.getOrCreateState(userId, timestamp);
        List<Long> epochs = userState.getEpochsParticipated() != null
            ? new ArrayList<>(userState.getEpochsParticipated())
            : new ArrayList<>();
        if (!epochs.contains(epochNumber)) {
            epochs.add(epochNumber);
        }

        BigInteger lifetime = BigInteger.ZERO;
        BigInteger lifetimeWithMultiplier = BigInteger.ZERO;
        for (Long epoch : epochs) {
            UserEpochStats stats = store.findUserEpochStats(userId, epoch).orElse(null);
            if (stats == null) {
                continue;
            }
            lifetime = lifetime.add(stats.getTotalPoints());
            lifetimeWithMultiplier = lifetimeWithMultiplier.add(stats.getTotalPointsWithMultiplier());
        }

        userState.setEpochsParticipated(epochs);
        userState.setLifetimePoints(lifetime);
        userState.setLifetimePointsWithMultiplier(lifetimeWithMultiplier);
        userState.setLastUpdate(timestamp);
        store.saveUserState(userState);

        if (epochNumber > 0) {
            leaderboardFacade.updateAllTimeLeaderboard(userId, toPoints(lifetimeWithMultiplier), timestamp);
        }
    }

    private void commitStats(UserEpochStats stats, long timestamp) {
        stats.recomputeTotals();
        store.saveUserEpochStats(stats);
        rollUpLifetime(stats.getUserId(), stats.getEpochNumber(), timestamp);

        // a late settlement of an ended epoch must not leak into its successor's ranking
        LeaderboardState state = coordinator.currentState();
        if (state.getCurrentEpochNumber() == stats.getEpochNumber()) {
            leaderboardFacade.updateLeaderboard(stats.getUserId(), toPoints(stats.getTotalPointsWithMultiplier()), timestamp);
        }
    }

    public UserEpochStats getOrCreateStats(String userId, long epochNumber, long timestamp) {
        return store.findUserEpochStats(userId, epochNumber).orElseGet(() -> {
            UserEpochStats stats = UserEpochStats.empty(userId, epochNumber, timestamp);
            store.saveUserEpochStats(stats);
            return stats;
        });
    }

    private UserDailyActivity getOrCreateActivity(String userId, long epochNumber, long day, long timestamp) {
        return store.findDailyActivity(userId, epochNumber, day)
            .orElseGet(() -> UserDailyActivity.empty(userId, epochNumber, day, timestamp));
    }

    public void trackReserve(String userId, String reserveId) {
        UserReserveList list = userMultiplierService.getOrCreatePositions(userId);
        if (!list.getReserveIds().contains(reserveId)) {
            list.getReserveIds().add(reserveId);
            store.saveUserReserveList(list);
        }
    }

    private LeaderboardConfig defaultConfig() {
        PointsProperties.Defaults defaults = properties.getDefaults();
        return LeaderboardConfig.builder()
            .depositRateBps(defaults.getDepositRateBps())
            .borrowRateBps(defaults.getBorrowRateBps())
            .vpRateBps(defaults.getVpRateBps())
            .lpRateBps(defaults.getLpRateBps())
            .cooldownSeconds(defaults.getCooldownSeconds())
            .build();
    }

    private static BigInteger nullToZero(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
