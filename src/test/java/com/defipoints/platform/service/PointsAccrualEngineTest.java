package com.defipoints.platform.service;

import com.defipoints.platform.PointsPlatformFixture;
import com.defipoints.platform.event.EventType;
import com.defipoints.platform.event.params.AccountParams;
import com.defipoints.platform.event.params.BalanceParams;
import com.defipoints.platform.event.params.ConfigSnapshotParams;
import com.defipoints.platform.event.params.EpochParams;
import com.defipoints.platform.event.params.KeeperParams;
import com.defipoints.platform.event.params.PointsAdjustmentParams;
import com.defipoints.platform.event.params.ReserveParams;
import com.defipoints.platform.math.FixedPointMath;
import com.defipoints.platform.model.TopK;
import com.defipoints.platform.model.TopKEntry;
import com.defipoints.platform.model.UserEpochStats;
import com.defipoints.platform.model.UserReservePoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PointsAccrualEngineTest {

    private static final String USDC = "0xusdc";
    private static final String DAI = "0xdai";
    private static final String ALICE = "0xalice";
    private static final BigInteger ONE_THOUSAND_USDC = BigInteger.valueOf(1_000_000_000L);
    private static final BigInteger ONE_THOUSAND_DAI = new BigInteger("1000000000000000000000");
    private static final BigInteger ONE_DOLLAR = BigInteger.valueOf(100_000_000L);
    private static final BigInteger WAD = FixedPointMath.WAD;

    private PointsPlatformFixture platform;

    @BeforeEach
    void setUp() {
        platform = new PointsPlatformFixture();
    }

    @Test
    void testBalancePoints_OneHourAtFullRate() {
        // Act
        BigInteger points = PointsAccrualEngine.balancePoints(ONE_THOUSAND_USDC, 6,
            BigInteger.valueOf(100_000_000L), 10_000, 3_600);

        // Assert
        assertEquals(new BigInteger("41666666666666666666"), points);
    }

    @Test
    void testBalancePoints_NonPositiveInputsYieldZero() {
        BigInteger price = BigInteger.valueOf(100_000_000L);
        assertEquals(BigInteger.ZERO, PointsAccrualEngine.balancePoints(BigInteger.ZERO, 6, price, 10_000, 3_600));
        assertEquals(BigInteger.ZERO, PointsAccrualEngine.balancePoints(ONE_THOUSAND_USDC, 6, price, 0, 3_600));
        assertEquals(BigInteger.ZERO, PointsAccrualEngine.balancePoints(ONE_THOUSAND_USDC, 6, price, 10_000, 0));
        assertEquals(BigInteger.ZERO, PointsAccrualEngine.balancePoints(ONE_THOUSAND_USDC, 6, BigInteger.ZERO, 10_000, 60));
    }

    @Test
    void testUsdValuePoints_OneDollarForOneDay() {
        BigInteger points = PointsAccrualEngine.usdValuePoints(BigInteger.valueOf(100_000_000L), 10_000, 86_400);
        assertEquals(WAD, points);
    }

    @Test
    void testVotingPowerPoints_OneTokenForOneDay() {
        assertEquals(WAD, PointsAccrualEngine.votingPowerPoints(WAD, 10_000, 86_400));
    }

    @Test
    void testToScaledPoints() {
        assertEquals(new BigInteger("2500000000000000000"), PointsAccrualEngine.toScaledPoints(2.5));
        assertEquals(BigInteger.ZERO, PointsAccrualEngine.toScaledPoints(-1));
        assertEquals(BigInteger.ZERO, PointsAccrualEngine.toScaledPoints(Double.NaN));
    }

    @Test
    void testDayOf_UtcBoundaries() {
        assertEquals(0, PointsAccrualEngine.dayOf(86_399));
        assertEquals(1, PointsAccrualEngine.dayOf(86_400));
        assertEquals(-1, PointsAccrualEngine.dayOf(-1));
    }

    @Test
    void testAccrue_DepositForOneHour() {
        // Arrange
        configure(10_000, BigInteger.ZERO);
        initReserve();
        startEpoch(1, 100);
        supply(ALICE, ONE_THOUSAND_USDC, 1_000);

        // Act
        settle(ALICE, 4_600);

        // Assert
        UserEpochStats stats = platform.store.findUserEpochStats(ALICE, 1).orElseThrow();
        assertEquals(new BigInteger("41666666666666666666"), stats.getDepositPoints());
        assertEquals(41.6667, PointsAccrualEngine.toPoints(stats.getTotalPoints()), 0.001);
        assertEquals(stats.getTotalPoints(), stats.getTotalPointsWithMultiplier());

        List<TopKEntry> head = platform.rankingStructure.topEntries(TopK.key(1));
        assertEquals(1, head.size());
        assertEquals(ALICE, head.get(0).getUserId());
        assertEquals(41.6667, head.get(0).getPoints(), 0.001);
        assertEquals(1, platform.rankingStructure.topEntries(TopK.key(RankingStructure.ALL_TIME_SCOPE)).size());
    }

    @Test
    void testAccrue_StopsAtEpochEnd() {
        // Arrange
        configure(10_000, BigInteger.ZERO);
        initReserve();
        startEpoch(1, 100);
        supply(ALICE, ONE_THOUSAND_USDC, 200);
        platform.apply(EventType.EPOCH_ENDED, 300, EpochParams.builder().epochNumber(1L).scheduledTime(1_000L).build());

        // Act
        settle(ALICE, 2_000);
        BigInteger afterFirstSettle = platform.store.findUserEpochStats(ALICE, 1).orElseThrow().getTotalPoints();
        settle(ALICE, 2_100);
        BigInteger afterSecondSettle = platform.store.findUserEpochStats(ALICE, 1).orElseThrow().getTotalPoints();

        // Assert: 800 seconds between the deposit and the end of the epoch
        assertEquals(new BigInteger("9259259259259259259"), afterFirstSettle);
        assertEquals(afterFirstSettle, afterSecondSettle);
        assertFalse(platform.store.findState().orElseThrow().isActive());
        assertEquals(1_000L, platform.store.findEpoch(1).orElseThrow().getEndTime());
    }

    @Test
    void testAccrue_PriceChangeOnlyAffectsLaterTime() {
        // Arrange
        configure(10_000, BigInteger.ZERO);
        initReserve();
        startEpoch(1, 100);
        supply(ALICE, ONE_THOUSAND_USDC, 1_000);
        setPrice(USDC, ONE_DOLLAR.multiply(BigInteger.TEN), 87_300);

        // Act
        settle(ALICE, 87_400);

        // Assert: 86300 seconds at $1 and 100 seconds at $10
        UserEpochStats stats = platform.store.findUserEpochStats(ALICE, 1).orElseThrow();
        assertEquals(new BigInteger("1010416666666666666666"), stats.getDepositPoints());
        assertEquals(1010.4167, PointsAccrualEngine.toPoints(stats.getDepositPoints()), 0.001);
    }

    @Test
    void testAccrue_GapSettlementUsesFrozenEpochEndIndex() {
        // Arrange
        configure(10_000, BigInteger.ZERO);
        initReserve();
        supply(ALICE, ONE_THOUSAND_USDC, 50);
        startEpoch(1, 100);
        platform.apply(EventType.EPOCH_ENDED, 300, EpochParams.builder().epochNumber(1L).scheduledTime(1_000L).build());
        platform.apply(EventType.RESERVE_DATA_UPDATED, 1_500, ReserveParams.builder()
            .reserve(USDC)
            .liquidityIndex(FixedPointMath.RAY.multiply(BigInteger.TWO))
            .build());

        // Act
        settle(ALICE, 2_000);
        BigInteger afterFirstSettle = platform.store.findUserEpochStats(ALICE, 1).orElseThrow().getTotalPoints();
        settle(ALICE, 2_100);

        // Assert: 900 seconds of the epoch, valued at the index in force when it ended
        assertTrue(platform.store.findEpochEndSnapshot(1, USDC).isPresent());
        assertEquals(10.4167, PointsAccrualEngine.toPoints(afterFirstSettle), 0.001);
        assertEquals(afterFirstSettle, platform.store.findUserEpochStats(ALICE, 1).orElseThrow().getTotalPoints());
        assertEquals(ONE_THOUSAND_USDC,
            platform.store.findUserReservePoints(ALICE, USDC).orElseThrow().getLastDepositBalance());
    }

    @Test
    void testSettleUser_CooldownSkipsOtherReserves() {
        // Arrange
        configure(10_000, BigInteger.ZERO, 3_600, 0d);
        initReserve();
        initReserve(DAI, 18);
        startEpoch(1, 100);
        supply(ALICE, USDC, ONE_THOUSAND_USDC, 1_000);
        supply(ALICE, DAI, ONE_THOUSAND_DAI, 1_000);

        // Act
        supply(ALICE, USDC, ONE_THOUSAND_USDC, 2_000);

        // Assert: the triggering reserve settles, the other one waits out its cooldown
        UserReservePoints daiBaseline = platform.store.findUserReservePoints(ALICE, DAI).orElseThrow();
        assertEquals(1_000L, daiBaseline.getLastUpdateTimestamp());
        assertEquals(ONE_THOUSAND_DAI, daiBaseline.getLastDepositBalance());
        assertEquals(BigInteger.ZERO, daiBaseline.getDepositPoints());
        UserReservePoints usdcBaseline = platform.store.findUserReservePoints(ALICE, USDC).orElseThrow();
        assertEquals(2_000L, usdcBaseline.getLastUpdateTimestamp());
        assertEquals(11.5741, PointsAccrualEngine.toPoints(usdcBaseline.getDepositPoints()), 0.001);

        // Act
        supply(ALICE, USDC, ONE_THOUSAND_USDC, 10_000);

        // Assert: past the cooldown the other reserve accrues its whole interval
        daiBaseline = platform.store.findUserReservePoints(ALICE, DAI).orElseThrow();
        assertEquals(10_000L, daiBaseline.getLastUpdateTimestamp());
        assertEquals(104.1667, PointsAccrualEngine.toPoints(daiBaseline.getDepositPoints()), 0.001);
    }

    @Test
    void testAwardDailyBonus_BelowMinimumUsdAwardsNothing() {
        // Arrange
        configure(0, BigInteger.valueOf(5).multiply(WAD), 0, 2_000d);
        initReserve();
        startEpoch(1, 100);

        // Act
        supply(ALICE, ONE_THOUSAND_USDC, 1_000);

        // Assert
        UserEpochStats stats = platform.store.findUserEpochStats(ALICE, 1).orElseThrow();
        assertEquals(BigInteger.ZERO, stats.getDailySupplyPoints());

        // Act
        supply(ALICE, ONE_THOUSAND_USDC, 2_000);

        // Assert: the day's supply volume now reaches the minimum
        stats = platform.store.findUserEpochStats(ALICE, 1).orElseThrow();
        assertEquals(BigInteger.valueOf(5).multiply(WAD), stats.getDailySupplyPoints());
        assertEquals(0L, stats.getLastSupplyPointsDay());
    }

    @Test
    void testSettle_NoEpochAwardsNothing() {
        // Arrange
        configure(10_000, BigInteger.ZERO);
        initReserve();
        supply(ALICE, ONE_THOUSAND_USDC, 200);

        // Act
        settle(ALICE, 5_000);

        // Assert
        assertTrue(platform.store.findUserEpochStats(ALICE, 1).isEmpty());
        assertEquals(200L, platform.store.findUserReservePoints(ALICE, USDC).orElseThrow().getLastUpdateTimestamp());
        assertEquals(ONE_THOUSAND_USDC,
            platform.store.findUserReservePoints(ALICE, USDC).orElseThrow().getLastDepositBalance());
    }

    @Test
    void testAwardDailyBonus_OncePerDay() {
        // Arrange
        configure(0, BigInteger.valueOf(5).multiply(WAD));
        initReserve();
        startEpoch(1, 100);

        // Act
        supply(ALICE, ONE_THOUSAND_USDC, 1_000);
        supply(ALICE, ONE_THOUSAND_USDC, 2_000);
        supply(ALICE, ONE_THOUSAND_USDC, 86_400 + 10);

        // Assert
        UserEpochStats stats = platform.store.findUserEpochStats(ALICE, 1).orElseThrow();
        assertEquals(BigInteger.valueOf(10).multiply(WAD), stats.getDailySupplyPoints());
        assertEquals(1L, stats.getLastSupplyPointsDay());
    }

    @Test
    void testApplyManualPoints_ClampedAtZero() {
        // Arrange
        startEpoch(1, 100);
        platform.apply(EventType.POINTS_AWARDED, 200, adjustment(BigInteger.TEN.multiply(WAD)));

        // Act
        platform.apply(EventType.POINTS_REMOVED, 300, adjustment(BigInteger.valueOf(25).multiply(WAD)));

        // Assert
        UserEpochStats stats = platform.store.findUserEpochStats(ALICE, 1).orElseThrow();
        assertEquals(BigInteger.ZERO, stats.getManualAwardPoints());
        assertEquals(BigInteger.ZERO, stats.getTotalPoints());
        assertTrue(platform.rankingStructure.topEntries(TopK.key(1)).isEmpty());
    }

    @Test
    void testBlacklistedUser_AccruesButIsNotRanked() {
        // Arrange
        configure(10_000, BigInteger.ZERO);
        initReserve();
        startEpoch(1, 100);
        platform.apply(EventType.ADDRESS_BLACKLISTED, 150, AccountParams.builder().user(ALICE).build());
        supply(ALICE, ONE_THOUSAND_USDC, 1_000);

        // Act
        settle(ALICE, 4_600);

        // Assert
        assertTrue(platform.store.findUserEpochStats(ALICE, 1).orElseThrow().getTotalPoints().signum() > 0);
        assertTrue(platform.rankingStructure.topEntries(TopK.key(1)).isEmpty());
        assertTrue(platform.leaderboardFacade.isBlacklisted(ALICE));
    }

    private void configure(long depositRateBps, BigInteger supplyDailyBonusWad) {
        configure(depositRateBps, supplyDailyBonusWad, 0, 0d);
    }

    private void configure(long depositRateBps, BigInteger supplyDailyBonusWad, long cooldownSeconds,
                           double minDailyBonusUsd) {
        platform.apply(EventType.CONFIG_SNAPSHOT, 10, ConfigSnapshotParams.builder()
            .depositRateBps(depositRateBps)
            .borrowRateBps(0L)
            .vpRateBps(0L)
            .supplyDailyBonus(supplyDailyBonusWad)
            .cooldownSeconds(cooldownSeconds)
            .minDailyBonusUsd(minDailyBonusUsd)
            .build());
    }

    private void initReserve() {
        initReserve(USDC, 6);
    }

    private void initReserve(String reserve, int decimals) {
        platform.apply(EventType.RESERVE_INITIALIZED, 20, ReserveParams.builder()
            .reserve(reserve)
            .decimals(decimals)
            .priceUsdE8(ONE_DOLLAR)
            .build());
    }

    private void setPrice(String reserve, BigInteger priceUsdE8, long timestamp) {
        platform.apply(EventType.ASSET_PRICE_UPDATED, timestamp, ReserveParams.builder()
            .reserve(reserve)
            .priceUsdE8(priceUsdE8)
            .build());
    }

    private void startEpoch(long epochNumber, long startTime) {
        platform.apply(EventType.EPOCH_STARTED, startTime, EpochParams.builder()
            .epochNumber(epochNumber)
            .scheduledTime(startTime)
            .build());
    }

    private void supply(String user, BigInteger amount, long timestamp) {
        supply(user, USDC, amount, timestamp);
    }

    private void supply(String user, String reserve, BigInteger amount, long timestamp) {
        platform.apply(EventType.SUPPLY_MINTED, timestamp, BalanceParams.builder()
            .user(user)
            .reserve(reserve)
            .value(amount)
            .balanceIncrease(BigInteger.ZERO)
            .index(FixedPointMath.RAY)
            .build());
    }

    private void settle(String user, long timestamp) {
        platform.apply(EventType.KEEPER_USER_SETTLED, timestamp, KeeperParams.builder().user(user).build());
    }

    private static PointsAdjustmentParams adjustment(BigInteger points) {
        return PointsAdjustmentParams.builder()
            .user(ALICE)
            .points(points)
            .reason("campaign")
            .build();
    }
}
