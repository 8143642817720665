package com.defipoints.platform.event;

import com.defipoints.platform.PointsPlatformFixture;
import com.defipoints.platform.event.params.BalanceParams;
import com.defipoints.platform.event.params.ConfigSnapshotParams;
import com.defipoints.platform.event.params.EpochParams;
import com.defipoints.platform.event.params.KeeperParams;
import com.defipoints.platform.event.params.ReserveParams;
import com.defipoints.platform.exception.InvalidRequestException;
import com.defipoints.platform.math.FixedPointMath;
import com.defipoints.platform.model.LeaderboardState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class EventDispatcherTest {

    private static final String USDC = "0xusdc";
    private static final String ALICE = "0xalice";

    private PointsPlatformFixture platform;

    @BeforeEach
    void setUp() {
        platform = new PointsPlatformFixture();
        platform.apply(EventType.CONFIG_SNAPSHOT, 10, ConfigSnapshotParams.builder()
            .depositRateBps(10_000L)
            .borrowRateBps(0L)
            .cooldownSeconds(0L)
            .build());
        platform.apply(EventType.RESERVE_INITIALIZED, 20, ReserveParams.builder()
            .reserve(USDC)
            .decimals(6)
            .priceUsdE8(BigInteger.valueOf(100_000_000L))
            .build());
        platform.apply(EventType.EPOCH_STARTED, 100, EpochParams.builder().epochNumber(1L).scheduledTime(100L).build());
    }

    @Test
    void testApply_ReplayedEventIsSkipped() {
        // Arrange
        ChainEvent mint = platform.event(EventType.SUPPLY_MINTED, 1_000, BalanceParams.builder()
            .user(ALICE)
            .reserve(USDC)
            .value(BigInteger.valueOf(1_000_000_000L))
            .balanceIncrease(BigInteger.ZERO)
            .index(FixedPointMath.RAY)
            .build());
        ChainEvent settle = platform.event(EventType.KEEPER_USER_SETTLED, 4_600,
            KeeperParams.builder().user(ALICE).build());
        assertTrue(platform.dispatcher.apply(mint));
        assertTrue(platform.dispatcher.apply(settle));
        BigInteger total = platform.store.findUserEpochStats(ALICE, 1).orElseThrow().getTotalPoints();

        // Act
        boolean mintReplayed = platform.dispatcher.apply(mint);
        boolean settleReplayed = platform.dispatcher.apply(settle);

        // Assert
        assertFalse(mintReplayed);
        assertFalse(settleReplayed);
        assertEquals(total, platform.store.findUserEpochStats(ALICE, 1).orElseThrow().getTotalPoints());
        assertEquals(BigInteger.valueOf(1_000_000_000L),
            platform.store.findUserReserve(ALICE, USDC).orElseThrow().getScaledATokenBalance());
    }

    @Test
    void testApply_SameBlockHigherLogIndexIsApplied() {
        // Arrange
        ChainEvent first = platform.event(EventType.KEEPER_USER_SETTLED, 500, KeeperParams.builder().user(ALICE).build());
        ChainEvent second = sameBlock(first, 1, "0xother");
        ChainEvent stale = sameBlock(first, 0, "0xstale");

        // Act & Assert
        assertTrue(platform.dispatcher.apply(second));
        assertFalse(platform.dispatcher.apply(stale));

        LeaderboardState state = platform.store.findState().orElseThrow();
        assertEquals(second.getBlockNumber(), state.getLastBlockNumber());
        assertEquals(1, state.getLastLogIndex());
    }

    @Test
    void testApply_ReplayGuardDisabled() {
        // Arrange
        platform.properties.getReplay().setGuardEnabled(false);
        ChainEvent settle = platform.event(EventType.KEEPER_USER_SETTLED, 500, KeeperParams.builder().user(ALICE).build());

        // Act & Assert
        assertTrue(platform.dispatcher.apply(settle));
        assertTrue(platform.dispatcher.apply(settle));
    }

    @Test
    void testApply_MissingEventName() {
        ChainEvent event = ChainEvent.builder().blockNumber(1L).timestamp(1L).logIndex(0).transactionHash("0x1").build();
        assertThrows(InvalidRequestException.class, () -> platform.dispatcher.apply(event));
    }

    @Test
    void testApply_MissingParams() {
        ChainEvent event = ChainEvent.builder()
            .blockNumber(99L)
            .timestamp(1_000L)
            .logIndex(0)
            .transactionHash("0x1")
            .eventName(EventType.SUPPLY_MINTED)
            .build();

        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
            () -> platform.dispatcher.apply(event));
        assertTrue(exception.getMessage().contains("SUPPLY_MINTED"));
    }

    @Test
    void testApply_MissingRequiredParam() {
        ChainEvent event = platform.event(EventType.SUPPLY_MINTED, 1_000, BalanceParams.builder()
            .user(ALICE)
            .reserve(USDC)
            .index(FixedPointMath.RAY)
            .build());

        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
            () -> platform.dispatcher.apply(event));
        assertTrue(exception.getMessage().contains("value"));
    }

    @Test
    void testApply_ScheduledEpochStartsBeforeRouting() {
        // Arrange
        platform.apply(EventType.EPOCH_STARTED, 200, EpochParams.builder().epochNumber(2L).scheduledTime(5_000L).build());

        // Act
        platform.apply(EventType.KEEPER_USER_SETTLED, 6_000, KeeperParams.builder().user(ALICE).build());

        // Assert
        LeaderboardState state = platform.store.findState().orElseThrow();
        assertEquals(2L, state.getCurrentEpochNumber());
        assertTrue(state.isActive());
        assertEquals(5_000L, platform.store.findEpoch(1).orElseThrow().getEndTime());
    }

    @Test
    void testWithLock_RunsAction() {
        AtomicBoolean ran = new AtomicBoolean(false);
        platform.dispatcher.withLock(() -> ran.set(true));
        assertTrue(ran.get());
    }

    private static ChainEvent sameBlock(ChainEvent event, int logIndex, String transactionHash) {
        return ChainEvent.builder()
            .blockNumber(event.getBlockNumber())
            .timestamp(event.getTimestamp())
            .logIndex(logIndex)
            .transactionHash(transactionHash)
            .eventName(event.getEventName())
            .params(event.getParams())
            .build();
    }
}
