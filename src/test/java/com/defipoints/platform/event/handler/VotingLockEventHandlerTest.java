package com.defipoints.platform.event.handler;

import com.defipoints.platform.PointsPlatformFixture;
import com.defipoints.platform.event.EventType;
import com.defipoints.platform.event.params.LockParams;
import com.defipoints.platform.event.params.LockTransferParams;
import com.defipoints.platform.event.params.VpTierParams;
import com.defipoints.platform.math.FixedPointMath;
import com.defipoints.platform.model.UserLeaderboardState;
import com.defipoints.platform.model.VotingLock;
import com.defipoints.platform.service.MultiplierResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class VotingLockEventHandlerTest {

    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";
    private static final String TOKEN_ID = "7";
    private static final BigInteger THOUSAND = FixedPointMath.WAD.multiply(BigInteger.valueOf(1_000));

    private PointsPlatformFixture platform;

    @BeforeEach
    void setUp() {
        platform = new PointsPlatformFixture();
        platform.apply(EventType.VP_TIER_ADDED, 10, VpTierParams.builder()
            .tierIndex(1)
            .minVotingPower(FixedPointMath.WAD.multiply(BigInteger.valueOf(100)))
            .multiplierBps(15_000L)
            .build());
    }

    @Test
    void testUnlockEnd_RoundsDownToWeek() {
        assertEquals(52 * VotingLockEventHandler.SECONDS_PER_WEEK, VotingLockEventHandler.unlockEnd(0));
        assertEquals(32_054_400L, VotingLockEventHandler.unlockEnd(1_000_000L));
        assertEquals(0, VotingLockEventHandler.unlockEnd(1_000_000L) % VotingLockEventHandler.SECONDS_PER_WEEK);
    }

    @Test
    void testLockDeposited_RaisesVotingPowerTier() {
        // Act
        deposit(1_000, THOUSAND, 1_000 + MultiplierResolver.MAX_LOCK_SECONDS);

        // Assert
        UserLeaderboardState state = platform.store.findUserState(ALICE).orElseThrow();
        assertEquals(THOUSAND, state.getVotingPower());
        assertEquals(1L, state.getVpTierIndex());
        assertEquals(15_000L, state.getVpMultiplierBps());
        assertEquals(15_000L, state.getCombinedMultiplierBps());

        VotingLock lock = platform.store.findVotingLock(TOKEN_ID).orElseThrow();
        assertEquals(ALICE, lock.getOwner());
        assertEquals(THOUSAND, lock.getLockedAmount());
    }

    @Test
    void testLockWithdrawn_DropsBackToBaseMultiplier() {
        // Arrange
        deposit(1_000, THOUSAND, 1_000 + MultiplierResolver.MAX_LOCK_SECONDS);

        // Act
        platform.apply(EventType.LOCK_WITHDRAWN, 2_000, LockParams.builder()
            .tokenId(TOKEN_ID)
            .amount(THOUSAND.multiply(BigInteger.TWO))
            .build());

        // Assert
        assertEquals(BigInteger.ZERO, platform.store.findVotingLock(TOKEN_ID).orElseThrow().getLockedAmount());
        UserLeaderboardState state = platform.store.findUserState(ALICE).orElseThrow();
        assertEquals(BigInteger.ZERO, state.getVotingPower());
        assertEquals(10_000L, state.getCombinedMultiplierBps());
    }

    @Test
    void testLockPermanent_KeepsFullVotingPower() {
        // Arrange
        deposit(1_000, THOUSAND, 1_000 + MultiplierResolver.MAX_LOCK_SECONDS / 2);

        // Act
        platform.apply(EventType.LOCK_PERMANENT, 2_000, LockParams.builder().tokenId(TOKEN_ID).build());

        // Assert
        VotingLock lock = platform.store.findVotingLock(TOKEN_ID).orElseThrow();
        assertTrue(lock.isPermanent());
        assertEquals(0L, lock.getLockEnd());
        assertEquals(THOUSAND, platform.store.findUserState(ALICE).orElseThrow().getVotingPower());
    }

    @Test
    void testLockUnlockedPermanent_DecaysAgain() {
        // Arrange
        deposit(1_000, THOUSAND, 0L);
        platform.apply(EventType.LOCK_PERMANENT, 1_500, LockParams.builder().tokenId(TOKEN_ID).build());

        // Act
        platform.apply(EventType.LOCK_UNLOCKED_PERMANENT, 2_000,
            LockParams.builder().tokenId(TOKEN_ID).timestamp(1_000_000L).build());

        // Assert
        VotingLock lock = platform.store.findVotingLock(TOKEN_ID).orElseThrow();
        assertFalse(lock.isPermanent());
        assertEquals(32_054_400L, lock.getLockEnd());
    }

    @Test
    void testLockTransferred_MovesVotingPower() {
        // Arrange
        deposit(1_000, THOUSAND, 1_000 + MultiplierResolver.MAX_LOCK_SECONDS);

        // Act
        platform.apply(EventType.LOCK_TRANSFERRED, 1_000, LockTransferParams.builder()
            .tokenId(TOKEN_ID)
            .from(ALICE)
            .to(BOB)
            .build());

        // Assert
        assertEquals(BOB, platform.store.findVotingLock(TOKEN_ID).orElseThrow().getOwner());
        assertEquals(BigInteger.ZERO, platform.store.findUserState(ALICE).orElseThrow().getVotingPower());
        UserLeaderboardState bob = platform.store.findUserState(BOB).orElseThrow();
        assertEquals(THOUSAND, bob.getVotingPower());
        assertEquals(15_000L, bob.getVpMultiplierBps());
    }

    private void deposit(long timestamp, BigInteger amount, long lockEnd) {
        platform.apply(EventType.LOCK_DEPOSITED, timestamp, LockParams.builder()
            .tokenId(TOKEN_ID)
            .owner(ALICE)
            .amount(amount)
            .lockEnd(lockEnd)
            .build());
    }
}
