package com.defipoints.platform.event.handler;

import com.defipoints.platform.PointsPlatformFixture;
import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.EventType;
import com.defipoints.platform.event.params.ConfigSnapshotParams;
import com.defipoints.platform.event.params.DailyBonusParams;
import com.defipoints.platform.event.params.ValueUpdateParams;
import com.defipoints.platform.exception.InvalidRequestException;
import com.defipoints.platform.math.FixedPointMath;
import com.defipoints.platform.model.AuditRecord;
import com.defipoints.platform.model.AuditType;
import com.defipoints.platform.model.LeaderboardConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConfigEventHandlerTest {

    private PointsPlatformFixture platform;

    @BeforeEach
    void setUp() {
        platform = new PointsPlatformFixture();
    }

    @Test
    void testConfigSnapshot_ConvertsWadBonusesAndKeepsLpRate() {
        // Arrange
        platform.apply(EventType.LP_RATE_UPDATED, 10, ValueUpdateParams.builder().value(500d).build());

        // Act
        platform.apply(EventType.CONFIG_SNAPSHOT, 20, ConfigSnapshotParams.builder()
            .depositRateBps(10_000L)
            .borrowRateBps(20_000L)
            .supplyDailyBonus(FixedPointMath.WAD.multiply(BigInteger.valueOf(5)))
            .withdrawDailyBonus(FixedPointMath.WAD.divide(BigInteger.TWO))
            .cooldownSeconds(3_600L)
            .build());

        // Assert
        LeaderboardConfig config = platform.store.findConfig().orElseThrow();
        assertEquals(10_000L, config.getDepositRateBps());
        assertEquals(20_000L, config.getBorrowRateBps());
        assertEquals(0L, config.getVpRateBps());
        assertEquals(500L, config.getLpRateBps());
        assertEquals(5.0, config.getSupplyDailyBonus());
        assertEquals(0.0, config.getBorrowDailyBonus());
        assertEquals(0.5, config.getWithdrawDailyBonus());
        assertEquals(3_600L, config.getCooldownSeconds());
        assertEquals(0.0, config.getMinDailyBonusUsd());
        assertEquals(20L, config.getLastUpdate());
    }

    @Test
    void testConfigSnapshot_MissingDepositRate() {
        ChainEvent event = platform.event(EventType.CONFIG_SNAPSHOT, 20,
            ConfigSnapshotParams.builder().borrowRateBps(1L).build());

        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
            () -> platform.dispatcher.apply(event));
        assertTrue(exception.getMessage().contains("depositRateBps"));
        assertTrue(platform.store.findConfig().isEmpty());
    }

    @Test
    void testDailyBonusUpdated_OnlyChangesProvidedBonuses() {
        // Arrange
        platform.apply(EventType.CONFIG_SNAPSHOT, 20, ConfigSnapshotParams.builder()
            .depositRateBps(1L)
            .borrowRateBps(1L)
            .supplyDailyBonus(FixedPointMath.WAD)
            .build());

        // Act
        platform.apply(EventType.DAILY_BONUS_UPDATED, 30, DailyBonusParams.builder()
            .borrowBonus(FixedPointMath.WAD.multiply(BigInteger.valueOf(3)))
            .build());

        // Assert
        LeaderboardConfig config = platform.store.findConfig().orElseThrow();
        assertEquals(1.0, config.getSupplyDailyBonus());
        assertEquals(3.0, config.getBorrowDailyBonus());
        assertEquals(30L, config.getLastUpdate());
    }

    @Test
    void testCooldownUpdated_ClampedAtZero() {
        platform.apply(EventType.COOLDOWN_UPDATED, 30, ValueUpdateParams.builder().value(-5d).build());

        assertEquals(0L, platform.store.findConfig().orElseThrow().getCooldownSeconds());
    }

    @Test
    void testRateUpdated_WritesAuditRecord() {
        // Arrange
        ChainEvent event = platform.event(EventType.DEPOSIT_RATE_UPDATED, 40,
            ValueUpdateParams.builder().value(2_500d).timestamp(35L).build());

        // Act
        platform.dispatcher.apply(event);

        // Assert
        LeaderboardConfig config = platform.store.findConfig().orElseThrow();
        assertEquals(2_500L, config.getDepositRateBps());
        assertEquals(35L, config.getLastUpdate());

        AuditRecord record = platform.store
            .findAuditRecord(AuditRecord.key(event.getTransactionHash(), event.getLogIndex()))
            .orElseThrow();
        assertEquals(AuditType.CONFIG_UPDATED, record.getType());
        assertEquals("depositRateBps=2500", record.getDetail());
    }
}
