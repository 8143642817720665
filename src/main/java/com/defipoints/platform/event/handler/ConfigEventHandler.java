package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.ConfigSnapshotParams;
import com.defipoints.platform.event.params.DailyBonusParams;
import com.defipoints.platform.event.params.ValueUpdateParams;
import com.defipoints.platform.math.FixedPointMath;
import com.defipoints.platform.model.AuditType;
import com.defipoints.platform.model.DailyAction;
import com.defipoints.platform.model.LeaderboardConfig;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.service.AuditService;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Points parameter changes. Every change is persisted as a whole {@link LeaderboardConfig}.
 */
@Component
public class ConfigEventHandler extends AbstractEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConfigEventHandler.class);

    private final PointsStore store;
    private final PointsAccrualEngine engine;
    private final AuditService auditService;

    @Autowired
    public ConfigEventHandler(
            PointsStore store,
            PointsAccrualEngine engine,
            AuditService auditService,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.store = store;
        this.engine = engine;
        this.auditService = auditService;
    }

    /**
     * Replaces every parameter carried by the snapshot. The LP rate is not part of it and is kept.
     */
    public void onConfigSnapshot(ChainEvent event) {
        ConfigSnapshotParams params = bind(event, ConfigSnapshotParams.class);
        LeaderboardConfig config = engine.config().toBuilder()
            .depositRateBps(require(params.getDepositRateBps(), "depositRateBps", event))
            .borrowRateBps(require(params.getBorrowRateBps(), "borrowRateBps", event))
            .vpRateBps(params.getVpRateBps() != null ? params.getVpRateBps() : 0L)
            .supplyDailyBonus(fromWad(params.getSupplyDailyBonus()))
            .borrowDailyBonus(fromWad(params.getBorrowDailyBonus()))
            .repayDailyBonus(fromWad(params.getRepayDailyBonus()))
            .withdrawDailyBonus(fromWad(params.getWithdrawDailyBonus()))
            .cooldownSeconds(params.getCooldownSeconds() != null ? params.getCooldownSeconds() : 0L)
            .minDailyBonusUsd(params.getMinDailyBonusUsd() != null ? params.getMinDailyBonusUsd() : 0d)
            .lastUpdate(event.resolveTimestamp(params.getTimestamp()))
            .build();
        save(event, config, "snapshot");
    }

    public void onDepositRateUpdated(ChainEvent event) {
        ValueUpdateParams params = bind(event, ValueUpdateParams.class);
        LeaderboardConfig config = engine.config();
        config.setDepositRateBps(requireValue(params, event).longValue());
        config.setLastUpdate(event.resolveTimestamp(params.getTimestamp()));
        save(event, config, "depositRateBps=" + config.getDepositRateBps());
    }

    public void onBorrowRateUpdated(ChainEvent event) {
        ValueUpdateParams params = bind(event, ValueUpdateParams.class);
        LeaderboardConfig config = engine.config();
        config.setBorrowRateBps(requireValue(params, event).longValue());
        config.setLastUpdate(event.resolveTimestamp(params.getTimestamp()));
        save(event, config, "borrowRateBps=" + config.getBorrowRateBps());
    }

    public void onVpRateUpdated(ChainEvent event) {
        ValueUpdateParams params = bind(event, ValueUpdateParams.class);
        LeaderboardConfig config = engine.config();
        config.setVpRateBps(requireValue(params, event).longValue());
        config.setLastUpdate(event.resolveTimestamp(params.getTimestamp()));
        save(event, config, "vpRateBps=" + config.getVpRateBps());
    }

    public void onLpRateUpdated(ChainEvent event) {
        ValueUpdateParams params = bind(event, ValueUpdateParams.class);
        LeaderboardConfig config = engine.config();
        config.setLpRateBps(requireValue(params, event).longValue());
        config.setLastUpdate(event.resolveTimestamp(params.getTimestamp()));
        save(event, config, "lpRateBps=" + config.getLpRateBps());
    }

    public void onDailyBonusUpdated(ChainEvent event) {
        DailyBonusParams params = bind(event, DailyBonusParams.class);
        LeaderboardConfig config = engine.config();
        setBonusIfPresent(config, DailyAction.SUPPLY, params.getSupplyBonus());
        setBonusIfPresent(config, DailyAction.BORROW, params.getBorrowBonus());
        setBonusIfPresent(config, DailyAction.REPAY, params.getRepayBonus());
        setBonusIfPresent(config, DailyAction.WITHDRAW, params.getWithdrawBonus());
        config.setLastUpdate(event.resolveTimestamp(params.getTimestamp()));
        save(event, config, "dailyBonus");
    }

    public void onCooldownUpdated(ChainEvent event) {
        ValueUpdateParams params = bind(event, ValueUpdateParams.class);
        LeaderboardConfig config = engine.config();
        config.setCooldownSeconds(Math.max(0L, requireValue(params, event).longValue()));
        config.setLastUpdate(event.resolveTimestamp(params.getTimestamp()));
        save(event, config, "cooldownSeconds=" + config.getCooldownSeconds());
    }

    public void onMinDailyBonusUsdUpdated(ChainEvent event) {
        ValueUpdateParams params = bind(event, ValueUpdateParams.class);
        LeaderboardConfig config = engine.config();
        config.setMinDailyBonusUsd(Math.max(0d, requireValue(params, event)));
        config.setLastUpdate(event.resolveTimestamp(params.getTimestamp()));
        save(event, config, "minDailyBonusUsd=" + config.getMinDailyBonusUsd());
    }

    private void save(ChainEvent event, LeaderboardConfig config, String detail) {
        store.saveConfig(config);
        auditService.record(event, AuditType.CONFIG_UPDATED, null, null, detail);
        logger.info("Points config updated by {}: {}", event.getEventName(), detail);
    }

    private static Double requireValue(ValueUpdateParams params, ChainEvent event) {
        return require(params.getValue(), "value", event);
    }

    private static void setBonusIfPresent(LeaderboardConfig config, DailyAction action, BigInteger wad) {
        if (wad != null) {
            config.setDailyBonus(action, fromWad(wad));
        }
    }

    private static double fromWad(BigInteger wad) {
        return wad == null ? 0d : FixedPointMath.toDecimal(wad, 18);
    }
}
