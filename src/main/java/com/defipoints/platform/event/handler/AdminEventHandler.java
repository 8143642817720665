package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.AccountParams;
import com.defipoints.platform.event.params.PointsAdjustmentParams;
import com.defipoints.platform.event.params.VpTierParams;
import com.defipoints.platform.exception.InvalidRequestException;
import com.defipoints.platform.model.AuditType;
import com.defipoints.platform.model.BlacklistEntry;
import com.defipoints.platform.model.VotingPowerTier;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.service.AuditService;
import com.defipoints.platform.service.LeaderboardFacade;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Operator actions: blacklisting, manual point adjustments and voting power tiers.
 */
@Component
public class AdminEventHandler extends AbstractEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(AdminEventHandler.class);

    private final PointsStore store;
    private final PointsAccrualEngine engine;
    private final LeaderboardFacade leaderboardFacade;
    private final AuditService auditService;

    @Autowired
    public AdminEventHandler(
            PointsStore store,
            PointsAccrualEngine engine,
            LeaderboardFacade leaderboardFacade,
            AuditService auditService,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.store = store;
        this.engine = engine;
        this.leaderboardFacade = leaderboardFacade;
        this.auditService = auditService;
    }

    public void onAddressBlacklisted(ChainEvent event) {
        AccountParams params = bind(event, AccountParams.class);
        String userId = requireAddress(params.getUser(), "user", event);
        long timestamp = event.resolveTimestamp(params.getTimestamp());

        store.saveBlacklistEntry(BlacklistEntry.builder()
            .userId(userId)
            .blacklisted(true)
            .updatedAt(timestamp)
            .build());
        leaderboardFacade.removeUserFromLeaderboards(userId, timestamp);
        auditService.record(event, AuditType.BLACKLISTED, userId, null, null);
        logger.info("Blacklisted user {}", userId);
    }

    public void onAddressUnblacklisted(ChainEvent event) {
        AccountParams params = bind(event, AccountParams.class);
        String userId = requireAddress(params.getUser(), "user", event);
        long timestamp = event.resolveTimestamp(params.getTimestamp());

        store.saveBlacklistEntry(BlacklistEntry.builder()
            .userId(userId)
            .blacklisted(false)
            .updatedAt(timestamp)
            .build());
        auditService.record(event, AuditType.UNBLACKLISTED, userId, null, null);
        logger.info("Removed user {} from blacklist", userId);
    }

    public void onPointsAwarded(ChainEvent event) {
        adjustPoints(event, AuditType.POINTS_AWARDED, false);
    }

    public void onPointsRemoved(ChainEvent event) {
        adjustPoints(event, AuditType.POINTS_REMOVED, true);
    }

    private void adjustPoints(ChainEvent event, AuditType type, boolean removal) {
        PointsAdjustmentParams params = bind(event, PointsAdjustmentParams.class);
        String userId = requireAddress(params.getUser(), "user", event);
        BigInteger points = require(params.getPoints(), "points", event);
        if (points.signum() < 0) {
            throw new InvalidRequestException("Points for " + event.getEventName() + " cannot be negative");
        }
        long timestamp = event.resolveTimestamp(params.getTimestamp());

        auditService.record(event, type, userId, points, params.getReason());
        engine.applyManualPoints(userId, removal ? points.negate() : points, timestamp);
        logger.info("{} {} scaled points for user {}: {}", removal ? "Removed" : "Awarded", points, userId,
            params.getReason());
    }

    public void onVpTierAdded(ChainEvent event) {
        VpTierParams params = bind(event, VpTierParams.class);
        int tierIndex = require(params.getTierIndex(), "tierIndex", event);
        long timestamp = event.resolveTimestamp(params.getTimestamp());

        store.saveVotingPowerTier(VotingPowerTier.builder()
            .tierIndex(tierIndex)
            .minVotingPower(require(params.getMinVotingPower(), "minVotingPower", event))
            .multiplierBps(require(params.getMultiplierBps(), "multiplierBps", event))
            .active(true)
            .createdAt(timestamp)
            .updatedAt(timestamp)
            .build());
        auditService.record(event, AuditType.VP_TIER_CHANGED, null, null, "added tier " + tierIndex);
    }

    public void onVpTierUpdated(ChainEvent event) {
        VpTierParams params = bind(event, VpTierParams.class);
        int tierIndex = require(params.getTierIndex(), "tierIndex", event);
        VotingPowerTier tier = store.findVotingPowerTier(tierIndex).orElse(null);
        if (tier == null) {
            logger.warn("Skipping update of unknown voting power tier {}", tierIndex);
        } else {
            if (params.getMinVotingPower() != null) {
                tier.setMinVotingPower(params.getMinVotingPower());
            }
            if (params.getMultiplierBps() != null) {
                tier.setMultiplierBps(params.getMultiplierBps());
            }
            tier.setUpdatedAt(event.resolveTimestamp(params.getTimestamp()));
            store.saveVotingPowerTier(tier);
        }
        auditService.record(event, AuditType.VP_TIER_CHANGED, null, null, "updated tier " + tierIndex);
    }

    public void onVpTierRemoved(ChainEvent event) {
        VpTierParams params = bind(event, VpTierParams.class);
        int tierIndex = require(params.getTierIndex(), "tierIndex", event);
        store.findVotingPowerTier(tierIndex).ifPresent(tier -> {
            tier.setActive(false);
            tier.setUpdatedAt(event.getTimestamp());
            store.saveVotingPowerTier(tier);
        });
        auditService.record(event, AuditType.VP_TIER_CHANGED, null, null, "removed tier " + tierIndex);
    }
}
