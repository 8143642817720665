package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.KeeperParams;
import com.defipoints.platform.model.AuditType;
import com.defipoints.platform.service.AuditService;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.defipoints.platform.service.UserMultiplierService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Off-chain keeper corrections and forced settlements.
 */
@Component
public class KeeperEventHandler extends AbstractEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(KeeperEventHandler.class);

    private final PointsAccrualEngine engine;
    private final UserMultiplierService userMultiplierService;
    private final AuditService auditService;

    @Autowired
    public KeeperEventHandler(
            PointsAccrualEngine engine,
            UserMultiplierService userMultiplierService,
            AuditService auditService,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.engine = engine;
        this.userMultiplierService = userMultiplierService;
        this.auditService = auditService;
    }

    public void onVotingPowerSynced(ChainEvent event) {
        KeeperParams params = bind(event, KeeperParams.class);
        String userId = requireAddress(params.getUser(), "user", event);
        long timestamp = event.resolveTimestamp(params.getTimestamp());

        userMultiplierService.applyVotingPower(userId, require(params.getVotingPower(), "votingPower", event), timestamp);
        logger.debug("Keeper synced voting power of user {} to {}", userId, params.getVotingPower());
    }

    /**
     * Sets the user's balance in a collection absolutely, re-deriving the multiplier when the
     * user starts or stops holding it.
     */
    public void onNftBalanceSynced(ChainEvent event) {
        KeeperParams params = bind(event, KeeperParams.class);
        String userId = requireAddress(params.getUser(), "user", event);
        String collection = requireAddress(params.getCollection(), "collection", event);
        long balance = require(params.getBalance(), "balance", event);
        long timestamp = event.resolveTimestamp(params.getTimestamp());

        if (userMultiplierService.updateNftBalance(userId, collection, balance, timestamp)) {
            userMultiplierService.refreshState(userId, timestamp);
        }
        logger.debug("Keeper synced NFT balance of user {} in {} to {}", userId, collection, balance);
    }

    public void onUserSettled(ChainEvent event) {
        KeeperParams params = bind(event, KeeperParams.class);
        String userId = requireAddress(params.getUser(), "user", event);
        long timestamp = event.resolveTimestamp(params.getTimestamp());

        auditService.record(event, AuditType.USER_SETTLED, userId, null, null);
        engine.settleAllReserves(userId, timestamp, event.getBlockNumber());
    }
}
