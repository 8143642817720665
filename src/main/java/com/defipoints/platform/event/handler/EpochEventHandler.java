package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.EpochParams;
import com.defipoints.platform.model.AuditType;
import com.defipoints.platform.model.LeaderboardEpoch;
import com.defipoints.platform.service.AuditService;
import com.defipoints.platform.service.EpochSettlementCoordinator;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EpochEventHandler extends AbstractEventHandler {

    private final EpochSettlementCoordinator coordinator;
    private final PointsAccrualEngine engine;
    private final AuditService auditService;

    @Autowired
    public EpochEventHandler(
            EpochSettlementCoordinator coordinator,
            PointsAccrualEngine engine,
            AuditService auditService,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.coordinator = coordinator;
        this.engine = engine;
        this.auditService = auditService;
    }

    public void onEpochStarted(ChainEvent event) {
        EpochParams params = bind(event, EpochParams.class);
        long epochNumber = require(params.getEpochNumber(), "epochNumber", event);
        long scheduledStart = event.resolveTimestamp(params.getScheduledTime());

        closeOut(coordinator.onEpochStart(epochNumber, scheduledStart, event.getTimestamp(), event.getBlockNumber()));
        auditService.record(event, AuditType.EPOCH_STARTED, null, null, "epoch " + epochNumber + " start " + scheduledStart);
    }

    public void onEpochEnded(ChainEvent event) {
        EpochParams params = bind(event, EpochParams.class);
        long epochNumber = require(params.getEpochNumber(), "epochNumber", event);
        long scheduledEnd = event.resolveTimestamp(params.getScheduledTime());

        closeOut(coordinator.onEpochEnd(epochNumber, scheduledEnd, event.getTimestamp(), event.getBlockNumber()));
        auditService.record(event, AuditType.EPOCH_ENDED, null, null, "epoch " + epochNumber + " end " + scheduledEnd);
    }

    /**
     * Applies every epoch transition due at {@code timestamp}. Runs ahead of each event.
     */
    public void applyScheduledTransitions(long timestamp, long blockNumber) {
        closeOut(coordinator.applyScheduledTransitions(timestamp, blockNumber));
    }

    private void closeOut(List<LeaderboardEpoch> endedEpochs) {
        for (LeaderboardEpoch epoch : endedEpochs) {
            engine.settleAllLpPositions(epoch);
        }
    }
}
