package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.LpPositionParams;
import com.defipoints.platform.model.LpPosition;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.defipoints.platform.service.UserMultiplierService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
public class LpEventHandler extends AbstractEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(LpEventHandler.class);

    private final PointsStore store;
    private final PointsAccrualEngine engine;
    private final UserMultiplierService userMultiplierService;

    @Autowired
    public LpEventHandler(
            PointsStore store,
            PointsAccrualEngine engine,
            UserMultiplierService userMultiplierService,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.store = store;
        this.engine = engine;
        this.userMultiplierService = userMultiplierService;
    }

    /**
     * Settles the position at its previous value and range, then records the new state. A
     * change of owner moves the position between the owners' lists.
     */
    public void onPositionUpdated(ChainEvent event) {
        LpPositionParams params = bind(event, LpPositionParams.class);
        String positionId = require(params.getPositionId(), "positionId", event);
        String userId = requireAddress(params.getUser(), "user", event);
        long timestamp = event.getTimestamp();

        LpPosition position = store.findLpPosition(positionId).orElse(null);
        if (position == null) {
            position = LpPosition.builder()
                .positionId(positionId)
                .userId(userId)
                .valueUsdE8(BigInteger.ZERO)
                .lastSettledAt(timestamp)
                .points(BigInteger.ZERO)
                .build();
        } else {
            engine.settleUserLpPositions(position.getUserId(), timestamp);
            position = store.findLpPosition(positionId).orElse(position);
        }

        if (!userId.equals(position.getUserId())) {
            userMultiplierService.untrackLpPosition(position.getUserId(), positionId);
            position.setUserId(userId);
        }
        position.setValueUsdE8(params.getValueUsdE8() != null ? params.getValueUsdE8().max(BigInteger.ZERO) : BigInteger.ZERO);
        position.setInRange(params.getInRange() != null && params.getInRange());
        store.saveLpPosition(position);
        userMultiplierService.trackLpPosition(userId, positionId);

        logger.debug("LP position {} of user {} now worth {} (in range: {})", positionId, userId,
            position.getValueUsdE8(), position.isInRange());
    }
}
