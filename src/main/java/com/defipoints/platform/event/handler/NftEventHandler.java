package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.NftMultiplierParams;
import com.defipoints.platform.event.params.NftPartnershipParams;
import com.defipoints.platform.event.params.NftTransferParams;
import com.defipoints.platform.model.AuditType;
import com.defipoints.platform.model.NftMultiplierConfig;
import com.defipoints.platform.model.NftPartnership;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.service.AuditService;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.defipoints.platform.service.UserMultiplierService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Partner NFT registry and ownership changes.
 */
@Component
public class NftEventHandler extends AbstractEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(NftEventHandler.class);

    private final PointsStore store;
    private final PointsAccrualEngine engine;
    private final UserMultiplierService userMultiplierService;
    private final AuditService auditService;

    @Autowired
    public NftEventHandler(
            PointsStore store,
            PointsAccrualEngine engine,
            UserMultiplierService userMultiplierService,
            AuditService auditService,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.store = store;
        this.engine = engine;
        this.userMultiplierService = userMultiplierService;
        this.auditService = auditService;
    }

    public void onPartnershipAdded(ChainEvent event) {
        NftPartnershipParams params = bind(event, NftPartnershipParams.class);
        String collection = requireAddress(params.getCollection(), "collection", event);
        long timestamp = event.getTimestamp();

        NftPartnership partnership = store.findNftPartnership(collection).orElseGet(() -> NftPartnership.builder()
            .collection(collection)
            .createdAt(timestamp)
            .build());
        applyPartnership(partnership, params, timestamp);
        store.saveNftPartnership(partnership);

        if (params.getFirstBonusBps() != null && params.getDecayRatioBps() != null) {
            saveMultiplierConfig(params.getFirstBonusBps(), params.getDecayRatioBps(), timestamp);
        }
        auditService.record(event, AuditType.NFT_PARTNERSHIP_CHANGED, null, null, "added " + collection);
        logger.info("NFT partnership {} added (active: {})", collection, partnership.isActive());
    }

    public void onPartnershipUpdated(ChainEvent event) {
        NftPartnershipParams params = bind(event, NftPartnershipParams.class);
        String collection = requireAddress(params.getCollection(), "collection", event);

        NftPartnership partnership = store.findNftPartnership(collection).orElse(null);
        if (partnership == null) {
            logger.warn("Skipping update of unknown NFT partnership {}", collection);
        } else {
            applyPartnership(partnership, params, event.getTimestamp());
            store.saveNftPartnership(partnership);
        }
        auditService.record(event, AuditType.NFT_PARTNERSHIP_CHANGED, null, null, "updated " + collection);
    }

    public void onPartnershipRemoved(ChainEvent event) {
        NftPartnershipParams params = bind(event, NftPartnershipParams.class);
        String collection = requireAddress(params.getCollection(), "collection", event);

        store.findNftPartnership(collection).ifPresent(partnership -> {
            partnership.setActive(false);
            partnership.setUpdatedAt(event.getTimestamp());
            store.saveNftPartnership(partnership);
        });
        auditService.record(event, AuditType.NFT_PARTNERSHIP_CHANGED, null, null, "removed " + collection);
        logger.info("NFT partnership {} removed", collection);
    }

    public void onMultiplierParamsUpdated(ChainEvent event) {
        NftMultiplierParams params = bind(event, NftMultiplierParams.class);
        saveMultiplierConfig(
            require(params.getFirstBonusBps(), "firstBonusBps", event),
            require(params.getDecayRatioBps(), "decayRatioBps", event),
            event.resolveTimestamp(params.getTimestamp()));
        auditService.record(event, AuditType.NFT_PARTNERSHIP_CHANGED, null, null, "multiplier params");
    }

    /**
     * One token moves between holders. Each side's balance shifts by one; a holder crossing
     * between zero and non-zero is settled at the old multiplier before the new one applies.
     */
    public void onPartnerNftTransferred(ChainEvent event) {
        NftTransferParams params = bind(event, NftTransferParams.class);
        String collection = params.getCollection() != null
            ? normalizeAddress(params.getCollection())
            : requireAddress(event.getSourceAddress(), "collection", event);
        String from = normalizeAddress(params.getFrom());
        String to = normalizeAddress(params.getTo());

        if (from != null && from.equals(to)) {
            return;
        }
        if (!isZeroAddress(from)) {
            applyDelta(event, from, collection, -1);
        }
        if (!isZeroAddress(to)) {
            applyDelta(event, to, collection, 1);
        }
    }

    private void applyDelta(ChainEvent event, String userId, String collection, int delta) {
        long timestamp = event.getTimestamp();
        long balance = userMultiplierService.nftBalance(userId, collection) + delta;
        boolean wouldFlip = (balance > 0) != (balance - delta > 0);

        if (wouldFlip) {
            engine.settleUser(userId, null, timestamp, event.getBlockNumber(), true);
        }
        boolean flipped = userMultiplierService.updateNftBalance(userId, collection, balance, timestamp);
        if (flipped) {
            userMultiplierService.refreshState(userId, timestamp);
            logger.debug("User {} {} collection {}", userId, balance > 0 ? "now holds" : "no longer holds", collection);
        }
    }

    private void applyPartnership(NftPartnership partnership, NftPartnershipParams params, long timestamp) {
        if (params.getName() != null) {
            partnership.setName(params.getName());
        }
        partnership.setActive(params.getActive() == null || params.getActive());
        if (params.getStartTimestamp() != null) {
            partnership.setStartTimestamp(params.getStartTimestamp());
        }
        Long end = params.getEndTimestamp();
        partnership.setEndTimestamp(end != null && end > 0 ? end : null);
        partnership.setUpdatedAt(timestamp);
    }

    private void saveMultiplierConfig(long firstBonusBps, long decayRatioBps, long timestamp) {
        store.saveNftMultiplierConfig(NftMultiplierConfig.builder()
            .firstBonusBps(firstBonusBps)
            .decayRatioBps(decayRatioBps)
            .lastUpdate(timestamp)
            .build());
        logger.info("NFT multiplier params set to first bonus {} bps, decay {} bps", firstBonusBps, decayRatioBps);
    }
}
