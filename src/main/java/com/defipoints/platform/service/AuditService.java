package com.defipoints.platform.service;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.model.AuditRecord;
import com.defipoints.platform.model.AuditType;
import com.defipoints.platform.repository.PointsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Writes one audit row per admin or lifecycle event, keyed by transaction hash and log index.
 */
@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final PointsStore store;

    @Autowired
    public AuditService(PointsStore store) {
        this.store = store;
    }

    public AuditRecord record(ChainEvent event, AuditType type, String userId, BigInteger amount, String detail) {
        AuditRecord record = AuditRecord.builder()
            .id(AuditRecord.key(event.getTransactionHash(), event.getLogIndex()))
            .type(type)
            .userId(userId)
            .amount(amount)
            .detail(detail)
            .blockNumber(event.getBlockNumber())
            .timestamp(event.getTimestamp())
            .build();
        store.saveAuditRecord(record);
        logger.debug("Recorded {} audit row {}", type, record.getId());
        return record;
    }
}
