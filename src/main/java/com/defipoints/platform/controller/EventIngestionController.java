package com.defipoints.platform.controller;

import com.defipoints.platform.dto.EventBatchRequest;
import com.defipoints.platform.dto.EventIngestionResponse;
import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.EventDispatcher;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/events")
public class EventIngestionController {

    private static final Logger logger = LoggerFactory.getLogger(EventIngestionController.class);

    private final EventDispatcher eventDispatcher;

    @Autowired
    public EventIngestionController(EventDispatcher eventDispatcher) {
        this.eventDispatcher = eventDispatcher;
    }

    /**
     * Apply a single chain event.
     * POST /api/v1/events
     */
    @PostMapping
    public ResponseEntity<EventIngestionResponse> ingest(@Valid @RequestBody ChainEvent event) {
        logger.info("Received event {} - block: {}, logIndex: {}, tx: {}",
            event.getEventName(), event.getBlockNumber(), event.getLogIndex(), event.getTransactionHash());

        try {
            boolean applied = eventDispatcher.apply(event);
            return ResponseEntity.ok(buildResponse(List.of(event), applied ? 1 : 0));
        } catch (Exception e) {
            logger.error("Error applying event {} - block: {}, logIndex: {}, error: {}",
                event.getEventName(), event.getBlockNumber(), event.getLogIndex(), e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Apply an ordered batch of chain events.
     * POST /api/v1/events/batch
     */
    @PostMapping("/batch")
    public ResponseEntity<EventIngestionResponse> ingestBatch(@Valid @RequestBody EventBatchRequest request) {
        List<ChainEvent> events = request.getEvents();
        logger.info("Received batch of {} events", events.size());

        int applied = 0;
        ChainEvent current = null;
        try {
            for (ChainEvent event : events) {
                current = event;
                if (eventDispatcher.apply(event)) {
                    applied++;
                }
            }
            logger.info("Applied {} of {} events", applied, events.size());
            return ResponseEntity.ok(buildResponse(events, applied));
        } catch (Exception e) {
            logger.error("Error applying batch after {} events - failed at {} block: {}, logIndex: {}, error: {}",
                applied, current.getEventName(), current.getBlockNumber(), current.getLogIndex(), e.getMessage(), e);
            throw e;
        }
    }

    private static EventIngestionResponse buildResponse(List<ChainEvent> events, int applied) {
        ChainEvent last = events.get(events.size() - 1);
        return EventIngestionResponse.builder()
            .received(events.size())
            .applied(applied)
            .skipped(events.size() - applied)
            .lastBlockNumber(last.getBlockNumber())
            .lastLogIndex(last.getLogIndex())
            .processedAt(Instant.now())
            .build();
    }
}
