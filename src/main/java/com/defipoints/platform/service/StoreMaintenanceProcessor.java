package com.defipoints.platform.service;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.event.EventDispatcher;
import com.defipoints.platform.repository.SnapshotRepository;
import com.defipoints.platform.repository.impl.InMemoryPointsStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background upkeep: restores and flushes the store snapshot and retries a failed Redis publish.
 */
@Component
public class StoreMaintenanceProcessor {

    private static final Logger logger = LoggerFactory.getLogger(StoreMaintenanceProcessor.class);

    private final InMemoryPointsStore store;
    private final SnapshotRepository snapshotRepository;
    private final EventDispatcher eventDispatcher;
    private final LeaderboardFacade leaderboardFacade;
    private final PointsProperties properties;

    @Autowired
    public StoreMaintenanceProcessor(
            InMemoryPointsStore store,
            SnapshotRepository snapshotRepository,
            EventDispatcher eventDispatcher,
            LeaderboardFacade leaderboardFacade,
            PointsProperties properties) {
        this.store = store;
        this.snapshotRepository = snapshotRepository;
        this.eventDispatcher = eventDispatcher;
        this.leaderboardFacade = leaderboardFacade;
        this.properties = properties;
    }

    @PostConstruct
    public void restoreSnapshot() {
        if (!properties.getSnapshot().isEnabled()) {
            return;
        }
        eventDispatcher.withLock(() -> snapshotRepository.load().ifPresent(store::importSnapshot));
    }

    /**
     * Flush the store to the snapshot file every {@code points.snapshot.flush-interval-ms}.
     */
    @Scheduled(fixedDelayString = "${points.snapshot.flush-interval-ms:30000}")
    public void flushSnapshot() {
        if (!properties.getSnapshot().isEnabled()) {
            return;
        }
        try {
            flush();
        } catch (Exception e) {
            logger.error("Error flushing store snapshot", e);
        }
    }

    @PreDestroy
    public void flushOnShutdown() {
        if (!properties.getSnapshot().isEnabled()) {
            return;
        }
        logger.info("Flushing store snapshot before shutdown");
        flush();
    }

    /**
     * Retry the global mirror publish every 30 seconds.
     */
    @Scheduled(fixedRate = 30000)
    public void republishMirror() {
        try {
            eventDispatcher.withLock(leaderboardFacade::republishIfDirty);
        } catch (Exception e) {
            logger.error("Error republishing global leaderboard mirror", e);
        }
    }

    private void flush() {
        eventDispatcher.withLock(() -> snapshotRepository.save(store.exportSnapshot()));
    }
}
