package com.defipoints.platform.repository.impl;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.exception.LeaderboardException;
import com.defipoints.platform.repository.SnapshotRepository;
import com.defipoints.platform.repository.StoreSnapshot;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persists the store image to a single JSON file. Writes go to a sibling temp file first and
 * are then moved over the target.
 */
@Repository
public class JsonSnapshotRepository implements SnapshotRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonSnapshotRepository.class);

    private final Path snapshotFile;
    private final ObjectMapper objectMapper;
    private final ReentrantLock fileLock = new ReentrantLock();

    @Autowired
    public JsonSnapshotRepository(PointsProperties properties) {
        this(Paths.get(properties.getSnapshot().getFile()));
    }

    JsonSnapshotRepository(Path snapshotFile) {
        this.snapshotFile = snapshotFile;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<StoreSnapshot> load() {
        fileLock.lock();
        try {
            if (!Files.exists(snapshotFile)) {
                logger.info("No snapshot found at {}, starting from an empty store", snapshotFile);
                return Optional.empty();
            }
            StoreSnapshot snapshot = objectMapper.readValue(snapshotFile.toFile(), StoreSnapshot.class);
            logger.info("Loaded store snapshot from {}", snapshotFile);
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new LeaderboardException("Failed to read snapshot file: " + snapshotFile, "SNAPSHOT_ERROR", e);
        } finally {
            fileLock.unlock();
        }
    }

    @Override
    public void save(StoreSnapshot snapshot) {
        fileLock.lock();
        try {
            initializeDirectory();
            File tempFile = new File(snapshotFile.toString() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile, snapshot);
            Files.move(tempFile.toPath(), snapshotFile, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Flushed store snapshot to {}", snapshotFile);
        } catch (IOException e) {
            throw new LeaderboardException("Failed to write snapshot file: " + snapshotFile, "SNAPSHOT_ERROR", e);
        } finally {
            fileLock.unlock();
        }
    }

    private void initializeDirectory() throws IOException {
        Path parent = snapshotFile.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
