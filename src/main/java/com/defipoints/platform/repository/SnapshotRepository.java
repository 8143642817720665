package com.defipoints.platform.repository;

import java.util.Optional;

public interface SnapshotRepository {
    Optional<StoreSnapshot> load();
    void save(StoreSnapshot snapshot);
}
