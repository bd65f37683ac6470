package com.autonomous.dashboard.store;

import com.autonomous.dashboard.model.SyncStatus;

import java.util.Optional;
import java.util.function.UnaryOperator;

public interface SyncStatusStore {

    Optional<SyncStatus> find(String organizationId);

    SyncStatus upsert(String organizationId, UnaryOperator<SyncStatus> change);
}
