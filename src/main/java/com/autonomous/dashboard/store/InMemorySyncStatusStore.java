package com.autonomous.dashboard.store;

import com.autonomous.dashboard.model.SyncStatus;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemorySyncStatusStore implements SyncStatusStore {

    private final Map<String, SyncStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncStatus> find(String organizationId) {
        return Optional.ofNullable(statuses.get(organizationId));
    }

    @Override
    public SyncStatus upsert(String organizationId, UnaryOperator<SyncStatus> change) {
        return statuses.compute(organizationId, (id, current) -> {
            SyncStatus base = current != null ? current : SyncStatus.builder().organizationId(id).build();
            return change.apply(base);
        });
    }
}
