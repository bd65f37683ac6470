package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatus {
    private String organizationId;
    private Instant lastSyncAt;
    private boolean syncInProgress;
    private int totalGroups;
    private int activeGroups;
    private SyncResult lastSyncResult;
}
