package com.autonomous.dashboard.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
public class SyncResult {
    private boolean success = true;
    private boolean dryRun;
    private Instant timestamp = Instant.now();
    private List<String> added = new ArrayList<>();
    private List<String> updated = new ArrayList<>();
    private List<String> removed = new ArrayList<>();
    private List<SyncError> errors = new ArrayList<>();
}
