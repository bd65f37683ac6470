package com.autonomous.dashboard.model;

import lombok.Builder;
import lombok.Data;

import java.util.function.Consumer;

@Data
@Builder
public class SyncOptions {
    private String organizationId;
    private boolean dryRun;
    private boolean forceUpdate;
    private Consumer<SyncProgress> progressListener;

    public void report(SyncProgress.Stage stage, int current, int total, String message) {
        if (progressListener != null) {
            progressListener.accept(new SyncProgress(stage, current, total, message));
        }
    }
}
