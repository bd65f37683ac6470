package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncError {
    private String groupId;       // "*" when the whole sync failed
    private String error;
    private boolean recoverable;
}
