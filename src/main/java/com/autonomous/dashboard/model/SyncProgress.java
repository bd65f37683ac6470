package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SyncProgress {

    public enum Stage { FETCHING, COMPARING, UPDATING, COMPLETE }

    private Stage stage;
    private int current;
    private int total;
    private String message;
}
