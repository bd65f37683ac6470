package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivationResult {
    private String groupId;
    private boolean activated;
    private GroupConfig config;
}
