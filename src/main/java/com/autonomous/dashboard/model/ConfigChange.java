package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigChange {
    private String field;
    private Object oldValue;
    private Object newValue;
}
