package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigViolation {
    private String field;
    private String reason;

    @Override
    public String toString() {
        return field + ": " + reason;
    }
}
