package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {
    private boolean valid;
    private List<ConfigViolation> errors;
    private List<String> warnings;

    public boolean hasErrorFor(String field) {
        return errors.stream().anyMatch(e -> e.getField().contains(field));
    }
}
