package com.autonomous.dashboard.service;

import com.autonomous.dashboard.model.ConfigViolation;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class ConfigValidationException extends RuntimeException {

    private final List<ConfigViolation> violations;

    public ConfigValidationException(List<ConfigViolation> violations) {
        super("Invalid group config: " + violations.stream()
            .map(ConfigViolation::toString)
            .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }
}
