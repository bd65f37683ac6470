package com.autonomous.dashboard.controller;

import com.autonomous.dashboard.gateway.GatewayException;
import com.autonomous.dashboard.model.ConfigViolation;
import com.autonomous.dashboard.service.ConfigValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigValidationException.class)
    public ResponseEntity<?> handleValidation(ConfigValidationException e) {
        List<String> violations = e.getViolations().stream()
            .map(ConfigViolation::toString)
            .collect(Collectors.toList());
        Map<String, Object> body = error("Invalid group config");
        body.put("violations", violations);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<?> handleGateway(GatewayException e) {
        HttpStatus status;
        if (e.getKind() == GatewayException.Kind.CONFIG_HASH_CONFLICT) {
            status = HttpStatus.CONFLICT;
        } else if (e.isTimeout()) {
            status = HttpStatus.GATEWAY_TIMEOUT;
        } else {
            status = HttpStatus.BAD_GATEWAY;
        }
        log.warn("Gateway call failed: kind={} method={} message={}", e.getKind(), e.getMethod(), e.getMessage());
        Map<String, Object> body = error(e.getMessage());
        body.put("kind", e.getKind().name());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<?> handleNotFound(NoSuchElementException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage()));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message != null ? message : "Unknown error");
        return body;
    }
}
