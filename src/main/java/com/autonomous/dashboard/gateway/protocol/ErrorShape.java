package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorShape {
    private String code;
    private String message;
    private JsonNode details;
    private Boolean retryable;
    private Long retryAfterMs;

    public ErrorShape(String code, String message) {
        this.code = code;
        this.message = message;
    }
}
