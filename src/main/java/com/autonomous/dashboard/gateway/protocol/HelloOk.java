package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HelloOk {

    public static final String TYPE = "hello-ok";

    private String type;
    private int protocol;
    private Policy policy;
    private Snapshot snapshot;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Policy {
        private long tickIntervalMs;
        private Long maxPayload;
        private Long maxBufferedBytes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Snapshot {
        private List<PresenceEntry> presence;
        private HealthStatus health;
        private Long stateVersion;
        private Long uptimeMs;
    }
}
