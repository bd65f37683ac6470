package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthStatus {
    private boolean ok;
    private String version;
    private long uptime;
    private String linkedChannel;
    private List<LinkedChannel> channels;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LinkedChannel {
        private String id;
        private String type;
        private boolean linked;
        private String accountId;
        private String displayName;
    }
}
