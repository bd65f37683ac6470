package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PresenceEntry {
    private String host;
    private String ip;
    private String version;
    private String platform;
    private String mode;
    private Long lastInputSeconds;
    private Long ts;
    private String reason;
    private List<String> tags;
    private String instanceId;
}
