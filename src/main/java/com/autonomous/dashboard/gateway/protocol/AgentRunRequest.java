package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentRunRequest {
    private String message;
    private String to;
    private String sessionKey;
    private String agentId;
    private String extraSystemPrompt;
    private boolean stream;
}
