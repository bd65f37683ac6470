package com.autonomous.dashboard.model.webhook;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class AgentResponseEvent extends WebhookEvent {
    private String runId;
    private String status;   // started | completed | error
    private Long inputTokens;
    private Long outputTokens;
    private Long durationMs;
    private String error;

    @Override
    public WebhookEventType eventType() {
        return WebhookEventType.AGENT_RESPONSE;
    }
}
