package com.autonomous.dashboard.model.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class UnknownWebhookEvent extends WebhookEvent {

    @JsonProperty("type")
    private String rawType;

    @Override
    public WebhookEventType eventType() {
        return WebhookEventType.UNKNOWN;
    }
}
