package com.autonomous.dashboard.model.webhook;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class StatusChangeEvent extends WebhookEvent {
    private String status;   // online | offline | reconnecting

    @Override
    public WebhookEventType eventType() {
        return WebhookEventType.STATUS_CHANGE;
    }
}
