package com.autonomous.dashboard.model.webhook;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class GroupLeftEvent extends WebhookEvent {
    private String groupId;
    private String reason;

    @Override
    public WebhookEventType eventType() {
        return WebhookEventType.GROUP_LEFT;
    }
}
