package com.autonomous.dashboard.model.webhook;

import com.autonomous.dashboard.model.RemoteGroup;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class GroupJoinedEvent extends WebhookEvent {
    private RemoteGroup group;

    @Override
    public WebhookEventType eventType() {
        return WebhookEventType.GROUP_JOINED;
    }
}
