package com.autonomous.dashboard.model.webhook;

import com.autonomous.dashboard.model.InboundMessage;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class MessageReceivedEvent extends WebhookEvent {
    private InboundMessage message;

    @Override
    public WebhookEventType eventType() {
        return WebhookEventType.MESSAGE_RECEIVED;
    }
}
