package com.autonomous.dashboard.model.webhook;

public enum WebhookEventType {
    GROUP_JOINED("group.joined"),
    GROUP_LEFT("group.left"),
    MESSAGE_RECEIVED("message.received"),
    MESSAGE_SENT("message.sent"),
    STATUS_CHANGE("status.change"),
    AGENT_RESPONSE("agent.response"),
    UNKNOWN("unknown");

    private final String wireName;

    WebhookEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
