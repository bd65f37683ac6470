package com.autonomous.dashboard.model.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type",
    visible = true, defaultImpl = UnknownWebhookEvent.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = GroupJoinedEvent.class, name = "group.joined"),
    @JsonSubTypes.Type(value = GroupLeftEvent.class, name = "group.left"),
    @JsonSubTypes.Type(value = MessageReceivedEvent.class, name = "message.received"),
    @JsonSubTypes.Type(value = MessageSentEvent.class, name = "message.sent"),
    @JsonSubTypes.Type(value = StatusChangeEvent.class, name = "status.change"),
    @JsonSubTypes.Type(value = AgentResponseEvent.class, name = "agent.response")
})
public abstract class WebhookEvent {
    private long timestamp;
    private String accountId;

    public abstract WebhookEventType eventType();
}
