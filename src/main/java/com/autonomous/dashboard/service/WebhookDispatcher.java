package com.autonomous.dashboard.service;

import com.autonomous.dashboard.model.RouteResult;
import com.autonomous.dashboard.model.webhook.AgentResponseEvent;
import com.autonomous.dashboard.model.webhook.GroupJoinedEvent;
import com.autonomous.dashboard.model.webhook.GroupLeftEvent;
import com.autonomous.dashboard.model.webhook.MessageReceivedEvent;
import com.autonomous.dashboard.model.webhook.MessageSentEvent;
import com.autonomous.dashboard.model.webhook.StatusChangeEvent;
import com.autonomous.dashboard.model.webhook.UnknownWebhookEvent;
import com.autonomous.dashboard.model.webhook.WebhookEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class WebhookDispatcher {

    private final SyncEngine syncEngine;
    private final MessageRouter messageRouter;

    public WebhookDispatcher(SyncEngine syncEngine, MessageRouter messageRouter) {
        this.syncEngine = syncEngine;
        this.messageRouter = messageRouter;
    }

    public void dispatch(WebhookEvent event, String organizationId) {
        log.debug("Handling webhook event: type={} organizationId={}", event.eventType().wireName(), organizationId);

        switch (event.eventType()) {
            case GROUP_JOINED -> handleGroupJoined((GroupJoinedEvent) event, organizationId);
            case GROUP_LEFT -> handleGroupLeft((GroupLeftEvent) event, organizationId);
            case MESSAGE_RECEIVED -> handleMessageReceived((MessageReceivedEvent) event, organizationId);
            case MESSAGE_SENT -> {
                MessageSentEvent sent = (MessageSentEvent) event;
                log.debug("Message sent: id={}", sent.getMessage() != null ? sent.getMessage().getId() : null);
            }
            case STATUS_CHANGE -> log.info("Gateway status changed: status={} organizationId={}",
                ((StatusChangeEvent) event).getStatus(), organizationId);
            case AGENT_RESPONSE -> {
                AgentResponseEvent response = (AgentResponseEvent) event;
                log.info("Agent run {}: status={} inputTokens={} outputTokens={} durationMs={}",
                    response.getRunId(), response.getStatus(), response.getInputTokens(),
                    response.getOutputTokens(), response.getDurationMs());
            }
            default -> log.debug("Unhandled webhook event type {}", ((UnknownWebhookEvent) event).getRawType());
        }
    }

    private void handleGroupJoined(GroupJoinedEvent event, String organizationId) {
        if (event.getGroup() == null || event.getGroup().getId() == null) {
            log.warn("group.joined without group id for {}", organizationId);
            return;
        }
        log.info("Group joined: groupId={} name={} organizationId={}",
            event.getGroup().getId(), event.getGroup().getName(), organizationId);
        syncEngine.registerJoinedGroup(organizationId, event.getGroup());
    }

    private void handleGroupLeft(GroupLeftEvent event, String organizationId) {
        log.info("Group left: groupId={} reason={} organizationId={}", event.getGroupId(), event.getReason(), organizationId);
        syncEngine.markGroupLeft(organizationId, event.getGroupId());
    }

    private void handleMessageReceived(MessageReceivedEvent event, String organizationId) {
        if (event.getMessage() == null) {
            log.warn("message.received without message for {}", organizationId);
            return;
        }
        RouteResult result = messageRouter.route(event.getMessage(), organizationId);
        log.debug("Message {} routed: stage={} responded={} skipReason={}",
            event.getMessage().getId(), result.getStage(), result.isResponded(), result.getSkipReason());
    }
}
