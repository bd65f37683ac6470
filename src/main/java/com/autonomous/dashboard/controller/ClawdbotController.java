package com.autonomous.dashboard.controller;

import com.autonomous.dashboard.gateway.ConnectionStatus;
import com.autonomous.dashboard.gateway.GatewayClient;
import com.autonomous.dashboard.gateway.protocol.SendMessageRequest;
import com.autonomous.dashboard.model.webhook.WebhookEvent;
import com.autonomous.dashboard.service.WebhookDispatcher;
import com.autonomous.dashboard.store.ChannelStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/clawdbot")
public class ClawdbotController {

    static final String ORGANIZATION_HEADER = "X-Organization-Id";

    @Autowired
    private WebhookDispatcher webhookDispatcher;

    @Autowired
    private GatewayClient gatewayClient;

    @Autowired
    private ChannelStore channelStore;

    @PostMapping("/webhook")
    public ResponseEntity<?> handleWebhook(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                           @RequestBody WebhookEvent event) {
        webhookDispatcher.dispatch(event, organizationId);
        return ResponseEntity.ok(Map.of(
            "success", true,
            "data", Map.of("received", true)
        ));
    }

    @PostMapping("/send")
    public ResponseEntity<?> sendMessage(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                         @RequestBody SendMessageRequest request) {
        if (!hasText(request.getTarget())) {
            throw new IllegalArgumentException("Target (group or user ID) is required");
        }
        if (!hasText(request.getMessage()) && !hasText(request.getMediaUrl())) {
            throw new IllegalArgumentException("Message or media is required");
        }
        if (request.getTarget().contains("@g.us")
                && channelStore.findByExternalGroupId(organizationId, request.getTarget()).isEmpty()) {
            log.warn("Message sent to untracked group: {} organizationId={}", request.getTarget(), organizationId);
        }

        String messageId = gatewayClient.sendMessage(request);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messageId", messageId);
        data.put("target", request.getTarget());
        data.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(Map.of("success", true, "data", data));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        ConnectionStatus status = gatewayClient.getStatus();
        return ResponseEntity.ok(Map.of(
            "success", true,
            "data", status
        ));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
