package com.autonomous.dashboard.controller;

import com.autonomous.dashboard.model.ActivationRequest;
import com.autonomous.dashboard.model.ActivationResult;
import com.autonomous.dashboard.model.Channel;
import com.autonomous.dashboard.model.ConfigChange;
import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.model.SyncOptions;
import com.autonomous.dashboard.model.SyncResult;
import com.autonomous.dashboard.model.SyncStatus;
import com.autonomous.dashboard.model.ValidationResult;
import com.autonomous.dashboard.service.ConfigTranslator;
import com.autonomous.dashboard.service.SyncEngine;
import com.autonomous.dashboard.store.ChannelStore;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static com.autonomous.dashboard.controller.ClawdbotController.ORGANIZATION_HEADER;

@Slf4j
@RestController
@RequestMapping("/clawdbot/groups")
public class GroupController {

    @Autowired
    private SyncEngine syncEngine;

    @Autowired
    private ChannelStore channelStore;

    @Autowired
    private ConfigTranslator configTranslator;

    @GetMapping
    public ResponseEntity<?> listGroups(@RequestHeader(ORGANIZATION_HEADER) String organizationId) {
        List<Channel> channels = channelStore.findByOrganization(organizationId);
        return ResponseEntity.ok(Map.of("success", true, "data", channels));
    }

    @PostMapping("/sync")
    public ResponseEntity<?> syncGroups(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                        @RequestBody(required = false) SyncRequest request) {
        SyncRequest body = request != null ? request : new SyncRequest();
        SyncResult result = syncEngine.syncGroups(SyncOptions.builder()
            .organizationId(organizationId)
            .dryRun(body.isDryRun())
            .forceUpdate(body.isForceUpdate())
            .build());
        return ResponseEntity.ok(Map.of("success", result.isSuccess(), "data", result));
    }

    @GetMapping("/sync/status")
    public ResponseEntity<?> syncStatus(@RequestHeader(ORGANIZATION_HEADER) String organizationId) {
        SyncStatus status = syncEngine.getSyncStatus(organizationId)
            .orElseGet(() -> SyncStatus.builder().organizationId(organizationId).build());
        return ResponseEntity.ok(Map.of("success", true, "data", status));
    }

    @PostMapping("/{groupId}/sync")
    public ResponseEntity<?> syncGroup(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                       @PathVariable String groupId) {
        Optional<Channel> channel = syncEngine.syncSingleGroup(organizationId, groupId);
        if (channel.isEmpty()) {
            throw new NoSuchElementException("Group config not found: " + groupId);
        }
        return ResponseEntity.ok(Map.of("success", true, "data", channel.get()));
    }

    @PutMapping("/{groupId}/config")
    public ResponseEntity<?> updateConfig(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                          @PathVariable String groupId,
                                          @RequestBody GroupConfig config) {
        Channel channel = channelStore.findByExternalGroupId(organizationId, groupId)
            .orElseThrow(() -> new NoSuchElementException("Unknown group: " + groupId));

        ValidationResult validation = configTranslator.requireValid(config);
        List<ConfigChange> changes = configTranslator.diffConfigs(channel.getConfig(), config);
        log.info("Updating config for group {} ({} changes): {}", groupId, changes.size(), changes);

        Channel updated = syncEngine.pushConfigToGateway(channel.toBuilder().config(config).build());
        return ResponseEntity.ok(Map.of(
            "success", true,
            "data", updated,
            "warnings", validation.getWarnings()
        ));
    }

    @PostMapping("/{groupId}/activate")
    public ResponseEntity<?> activateGroup(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                           @PathVariable String groupId,
                                           @RequestBody(required = false) ActivationRequest request) {
        ActivationResult result = syncEngine.activateGroup(organizationId, groupId, request);
        return ResponseEntity.ok(Map.of("success", true, "data", result));
    }

    @DeleteMapping("/{groupId}/activate")
    public ResponseEntity<?> deactivateGroup(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                             @PathVariable String groupId) {
        ActivationResult result = syncEngine.deactivateGroup(organizationId, groupId);
        return ResponseEntity.ok(Map.of("success", true, "data", result));
    }

    @Data
    public static class SyncRequest {
        private boolean dryRun;
        private boolean forceUpdate;
    }
}
