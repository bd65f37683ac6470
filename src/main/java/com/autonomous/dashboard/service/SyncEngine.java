package com.autonomous.dashboard.service;

import com.autonomous.dashboard.gateway.GatewayClient;
import com.autonomous.dashboard.gateway.protocol.ConfigSnapshot;
import com.autonomous.dashboard.model.ActivationRequest;
import com.autonomous.dashboard.model.ActivationResult;
import com.autonomous.dashboard.model.Channel;
import com.autonomous.dashboard.model.ChannelStatus;
import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.model.RemoteGroup;
import com.autonomous.dashboard.model.SyncError;
import com.autonomous.dashboard.model.SyncOptions;
import com.autonomous.dashboard.model.SyncProgress;
import com.autonomous.dashboard.model.SyncResult;
import com.autonomous.dashboard.model.SyncStatus;
import com.autonomous.dashboard.store.ChannelStore;
import com.autonomous.dashboard.store.SyncStatusStore;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reconciles the gateway's group roster with an organization's local channels.
 * Channels are never deleted here; groups that disappear are marked inactive.
 */
@Slf4j
@Service
public class SyncEngine {

    static final String ALL_GROUPS = "*";

    private final GatewayClient gateway;
    private final ChannelStore channelStore;
    private final SyncStatusStore syncStatusStore;
    private final ConfigTranslator configTranslator;

    private final Map<String, ReentrantLock> organizationLocks = new ConcurrentHashMap<>();

    public SyncEngine(GatewayClient gateway, ChannelStore channelStore,
                      SyncStatusStore syncStatusStore, ConfigTranslator configTranslator) {
        this.gateway = gateway;
        this.channelStore = channelStore;
        this.syncStatusStore = syncStatusStore;
        this.configTranslator = configTranslator;
    }

    public SyncResult syncGroups(SyncOptions options) {
        String organizationId = options.getOrganizationId();
        ReentrantLock lock = organizationLocks.computeIfAbsent(organizationId, id -> new ReentrantLock());
        lock.lock();
        try {
            return runSync(options);
        } finally {
            lock.unlock();
        }
    }

    private SyncResult runSync(SyncOptions options) {
        String organizationId = options.getOrganizationId();
        boolean dryRun = options.isDryRun();
        log.info("Starting group sync: organizationId={} dryRun={} forceUpdate={}",
            organizationId, dryRun, options.isForceUpdate());

        SyncResult result = new SyncResult();
        result.setDryRun(dryRun);

        if (!dryRun) {
            syncStatusStore.upsert(organizationId, status -> status.toBuilder().syncInProgress(true).build());
        }

        try {
            options.report(SyncProgress.Stage.FETCHING, 0, 1, "Fetching groups from Clawdbot...");
            gateway.ensureConnected();
            ConfigSnapshot snapshot = gateway.fetchConfig();
            List<RemoteGroup> remoteGroups = gateway.groupsFrom(snapshot);
            log.debug("Fetched {} groups from gateway for {}", remoteGroups.size(), organizationId);

            int total = remoteGroups.size();
            options.report(SyncProgress.Stage.COMPARING, 0, total, "Comparing with database...");
            List<Channel> existingChannels = channelStore.findByOrganization(organizationId);
            Map<String, Channel> existingByGroupId = existingChannels.stream()
                .collect(Collectors.toMap(Channel::getExternalGroupId, Function.identity(), (first, second) -> first));
            Set<String> remoteIds = new HashSet<>();

            options.report(SyncProgress.Stage.UPDATING, 0, total, "Syncing changes...");
            int processed = 0;
            for (RemoteGroup group : remoteGroups) {
                remoteIds.add(group.getId());
                try {
                    reconcileGroup(organizationId, group, existingByGroupId.get(group.getId()), snapshot, options, result);
                } catch (RuntimeException e) {
                    log.error("Error processing group {} for {}: {}", group.getId(), organizationId, e.getMessage());
                    result.getErrors().add(new SyncError(group.getId(), messageOf(e), true));
                }
                processed++;
                options.report(SyncProgress.Stage.UPDATING, processed, total,
                    "Processed " + processed + "/" + total + " groups");
            }

            for (Channel existing : existingChannels) {
                if (remoteIds.contains(existing.getExternalGroupId())) {
                    continue;
                }
                try {
                    log.debug("Marking group {} as removed for {}", existing.getExternalGroupId(), organizationId);
                    if (!dryRun) {
                        channelStore.update(existing.getId(), current -> current.toBuilder().status(ChannelStatus.INACTIVE).build());
                    }
                    result.getRemoved().add(existing.getExternalGroupId());
                } catch (RuntimeException e) {
                    log.error("Error marking group {} removed for {}: {}", existing.getExternalGroupId(), organizationId, e.getMessage());
                    result.getErrors().add(new SyncError(existing.getExternalGroupId(), messageOf(e), true));
                }
            }

            options.report(SyncProgress.Stage.COMPLETE, total, total, String.format(
                "Sync complete: %d added, %d updated, %d removed",
                result.getAdded().size(), result.getUpdated().size(), result.getRemoved().size()));

            result.setSuccess(result.getErrors().isEmpty());
            if (!dryRun) {
                int activeGroups = countActive(organizationId);
                syncStatusStore.upsert(organizationId, status -> status.toBuilder()
                    .syncInProgress(false)
                    .lastSyncAt(Instant.now())
                    .lastSyncResult(result)
                    .totalGroups(total)
                    .activeGroups(activeGroups)
                    .build());
            }

            log.info("Group sync completed: organizationId={} added={} updated={} removed={} errors={} dryRun={}",
                organizationId, result.getAdded().size(), result.getUpdated().size(),
                result.getRemoved().size(), result.getErrors().size(), dryRun);
        } catch (RuntimeException e) {
            log.error("Group sync failed for {}", organizationId, e);
            result.setSuccess(false);
            result.getErrors().add(new SyncError(ALL_GROUPS, messageOf(e), false));
            if (!dryRun) {
                syncStatusStore.upsert(organizationId, status -> status.toBuilder()
                    .syncInProgress(false)
                    .lastSyncResult(result)
                    .build());
            }
        }
        return result;
    }

    private void reconcileGroup(String organizationId, RemoteGroup group, Channel existing,
                                ConfigSnapshot snapshot, SyncOptions options, SyncResult result) {
        if (existing == null) {
            log.debug("Adding new group {} ({}) for {}", group.getId(), group.getName(), organizationId);
            if (!options.isDryRun()) {
                GroupConfig config = gateway.groupConfigFrom(snapshot, group.getId())
                    .map(remote -> configTranslator.fromGatewayGroupConfig(remote, null))
                    .orElseGet(configTranslator::defaultGroupConfig);
                channelStore.create(Channel.builder()
                    .organizationId(organizationId)
                    .externalGroupId(group.getId())
                    .name(group.getName())
                    .status(config.isEnabled() ? ChannelStatus.ACTIVE : ChannelStatus.INACTIVE)
                    .config(config)
                    .build());
            }
            result.getAdded().add(group.getId());
            return;
        }

        if (options.isForceUpdate() || needsUpdate(existing, group)) {
            log.debug("Updating existing group {} for {} (forceUpdate={})", group.getId(), organizationId, options.isForceUpdate());
            if (!options.isDryRun()) {
                Optional<GroupConfig> remote = gateway.groupConfigFrom(snapshot, group.getId());
                channelStore.update(existing.getId(), current -> current.toBuilder()
                    .name(group.getName())
                    .config(remote
                        .map(config -> configTranslator.fromGatewayGroupConfig(config, current.getConfig()))
                        .orElse(current.getConfig()))
                    .build());
            }
            result.getUpdated().add(group.getId());
        }
    }

    public Optional<Channel> syncSingleGroup(String organizationId, String groupId) {
        log.debug("Syncing single group {} for {}", groupId, organizationId);
        gateway.ensureConnected();
        ConfigSnapshot snapshot = gateway.fetchConfig();

        Optional<GroupConfig> remote = gateway.groupConfigFrom(snapshot, groupId);
        if (remote.isEmpty()) {
            log.warn("Group config not found: organizationId={} groupId={}", organizationId, groupId);
            return Optional.empty();
        }

        Optional<Channel> existing = channelStore.findByExternalGroupId(organizationId, groupId);
        if (existing.isPresent()) {
            return Optional.of(channelStore.update(existing.get().getId(), current -> {
                GroupConfig config = configTranslator.fromGatewayGroupConfig(remote.get(), current.getConfig());
                return current.toBuilder()
                    .config(config)
                    .status(config.isEnabled() ? ChannelStatus.ACTIVE : ChannelStatus.INACTIVE)
                    .build();
            }));
        }

        String name = gateway.groupsFrom(snapshot).stream()
            .filter(group -> groupId.equals(group.getId()))
            .map(RemoteGroup::getName)
            .findFirst()
            .orElse(groupId);
        GroupConfig config = configTranslator.fromGatewayGroupConfig(remote.get(), null);
        log.debug("Creating new group {} for {}", groupId, organizationId);
        return Optional.of(channelStore.create(Channel.builder()
            .organizationId(organizationId)
            .externalGroupId(groupId)
            .name(name)
            .status(config.isEnabled() ? ChannelStatus.ACTIVE : ChannelStatus.INACTIVE)
            .config(config)
            .build()));
    }

    /**
     * Writes the channel's group config into the gateway, guarded by the config hash read
     * just before. A concurrent change on the gateway side surfaces as CONFIG_HASH_CONFLICT.
     */
    public Channel pushConfigToGateway(Channel channel) {
        log.info("Pushing config to gateway: channelId={} groupId={}", channel.getId(), channel.getExternalGroupId());
        gateway.ensureConnected();
        String baseHash = gateway.fetchConfig().getHash();
        gateway.patchGroupConfig(channel.getExternalGroupId(),
            configTranslator.toGatewayGroupConfig(channel.getConfig()), baseHash);

        Channel updated = channelStore.update(channel.getId(), current -> current.toBuilder().config(channel.getConfig()).build());
        log.info("Config pushed to gateway: channelId={} groupId={}", channel.getId(), channel.getExternalGroupId());
        return updated;
    }

    /**
     * Turns the bot on in a group: writes the activation fields to the gateway, then creates or
     * reactivates the local channel.
     */
    public ActivationResult activateGroup(String organizationId, String groupId, ActivationRequest request) {
        ActivationRequest body = request != null ? request : new ActivationRequest();
        GroupConfig activation = GroupConfig.builder()
            .enabled(true)
            .requireMention(body.getRequireMention() != null ? body.getRequireMention() : true)
            .personality(body.getPersonality())
            .features(body.getFeatures() != null ? body.getFeatures() : configTranslator.defaultGroupConfig().getFeatures())
            .build();
        configTranslator.requireValid(activation);

        log.info("Activating group: groupId={} organizationId={}", groupId, organizationId);
        gateway.ensureConnected();
        ConfigSnapshot snapshot = gateway.fetchConfig();
        gateway.patchGroupConfig(groupId, configTranslator.toGatewayGroupConfig(activation), snapshot.getHash());

        Optional<Channel> existing = channelStore.findByExternalGroupId(organizationId, groupId);
        if (existing.isEmpty()) {
            try {
                channelStore.create(Channel.builder()
                    .organizationId(organizationId)
                    .externalGroupId(groupId)
                    .name(rosterName(snapshot, groupId))
                    .status(ChannelStatus.ACTIVE)
                    .config(withActivation(configTranslator.defaultGroupConfig(), activation))
                    .build());
                return new ActivationResult(groupId, true, activation);
            } catch (IllegalStateException e) {
                log.debug("Group {} registered concurrently for {}", groupId, organizationId);
                existing = channelStore.findByExternalGroupId(organizationId, groupId);
            }
        }
        existing.ifPresent(channel -> channelStore.update(channel.getId(), current -> current.toBuilder()
            .status(ChannelStatus.ACTIVE)
            .config(withActivation(current.getConfig() != null ? current.getConfig() : configTranslator.defaultGroupConfig(),
                activation))
            .build()));
        return new ActivationResult(groupId, true, activation);
    }

    public ActivationResult deactivateGroup(String organizationId, String groupId) {
        log.info("Deactivating group: groupId={} organizationId={}", groupId, organizationId);
        gateway.ensureConnected();
        String baseHash = gateway.fetchConfig().getHash();
        gateway.patchGroupEntry(groupId, JsonNodeFactory.instance.objectNode().put("enabled", false), baseHash);

        channelStore.findByExternalGroupId(organizationId, groupId)
            .ifPresent(channel -> channelStore.update(channel.getId(), current -> current.toBuilder()
                .status(ChannelStatus.INACTIVE)
                .config(current.getConfig() != null ? current.getConfig().toBuilder().enabled(false).build() : null)
                .build()));
        return new ActivationResult(groupId, false, GroupConfig.builder().enabled(false).build());
    }

    private static GroupConfig withActivation(GroupConfig base, GroupConfig activation) {
        return base.toBuilder()
            .enabled(true)
            .requireMention(activation.isRequireMention())
            .features(activation.getFeatures())
            .personality(activation.getPersonality() != null ? activation.getPersonality() : base.getPersonality())
            .build();
    }

    private String rosterName(ConfigSnapshot snapshot, String groupId) {
        return gateway.groupsFrom(snapshot).stream()
            .filter(group -> groupId.equals(group.getId()))
            .map(RemoteGroup::getName)
            .findFirst()
            .orElse("Group " + groupId.split("@")[0]);
    }

    public List<RemoteGroup> detectNewGroups(String organizationId) {
        gateway.ensureConnected();
        List<RemoteGroup> remoteGroups = gateway.listGroups();
        Set<String> known = channelStore.findByOrganization(organizationId).stream()
            .map(Channel::getExternalGroupId)
            .collect(Collectors.toSet());
        List<RemoteGroup> newGroups = remoteGroups.stream()
            .filter(group -> !known.contains(group.getId()))
            .collect(Collectors.toList());
        log.debug("Detected {} new groups for {}", newGroups.size(), organizationId);
        return newGroups;
    }

    public Optional<SyncStatus> getSyncStatus(String organizationId) {
        return syncStatusStore.find(organizationId);
    }

    /**
     * Records a group the bot was added to. Unknown groups become a pending, disabled channel;
     * known ones are left alone.
     *
     * @return the new channel, or empty when the group was already known
     */
    public Optional<Channel> registerJoinedGroup(String organizationId, RemoteGroup group) {
        if (channelStore.findByExternalGroupId(organizationId, group.getId()).isPresent()) {
            log.debug("Joined group {} already known for {}", group.getId(), organizationId);
            return Optional.empty();
        }
        try {
            Channel created = channelStore.create(Channel.builder()
                .organizationId(organizationId)
                .externalGroupId(group.getId())
                .name(group.getName() != null ? group.getName() : group.getId())
                .status(ChannelStatus.PENDING)
                .config(configTranslator.pendingGroupConfig())
                .build());
            log.info("New group registered: groupId={} name={} organizationId={}", group.getId(), group.getName(), organizationId);
            return Optional.of(created);
        } catch (IllegalStateException e) {
            log.debug("Joined group {} registered concurrently for {}", group.getId(), organizationId);
            return Optional.empty();
        }
    }

    public Optional<Channel> markGroupLeft(String organizationId, String groupId) {
        Optional<Channel> existing = channelStore.findByExternalGroupId(organizationId, groupId);
        if (existing.isEmpty()) {
            log.debug("Left group {} unknown for {}", groupId, organizationId);
            return Optional.empty();
        }
        log.info("Group left: groupId={} organizationId={}", groupId, organizationId);
        return Optional.of(channelStore.update(existing.get().getId(),
            current -> current.toBuilder().status(ChannelStatus.INACTIVE).build()));
    }

    private boolean needsUpdate(Channel existing, RemoteGroup group) {
        return existing.getName() == null || !existing.getName().equals(group.getName());
    }

    private int countActive(String organizationId) {
        return (int) channelStore.findByOrganization(organizationId).stream()
            .filter(channel -> channel.getStatus() == ChannelStatus.ACTIVE)
            .count();
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
