package com.autonomous.dashboard.service;

import com.autonomous.dashboard.gateway.GatewayClient;
import com.autonomous.dashboard.gateway.GatewayException;
import com.autonomous.dashboard.gateway.protocol.ConfigSnapshot;
import com.autonomous.dashboard.model.ActivationRequest;
import com.autonomous.dashboard.model.ActivationResult;
import com.autonomous.dashboard.model.Channel;
import com.autonomous.dashboard.model.ChannelStatus;
import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.model.PersonalityConfig;
import com.autonomous.dashboard.model.RemoteGroup;
import com.autonomous.dashboard.model.SyncError;
import com.autonomous.dashboard.model.SyncOptions;
import com.autonomous.dashboard.model.SyncProgress;
import com.autonomous.dashboard.model.SyncResult;
import com.autonomous.dashboard.model.SyncStatus;
import com.autonomous.dashboard.store.InMemoryChannelStore;
import com.autonomous.dashboard.store.InMemorySyncStatusStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncEngineTest {

    private static final String ORG = "org-1";

    @Mock
    private GatewayClient gateway;

    private InMemoryChannelStore channelStore;
    private InMemorySyncStatusStore syncStatusStore;
    private SyncEngine syncEngine;

    private final ConfigSnapshot snapshot = new ConfigSnapshot(null, "hash-1");

    @BeforeEach
    void setUp() {
        channelStore = new InMemoryChannelStore();
        syncStatusStore = new InMemorySyncStatusStore();
        syncEngine = new SyncEngine(gateway, channelStore, syncStatusStore, new ConfigTranslator());
    }

    @Test
    void shouldAddUpdateAndSoftRemoveGroups() {
        seed("g1", "Sales", ChannelStatus.ACTIVE);
        seed("g2", "Old name", ChannelStatus.ACTIVE);
        seed("g9", "Gone", ChannelStatus.ACTIVE);
        roster(group("g1", "Sales"), group("g2", "Support"), group("g3", "Marketing"));
        when(gateway.groupConfigFrom(snapshot, "g2")).thenReturn(Optional.empty());
        when(gateway.groupConfigFrom(snapshot, "g3"))
            .thenReturn(Optional.of(GroupConfig.builder().enabled(true).historyLimit(25).build()));

        SyncResult result = syncEngine.syncGroups(options(false, false));

        assertTrue(result.isSuccess());
        assertEquals(List.of("g3"), result.getAdded());
        assertEquals(List.of("g2"), result.getUpdated());
        assertEquals(List.of("g9"), result.getRemoved());

        assertEquals(4, channelStore.findByOrganization(ORG).size());
        assertEquals(ChannelStatus.INACTIVE, channel("g9").getStatus());
        assertEquals("Support", channel("g2").getName());
        Channel added = channel("g3");
        assertEquals(ChannelStatus.ACTIVE, added.getStatus());
        assertEquals(25, added.getConfig().getHistoryLimit());
        assertNotNull(added.getConfig().getPersonality());

        SyncStatus status = syncEngine.getSyncStatus(ORG).orElseThrow();
        assertFalse(status.isSyncInProgress());
        assertEquals(3, status.getTotalGroups());
        assertEquals(3, status.getActiveGroups());
        assertNotNull(status.getLastSyncAt());
        assertSame(result, status.getLastSyncResult());
    }

    @Test
    void shouldKeepEditsMadeWhileSyncRuns() {
        InMemoryChannelStore editedDuringSync = new InMemoryChannelStore() {
            private boolean edited;

            @Override
            public List<Channel> findByOrganization(String organizationId) {
                List<Channel> snapshotOfChannels = super.findByOrganization(organizationId);
                if (!edited) {
                    edited = true;
                    Channel gone = findByExternalGroupId(ORG, "g9").orElseThrow();
                    update(gone.getId(), current -> current.toBuilder()
                        .config(current.getConfig().toBuilder().systemPrompt("edited concurrently").build())
                        .build());
                }
                return snapshotOfChannels;
            }
        };
        channelStore = editedDuringSync;
        syncEngine = new SyncEngine(gateway, channelStore, syncStatusStore, new ConfigTranslator());
        seed("g9", "Gone", ChannelStatus.ACTIVE);
        roster();

        SyncResult result = syncEngine.syncGroups(options(false, false));

        assertEquals(List.of("g9"), result.getRemoved());
        Channel removed = channel("g9");
        assertEquals(ChannelStatus.INACTIVE, removed.getStatus());
        assertEquals("edited concurrently", removed.getConfig().getSystemPrompt());
    }

    @Test
    void shouldSerializeSyncsOfTheSameOrganization() throws Exception {
        CountDownLatch firstFetching = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        when(gateway.fetchConfig()).thenAnswer(invocation -> {
            if (fetches.incrementAndGet() == 1) {
                firstFetching.countDown();
                assertTrue(releaseFirst.await(5, TimeUnit.SECONDS));
            }
            return snapshot;
        });
        when(gateway.groupsFrom(snapshot)).thenReturn(List.of(group("g1", "Sales"), group("g2", "Support")));

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<SyncResult> first = callers.submit(() -> syncEngine.syncGroups(options(false, false)));
            assertTrue(firstFetching.await(5, TimeUnit.SECONDS));
            Future<SyncResult> second = callers.submit(() -> syncEngine.syncGroups(options(false, false)));

            Thread.sleep(100);
            assertFalse(second.isDone());
            assertEquals(1, fetches.get());

            releaseFirst.countDown();
            SyncResult firstResult = first.get(5, TimeUnit.SECONDS);
            SyncResult secondResult = second.get(5, TimeUnit.SECONDS);

            assertTrue(firstResult.isSuccess());
            assertTrue(secondResult.isSuccess());
            assertEquals(List.of("g1", "g2"), firstResult.getAdded());
            assertTrue(secondResult.getAdded().isEmpty());
            assertTrue(secondResult.getErrors().isEmpty());
            assertEquals(2, channelStore.findByOrganization(ORG).size());
        } finally {
            releaseFirst.countDown();
            callers.shutdownNow();
        }
    }

    @Test
    void shouldUpdateUnchangedGroupsWhenForced() {
        seed("g1", "Sales", ChannelStatus.ACTIVE);
        roster(group("g1", "Sales"));

        SyncResult result = syncEngine.syncGroups(options(false, true));

        assertEquals(List.of("g1"), result.getUpdated());
    }

    @Test
    void shouldWriteNothingOnDryRun() {
        seed("g9", "Gone", ChannelStatus.ACTIVE);
        roster(group("g1", "Sales"));

        SyncResult result = syncEngine.syncGroups(options(true, false));

        assertTrue(result.isDryRun());
        assertEquals(List.of("g1"), result.getAdded());
        assertEquals(List.of("g9"), result.getRemoved());
        assertEquals(1, channelStore.findByOrganization(ORG).size());
        assertEquals(ChannelStatus.ACTIVE, channel("g9").getStatus());
        assertTrue(syncEngine.getSyncStatus(ORG).isEmpty());
        verify(gateway, never()).groupConfigFrom(any(), anyString());
    }

    @Test
    void shouldContinueAfterPerGroupFailure() {
        roster(group("g1", "Broken"), group("g2", "Fine"));
        when(gateway.groupConfigFrom(snapshot, "g1"))
            .thenThrow(new GatewayException(GatewayException.Kind.REQUEST_FAILED, "malformed group entry"));
        when(gateway.groupConfigFrom(snapshot, "g2")).thenReturn(Optional.empty());

        SyncResult result = syncEngine.syncGroups(options(false, false));

        assertFalse(result.isSuccess());
        assertEquals(List.of("g2"), result.getAdded());
        assertEquals(1, result.getErrors().size());
        SyncError error = result.getErrors().get(0);
        assertEquals("g1", error.getGroupId());
        assertTrue(error.isRecoverable());
        assertFalse(syncEngine.getSyncStatus(ORG).orElseThrow().isSyncInProgress());
    }

    @Test
    void shouldReportUnreachableGatewayAsSingleFatalError() {
        when(gateway.ensureConnected())
            .thenThrow(new GatewayException(GatewayException.Kind.CONNECTION_TIMEOUT, "Connection timeout after 30000ms"));

        SyncResult result = syncEngine.syncGroups(options(false, false));

        assertFalse(result.isSuccess());
        assertEquals(1, result.getErrors().size());
        assertEquals("*", result.getErrors().get(0).getGroupId());
        assertFalse(result.getErrors().get(0).isRecoverable());
        assertFalse(syncEngine.getSyncStatus(ORG).orElseThrow().isSyncInProgress());
    }

    @Test
    void shouldReportProgressStages() {
        roster(group("g1", "Sales"), group("g2", "Support"));
        List<SyncProgress.Stage> stages = new ArrayList<>();

        syncEngine.syncGroups(SyncOptions.builder()
            .organizationId(ORG)
            .progressListener(progress -> stages.add(progress.getStage()))
            .build());

        assertEquals(SyncProgress.Stage.FETCHING, stages.get(0));
        assertEquals(SyncProgress.Stage.COMPARING, stages.get(1));
        assertEquals(SyncProgress.Stage.COMPLETE, stages.get(stages.size() - 1));
        assertEquals(3, stages.stream().filter(stage -> stage == SyncProgress.Stage.UPDATING).count());
    }

    @Test
    void shouldRefreshExistingChannelFromSingleGroupSync() {
        seed("g1", "Sales", ChannelStatus.ACTIVE);
        when(gateway.fetchConfig()).thenReturn(snapshot);
        when(gateway.groupConfigFrom(snapshot, "g1"))
            .thenReturn(Optional.of(GroupConfig.builder().enabled(false).build()));

        Optional<Channel> synced = syncEngine.syncSingleGroup(ORG, "g1");

        assertTrue(synced.isPresent());
        assertEquals(ChannelStatus.INACTIVE, synced.get().getStatus());
        assertFalse(channel("g1").getConfig().isEnabled());
    }

    @Test
    void shouldCreateChannelFromSingleGroupSyncUsingRosterName() {
        when(gateway.fetchConfig()).thenReturn(snapshot);
        when(gateway.groupConfigFrom(snapshot, "g5"))
            .thenReturn(Optional.of(GroupConfig.builder().enabled(true).build()));
        when(gateway.groupsFrom(snapshot)).thenReturn(List.of(group("g5", "Partners")));

        Channel created = syncEngine.syncSingleGroup(ORG, "g5").orElseThrow();

        assertEquals("Partners", created.getName());
        assertEquals(ChannelStatus.ACTIVE, created.getStatus());
    }

    @Test
    void shouldReturnEmptyWhenGatewayHasNoConfigForGroup() {
        when(gateway.fetchConfig()).thenReturn(snapshot);

        assertTrue(syncEngine.syncSingleGroup(ORG, "missing").isEmpty());
        assertTrue(channelStore.findByOrganization(ORG).isEmpty());
    }

    @Test
    void shouldPushRoutingConfigWithCurrentHash() {
        Channel channel = seed("g1", "Sales", ChannelStatus.ACTIVE);
        when(gateway.fetchConfig()).thenReturn(snapshot);

        syncEngine.pushConfigToGateway(channel.toBuilder()
            .config(channel.getConfig().toBuilder().historyLimit(5).build())
            .build());

        verify(gateway).patchGroupConfig(eq("g1"),
            argThat(config -> config.getHistoryLimit() == 5 && config.getPersonality() != null), eq("hash-1"));
        assertEquals(5, channel("g1").getConfig().getHistoryLimit());
    }

    @Test
    void shouldFailClosedOnHashConflict() {
        Channel channel = seed("g1", "Sales", ChannelStatus.ACTIVE);
        when(gateway.fetchConfig()).thenReturn(snapshot);
        doThrow(new GatewayException(GatewayException.Kind.CONFIG_HASH_CONFLICT, "Gateway config changed since hash hash-1"))
            .when(gateway).patchGroupConfig(eq("g1"), any(GroupConfig.class), eq("hash-1"));

        Channel edited = channel.toBuilder()
            .config(channel.getConfig().toBuilder().historyLimit(5).build())
            .build();
        GatewayException error = assertThrows(GatewayException.class, () -> syncEngine.pushConfigToGateway(edited));

        assertEquals(GatewayException.Kind.CONFIG_HASH_CONFLICT, error.getKind());
        verify(gateway, times(1)).patchGroupConfig(anyString(), any(GroupConfig.class), anyString());
        assertEquals(50, channel("g1").getConfig().getHistoryLimit());
    }

    @Test
    void shouldRegisterJoinedGroupAsPendingOnce() {
        Optional<Channel> first = syncEngine.registerJoinedGroup(ORG, group("g7", "New team"));
        Optional<Channel> second = syncEngine.registerJoinedGroup(ORG, group("g7", "New team"));

        assertTrue(first.isPresent());
        assertEquals(ChannelStatus.PENDING, first.get().getStatus());
        assertFalse(first.get().getConfig().isEnabled());
        assertTrue(first.get().getConfig().isRequireMention());
        assertEquals(50, first.get().getConfig().getHistoryLimit());
        assertTrue(second.isEmpty());
        assertEquals(1, channelStore.findByOrganization(ORG).size());
    }

    @Test
    void shouldSoftRemoveLeftGroup() {
        seed("g1", "Sales", ChannelStatus.ACTIVE);

        syncEngine.markGroupLeft(ORG, "g1");

        assertEquals(ChannelStatus.INACTIVE, channel("g1").getStatus());
        assertTrue(syncEngine.markGroupLeft(ORG, "unknown").isEmpty());
    }

    @Test
    void shouldActivatePendingGroupWithDefaults() {
        syncEngine.registerJoinedGroup(ORG, group("g7", "New team"));
        when(gateway.fetchConfig()).thenReturn(snapshot);

        ActivationResult result = syncEngine.activateGroup(ORG, "g7", null);

        assertTrue(result.isActivated());
        verify(gateway).patchGroupConfig(eq("g7"), argThat(config -> config.isEnabled()
            && config.isRequireMention()
            && config.getFeatures().getImageAnalysis()
            && !config.getFeatures().getCodeExecution()
            && config.getPersonality() == null
            && config.getHistoryLimit() == null), eq("hash-1"));
        Channel activated = channel("g7");
        assertEquals(ChannelStatus.ACTIVE, activated.getStatus());
        assertTrue(activated.getConfig().isEnabled());
        assertEquals(50, activated.getConfig().getHistoryLimit());
        assertEquals("New team", activated.getName());
    }

    @Test
    void shouldCreateChannelWhenActivatingUnknownGroup() {
        when(gateway.fetchConfig()).thenReturn(snapshot);
        when(gateway.groupsFrom(snapshot)).thenReturn(List.of());

        syncEngine.activateGroup(ORG, "120363000000000009@g.us", ActivationRequest.builder()
            .requireMention(false)
            .personality(PersonalityConfig.builder().humor(90).build())
            .build());

        Channel created = channel("120363000000000009@g.us");
        assertEquals("Group 120363000000000009", created.getName());
        assertEquals(ChannelStatus.ACTIVE, created.getStatus());
        assertFalse(created.getConfig().isRequireMention());
        assertEquals(90, created.getConfig().getPersonality().getHumor());
    }

    @Test
    void shouldRejectInvalidActivationBeforeTouchingGateway() {
        ActivationRequest request = ActivationRequest.builder()
            .personality(PersonalityConfig.builder().humor(150).build())
            .build();

        assertThrows(ConfigValidationException.class, () -> syncEngine.activateGroup(ORG, "g1", request));
        verifyNoInteractions(gateway);
    }

    @Test
    void shouldDeactivateOnlyTheEnabledFlag() {
        Channel seeded = seed("g1", "Sales", ChannelStatus.ACTIVE);
        channelStore.update(seeded.getId(), current -> current.toBuilder()
            .config(current.getConfig().toBuilder().systemPrompt("You sell bikes.").build())
            .build());
        when(gateway.fetchConfig()).thenReturn(snapshot);

        ActivationResult result = syncEngine.deactivateGroup(ORG, "g1");

        assertFalse(result.isActivated());
        verify(gateway).patchGroupEntry(eq("g1"),
            argThat(entry -> entry.size() == 1 && !entry.path("enabled").asBoolean(true)), eq("hash-1"));
        Channel deactivated = channel("g1");
        assertEquals(ChannelStatus.INACTIVE, deactivated.getStatus());
        assertFalse(deactivated.getConfig().isEnabled());
        assertEquals("You sell bikes.", deactivated.getConfig().getSystemPrompt());
    }

    @Test
    void shouldDetectGroupsWithoutChannel() {
        seed("g1", "Sales", ChannelStatus.ACTIVE);
        when(gateway.listGroups()).thenReturn(List.of(group("g1", "Sales"), group("g2", "Support")));

        List<RemoteGroup> newGroups = syncEngine.detectNewGroups(ORG);

        assertEquals(1, newGroups.size());
        assertEquals("g2", newGroups.get(0).getId());
    }

    // ============================================
    // Helpers
    // ============================================

    private void roster(RemoteGroup... groups) {
        when(gateway.fetchConfig()).thenReturn(snapshot);
        when(gateway.groupsFrom(snapshot)).thenReturn(List.of(groups));
    }

    private Channel seed(String groupId, String name, ChannelStatus status) {
        return channelStore.create(Channel.builder()
            .organizationId(ORG)
            .externalGroupId(groupId)
            .name(name)
            .status(status)
            .config(new ConfigTranslator().defaultGroupConfig())
            .build());
    }

    private Channel channel(String groupId) {
        return channelStore.findByExternalGroupId(ORG, groupId).orElseThrow();
    }

    private static RemoteGroup group(String id, String name) {
        return RemoteGroup.builder().id(id).name(name).build();
    }

    private static SyncOptions options(boolean dryRun, boolean forceUpdate) {
        return SyncOptions.builder()
            .organizationId(ORG)
            .dryRun(dryRun)
            .forceUpdate(forceUpdate)
            .build();
    }
}
