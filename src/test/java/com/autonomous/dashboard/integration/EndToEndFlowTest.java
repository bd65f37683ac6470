package com.autonomous.dashboard.integration;

import com.autonomous.dashboard.gateway.GatewayClient;
import com.autonomous.dashboard.gateway.GatewayException;
import com.autonomous.dashboard.gateway.protocol.ConfigSnapshot;
import com.autonomous.dashboard.model.Channel;
import com.autonomous.dashboard.model.ChannelStatus;
import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.store.ChannelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class EndToEndFlowTest {

    private static final String ORG_HEADER = "X-Organization-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ChannelStore channelStore;

    @MockBean
    private GatewayClient gatewayClient;

    @BeforeEach
    void setUp() {
        when(gatewayClient.fetchConfig()).thenReturn(new ConfigSnapshot(null, "hash-1"));
        when(gatewayClient.runAgent(any())).thenThrow(GatewayException.requestTimeout("agent"));
    }

    @Test
    void shouldRegisterActivateAndAnswerGroup() throws Exception {
        String groupId = "120363000000000001@g.us";
        when(gatewayClient.groupConfigFrom(any(), eq(groupId))).thenReturn(Optional.of(GroupConfig.builder()
            .requireMention(true)
            .mentionPatterns(List.of("@bot"))
            .enabled(true)
            .historyLimit(20)
            .build()));

        webhook("org-e2e-1", "{\"type\":\"group.joined\",\"group\":{\"id\":\"" + groupId + "\",\"name\":\"Vendas\"}}");

        Channel pending = channelStore.findByExternalGroupId("org-e2e-1", groupId).orElseThrow();
        assertEquals(ChannelStatus.PENDING, pending.getStatus());
        assertFalse(pending.getConfig().isEnabled());

        mockMvc.perform(post("/clawdbot/groups/" + groupId + "/sync").header(ORG_HEADER, "org-e2e-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("active"));

        webhook("org-e2e-1", "{\"type\":\"message.received\",\"message\":{\"id\":\"m1\","
            + "\"from\":\"5511999999999@s.whatsapp.net\",\"body\":\"@bot oi, tudo bem?\","
            + "\"isGroup\":true,\"groupId\":\"" + groupId + "\"}}");

        verify(gatewayClient).sendMessage(groupId, "Olá! Como posso ajudar?", "m1");
        assertNotNull(channelStore.findByExternalGroupId("org-e2e-1", groupId).orElseThrow().getLastMessageAt());
    }

    @Test
    void shouldIgnoreMessagesInPendingGroup() throws Exception {
        String groupId = "120363000000000002@g.us";
        webhook("org-e2e-2", "{\"type\":\"group.joined\",\"group\":{\"id\":\"" + groupId + "\"}}");

        webhook("org-e2e-2", "{\"type\":\"message.received\",\"message\":{\"id\":\"m2\","
            + "\"from\":\"5511999999999@s.whatsapp.net\",\"body\":\"@bot hello\",\"isMention\":true,"
            + "\"isGroup\":true,\"groupId\":\"" + groupId + "\"}}");

        verify(gatewayClient, never()).runAgent(any());
        verify(gatewayClient, never()).sendMessage(anyString(), anyString(), any());
        assertEquals(groupId, channelStore.findByExternalGroupId("org-e2e-2", groupId).orElseThrow().getName());
    }

    @Test
    void shouldAnswerAfterActivatingPendingGroup() throws Exception {
        String groupId = "120363000000000004@g.us";
        webhook("org-e2e-4", "{\"type\":\"group.joined\",\"group\":{\"id\":\"" + groupId + "\",\"name\":\"Suporte\"}}");

        mockMvc.perform(post("/clawdbot/groups/" + groupId + "/activate")
                .header(ORG_HEADER, "org-e2e-4")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"requireMention\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.activated").value(true));

        Channel active = channelStore.findByExternalGroupId("org-e2e-4", groupId).orElseThrow();
        assertEquals(ChannelStatus.ACTIVE, active.getStatus());
        verify(gatewayClient).patchGroupConfig(eq(groupId), argThat(config -> !config.isRequireMention()), eq("hash-1"));

        webhook("org-e2e-4", "{\"type\":\"message.received\",\"message\":{\"id\":\"m4\","
            + "\"from\":\"5511999999999@s.whatsapp.net\",\"body\":\"hello there\","
            + "\"isGroup\":true,\"groupId\":\"" + groupId + "\"}}");

        verify(gatewayClient).sendMessage(groupId, "Hello! How can I help you?", "m4");
    }

    @Test
    void shouldSoftRemoveLeftGroup() throws Exception {
        String groupId = "120363000000000003@g.us";
        webhook("org-e2e-3", "{\"type\":\"group.joined\",\"group\":{\"id\":\"" + groupId + "\",\"name\":\"Temp\"}}");
        webhook("org-e2e-3", "{\"type\":\"group.left\",\"groupId\":\"" + groupId + "\",\"reason\":\"removed\"}");

        Channel channel = channelStore.findByExternalGroupId("org-e2e-3", groupId).orElseThrow();
        assertEquals(ChannelStatus.INACTIVE, channel.getStatus());
    }

    private void webhook(String organizationId, String body) throws Exception {
        mockMvc.perform(post("/clawdbot/webhook")
                .header(ORG_HEADER, organizationId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.received").value(true));
    }
}
