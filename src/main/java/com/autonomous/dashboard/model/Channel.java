package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Channel {
    private String id;
    private String organizationId;
    private String externalGroupId;   // unique per organization
    private String name;

    @Builder.Default
    private String type = "whatsapp_group";

    private ChannelStatus status;
    private GroupConfig config;
    private String knowledgeBaseId;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastMessageAt;
}
