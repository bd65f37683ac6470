package com.autonomous.dashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ChannelContext {
    private Channel channel;
    private GroupConfig config;
    private PersonalityConfig personality;
    private String systemPrompt;
    private String knowledgeBaseId;

    public String getChannelId() {
        return channel.getId();
    }
}
