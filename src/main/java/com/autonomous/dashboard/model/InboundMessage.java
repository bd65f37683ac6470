package com.autonomous.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {
    private String id;
    private long timestamp;
    private String from;
    private String fromName;
    private String to;
    private String body;
    private String type;          // text | image | video | audio | document | sticker | reaction
    private String mediaUrl;
    private String mediaCaption;

    @JsonProperty("isFromMe")
    private boolean fromMe;

    @JsonProperty("isMention")
    private boolean mention;

    @JsonProperty("isGroup")
    private boolean group;

    private String groupId;

    public String conversationKey() {
        return groupId != null ? groupId : to;
    }

    public String replyTarget() {
        return groupId != null ? groupId : from;
    }
}
