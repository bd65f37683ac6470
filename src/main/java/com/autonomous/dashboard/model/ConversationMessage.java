package com.autonomous.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    public enum Role { USER, ASSISTANT }

    private Role role;
    private String participantId;
    private String content;
    private Instant createdAt;
}
