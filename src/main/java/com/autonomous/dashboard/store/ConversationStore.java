package com.autonomous.dashboard.store;

import com.autonomous.dashboard.model.ConversationMessage;

import java.util.List;

public interface ConversationStore {

    List<ConversationMessage> recent(String channelId, int limit);

    void append(String channelId, ConversationMessage message);
}
