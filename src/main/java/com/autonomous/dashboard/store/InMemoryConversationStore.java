package com.autonomous.dashboard.store;

import com.autonomous.dashboard.model.ConversationMessage;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryConversationStore implements ConversationStore {

    // Largest history limit a group config accepts
    static final int DEFAULT_CAPACITY = 1000;

    private final Map<String, List<ConversationMessage>> conversations = new ConcurrentHashMap<>();
    private final int capacity;

    public InMemoryConversationStore() {
        this(DEFAULT_CAPACITY);
    }

    InMemoryConversationStore(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public List<ConversationMessage> recent(String channelId, int limit) {
        List<ConversationMessage> messages = conversations.get(channelId);
        if (messages == null || limit <= 0) {
            return List.of();
        }
        synchronized (messages) {
            int from = Math.max(0, messages.size() - limit);
            return List.copyOf(messages.subList(from, messages.size()));
        }
    }

    @Override
    public void append(String channelId, ConversationMessage message) {
        List<ConversationMessage> messages =
            conversations.computeIfAbsent(channelId, id -> Collections.synchronizedList(new ArrayList<>()));
        synchronized (messages) {
            messages.add(message);
            if (messages.size() > capacity) {
                messages.subList(0, messages.size() - capacity).clear();
            }
        }
    }
}
