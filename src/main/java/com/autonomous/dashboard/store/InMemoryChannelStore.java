package com.autonomous.dashboard.store;

import com.autonomous.dashboard.model.Channel;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Repository
public class InMemoryChannelStore implements ChannelStore {

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    // organizationId + '|' + externalGroupId -> channelId
    private final Map<String, String> externalIndex = new ConcurrentHashMap<>();

    @Override
    public List<Channel> findByOrganization(String organizationId) {
        return channels.values().stream()
            .filter(channel -> organizationId.equals(channel.getOrganizationId()))
            .sorted(Comparator.comparing(Channel::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Channel> findById(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    @Override
    public Optional<Channel> findByExternalGroupId(String organizationId, String externalGroupId) {
        String channelId = externalIndex.get(key(organizationId, externalGroupId));
        return channelId == null ? Optional.empty() : findById(channelId);
    }

    @Override
    public Channel create(Channel channel) {
        Instant now = Instant.now();
        Channel stored = channel.toBuilder()
            .id(channel.getId() != null ? channel.getId() : UUID.randomUUID().toString())
            .createdAt(channel.getCreatedAt() != null ? channel.getCreatedAt() : now)
            .updatedAt(now)
            .build();

        String existing = externalIndex.putIfAbsent(key(stored.getOrganizationId(), stored.getExternalGroupId()), stored.getId());
        if (existing != null) {
            throw new IllegalStateException("Channel already exists for group " + stored.getExternalGroupId()
                + " in organization " + stored.getOrganizationId());
        }
        channels.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Channel update(String channelId, UnaryOperator<Channel> patch) {
        Channel stored = channels.computeIfPresent(channelId, (id, current) -> patch.apply(current).toBuilder()
            .id(current.getId())
            .organizationId(current.getOrganizationId())
            .externalGroupId(current.getExternalGroupId())
            .createdAt(current.getCreatedAt())
            .updatedAt(Instant.now())
            .build());
        if (stored == null) {
            throw new NoSuchElementException("Unknown channel " + channelId);
        }
        return stored;
    }

    private static String key(String organizationId, String externalGroupId) {
        return organizationId + "|" + externalGroupId;
    }
}
