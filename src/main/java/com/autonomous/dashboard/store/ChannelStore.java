package com.autonomous.dashboard.store;

import com.autonomous.dashboard.model.Channel;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

// A channel is unique per (organizationId, externalGroupId)
public interface ChannelStore {

    List<Channel> findByOrganization(String organizationId);

    Optional<Channel> findById(String channelId);

    Optional<Channel> findByExternalGroupId(String organizationId, String externalGroupId);

    Channel create(Channel channel);

    Channel update(String channelId, UnaryOperator<Channel> patch);
}
