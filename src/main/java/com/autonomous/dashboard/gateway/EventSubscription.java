package com.autonomous.dashboard.gateway;

@FunctionalInterface
public interface EventSubscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
