package com.adpulse.alerts.channel;

/**
 * Pushes an event to every client subscribed to a scope (e.g. {@code user_42}).
 */
public interface RealtimePublisher {

    /**
     * @throws com.adpulse.alerts.exception.ChannelException if the broker rejects the message
     */
    void publish(String scope, String eventName, Object payload);
}
