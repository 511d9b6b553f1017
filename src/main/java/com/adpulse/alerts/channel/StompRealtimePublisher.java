package com.adpulse.alerts.channel;

import com.adpulse.alerts.exception.ChannelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes to the in-process STOMP broker; the event name travels in the {@code event} header.
 *
 * Scope {@code user_42} goes to user 42's private queue ({@code /user/queue/alerts} on the
 * subscriber side). Any other scope maps to {@code /topic/<scope>}, whose subscriptions
 * {@link SubscriptionGuard} restricts.
 */
@Component
public class StompRealtimePublisher implements RealtimePublisher {

    private static final Logger log = LoggerFactory.getLogger(StompRealtimePublisher.class);

    static final String TOPIC_PREFIX = "/topic/";
    static final String USER_SCOPE_PREFIX = "user_";
    static final String USER_QUEUE = "/queue/alerts";
    static final String EVENT_HEADER = "event";

    private final SimpMessagingTemplate messagingTemplate;

    public StompRealtimePublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void publish(String scope, String eventName, Object payload) {
        Map<String, Object> headers = Map.of(EVENT_HEADER, eventName);
        boolean userScope = scope.startsWith(USER_SCOPE_PREFIX);
        String userId = userScope ? scope.substring(USER_SCOPE_PREFIX.length()) : null;
        String destination = userScope ? "/user/" + userId + USER_QUEUE : TOPIC_PREFIX + scope;

        try {
            if (userScope) {
                messagingTemplate.convertAndSendToUser(userId, USER_QUEUE, payload, headers);
            } else {
                messagingTemplate.convertAndSend(destination, payload, headers);
            }
            log.debug("Published {} to {}", eventName, destination);
        } catch (MessagingException e) {
            throw new ChannelException("Failed to publish " + eventName + " to " + destination, e);
        }
    }
}
