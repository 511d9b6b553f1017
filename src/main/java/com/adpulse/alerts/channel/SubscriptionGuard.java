package com.adpulse.alerts.channel;

import com.adpulse.alerts.exception.PermissionDeniedException;
import com.adpulse.alerts.repository.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * Inbound STOMP interceptor that keeps realtime channels private.
 *
 * Allowed subscriptions:
 * - {@code /user/queue/...}: resolved by the broker to the subscriber's own sessions
 * - {@code /topic/conversation_<id>}: only for the conversation's manager or client user
 *
 * Everything else, and any subscription without an authenticated principal, is rejected.
 * The principal is the one carried by the WebSocket upgrade request.
 */
@Component
public class SubscriptionGuard implements ChannelInterceptor {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionGuard.class);

    static final String USER_DESTINATION_PREFIX = "/user/";
    static final String CONVERSATION_TOPIC_PREFIX = StompRealtimePublisher.TOPIC_PREFIX + "conversation_";

    private final ConversationRepository conversationRepository;

    public SubscriptionGuard(ConversationRepository conversationRepository) {
        this.conversationRepository = conversationRepository;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        if (accessor.getCommand() != StompCommand.SUBSCRIBE) {
            return message;
        }

        String destination = accessor.getDestination();
        Principal user = accessor.getUser();
        if (!isAllowed(destination, user)) {
            log.warn("Rejected subscription to {} by {}", destination, user != null ? user.getName() : "anonymous");
            throw new PermissionDeniedException("Subscription to " + destination + " is not allowed");
        }
        return message;
    }

    boolean isAllowed(String destination, Principal user) {
        if (destination == null || user == null) {
            return false;
        }
        if (destination.startsWith(USER_DESTINATION_PREFIX)) {
            return true;
        }
        if (destination.startsWith(CONVERSATION_TOPIC_PREFIX)) {
            String conversationId = destination.substring(CONVERSATION_TOPIC_PREFIX.length());
            return !conversationId.isEmpty()
                    && conversationRepository.isParticipant(conversationId, user.getName());
        }
        return false;
    }
}
