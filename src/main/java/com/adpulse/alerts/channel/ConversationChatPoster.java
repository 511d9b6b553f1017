package com.adpulse.alerts.channel;

import com.adpulse.alerts.exception.ChannelException;
import com.adpulse.alerts.exception.PersistenceException;
import com.adpulse.alerts.exception.ProviderException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.Campaign;
import com.adpulse.alerts.model.ChatMessage;
import com.adpulse.alerts.repository.CampaignRepository;
import com.adpulse.alerts.repository.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Drops the alert into the manager/advertiser conversation as a system message. Campaigns whose
 * manager has never talked to the advertiser have no conversation, and the post fails.
 */
@Component
public class ConversationChatPoster implements ChatPoster {

    private static final Logger log = LoggerFactory.getLogger(ConversationChatPoster.class);

    static final String SYSTEM_SENDER = "system";
    static final String ALERT_MESSAGE_TYPE = "alert";

    private final CampaignRepository campaignRepository;
    private final ConversationRepository conversationRepository;
    private final Clock clock;

    public ConversationChatPoster(CampaignRepository campaignRepository,
                                  ConversationRepository conversationRepository,
                                  Clock clock) {
        this.campaignRepository = campaignRepository;
        this.conversationRepository = conversationRepository;
        this.clock = clock;
    }

    @Override
    public String postSystemMessage(String campaignId, Alert alert) {
        try {
            Campaign campaign = campaignRepository.findById(campaignId)
                    .orElseThrow(() -> new ChannelException("Campaign not found: " + campaignId));

            String conversationId = conversationRepository
                    .findConversationId(campaign.getRecipientId(), campaign.getTenantId())
                    .orElseThrow(() -> new ChannelException("No conversation between manager "
                            + campaign.getRecipientId() + " and tenant " + campaign.getTenantId()));

            ChatMessage saved = conversationRepository.saveMessage(ChatMessage.builder()
                    .conversationId(conversationId)
                    .senderId(SYSTEM_SENDER)
                    .content(formatMessage(campaign, alert))
                    .messageType(ALERT_MESSAGE_TYPE)
                    .alertId(alert.getId())
                    .createdAt(clock.millis())
                    .build());

            log.debug("Alert {} posted to conversation {} as message {}", alert.getId(), conversationId, saved.getId());
            return conversationId;
        } catch (ProviderException | PersistenceException e) {
            throw new ChannelException("Failed to post alert " + alert.getId() + " to chat", e);
        }
    }

    static String formatMessage(Campaign campaign, Alert alert) {
        return String.format("[%s] %s (%s)%n%s", alert.getPriority(), alert.getTitle(), campaign.getName(), alert.getMessage());
    }
}
