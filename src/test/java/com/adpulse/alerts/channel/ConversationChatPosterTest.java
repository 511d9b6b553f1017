package com.adpulse.alerts.channel;

import com.adpulse.alerts.exception.ChannelException;
import com.adpulse.alerts.exception.PersistenceException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertStatus;
import com.adpulse.alerts.model.Campaign;
import com.adpulse.alerts.model.ChatMessage;
import com.adpulse.alerts.repository.CampaignRepository;
import com.adpulse.alerts.repository.ConversationRepository;
import com.adpulse.alerts.testutil.MutableClock;
import com.adpulse.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationChatPosterTest {

    @Mock private CampaignRepository campaignRepository;
    @Mock private ConversationRepository conversationRepository;

    private MutableClock clock;
    private ConversationChatPoster chatPoster;
    private Campaign campaign;
    private Alert alert;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-12T11:00:00Z"));
        chatPoster = new ConversationChatPoster(campaignRepository, conversationRepository, clock);
        campaign = TestDataFactory.createCampaign("camp-1");
        alert = TestDataFactory.createAlert("alert-1", TestDataFactory.MANAGER_ID, AlertStatus.ACTIVE);
    }

    @Test
    void postSystemMessage_existingConversation_savesAlertMessage() {
        when(campaignRepository.findById("camp-1")).thenReturn(Optional.of(campaign));
        when(conversationRepository.findConversationId(TestDataFactory.MANAGER_ID, TestDataFactory.TENANT_ID))
                .thenReturn(Optional.of("conv-9"));
        when(conversationRepository.saveMessage(any(ChatMessage.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        String conversationId = chatPoster.postSystemMessage("camp-1", alert);

        ArgumentCaptor<ChatMessage> saved = ArgumentCaptor.forClass(ChatMessage.class);
        verify(conversationRepository).saveMessage(saved.capture());
        assertThat(conversationId).isEqualTo("conv-9");
        assertThat(saved.getValue().getConversationId()).isEqualTo("conv-9");
        assertThat(saved.getValue().getSenderId()).isEqualTo("system");
        assertThat(saved.getValue().getMessageType()).isEqualTo("alert");
        assertThat(saved.getValue().getAlertId()).isEqualTo("alert-1");
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(clock.millis());
        assertThat(saved.getValue().getContent())
                .startsWith("[HIGH] ROAS drop")
                .contains("Campaign camp-1")
                .contains(alert.getMessage());
    }

    @Test
    void postSystemMessage_noConversation_fails() {
        when(campaignRepository.findById("camp-1")).thenReturn(Optional.of(campaign));
        when(conversationRepository.findConversationId(any(), any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> chatPoster.postSystemMessage("camp-1", alert))
                .isInstanceOf(ChannelException.class)
                .hasMessageContaining("No conversation");
        verify(conversationRepository, never()).saveMessage(any());
    }

    @Test
    void postSystemMessage_unknownCampaign_fails() {
        when(campaignRepository.findById("camp-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> chatPoster.postSystemMessage("camp-1", alert))
                .isInstanceOf(ChannelException.class);
        verifyNoInteractions(conversationRepository);
    }

    @Test
    void postSystemMessage_storeFailure_becomesChannelException() {
        when(campaignRepository.findById("camp-1")).thenReturn(Optional.of(campaign));
        when(conversationRepository.findConversationId(any(), any()))
                .thenThrow(new PersistenceException("timeout"));

        assertThatThrownBy(() -> chatPoster.postSystemMessage("camp-1", alert))
                .isInstanceOf(ChannelException.class)
                .hasCauseInstanceOf(PersistenceException.class);
    }
}
