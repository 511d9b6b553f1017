package com.adpulse.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {
    private String id;
    private String conversationId;
    private String senderId;
    private String content;
    private String messageType;         // "text" or "alert"
    private String alertId;
    private long createdAt;
}
