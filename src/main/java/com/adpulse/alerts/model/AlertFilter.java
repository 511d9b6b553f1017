package com.adpulse.alerts.model;

import lombok.Builder;
import lombok.Value;

/**
 * Listing criteria. Every field is optional except the recipient the listing is scoped to.
 */
@Value
@Builder(toBuilder = true)
public class AlertFilter {
    String recipientId;
    AlertStatus status;
    AlertPriority priority;
    AlertType type;
    String campaignId;
    Boolean read;
    Long createdFrom;       // inclusive, epoch millis
    Long createdTo;         // inclusive, epoch millis

    public boolean matches(Alert alert) {
        if (recipientId != null && !recipientId.equals(alert.getRecipientId())) return false;
        if (status != null && status != alert.getStatus()) return false;
        if (priority != null && priority != alert.getPriority()) return false;
        if (type != null && type != alert.getType()) return false;
        if (campaignId != null && !campaignId.equals(alert.getCampaignId())) return false;
        if (read != null && read != alert.isRead()) return false;
        if (createdFrom != null && alert.getCreatedAt() < createdFrom) return false;
        if (createdTo != null && alert.getCreatedAt() > createdTo) return false;
        return true;
    }
}
