package com.adpulse.alerts.model;

import com.adpulse.alerts.model.detail.AlertDetail;
import lombok.Builder;
import lombok.Value;

/**
 * Partial update of an alert. Only non-null fields are written, so concurrent writers
 * touching different fields (e.g. the email and chat delivery flags) do not clobber each other.
 */
@Value
@Builder
public class AlertUpdate {
    AlertStatus status;
    Double currentValue;
    Double previousValue;
    boolean clearPreviousValue;
    String message;
    AlertDetail detail;
    Boolean read;
    Long readAt;
    Boolean emailSent;
    Boolean chatSent;
    Long updatedAt;
    Long resolvedAt;

    public static AlertUpdate emailSent() {
        return AlertUpdate.builder().emailSent(true).build();
    }

    public static AlertUpdate chatSent() {
        return AlertUpdate.builder().chatSent(true).build();
    }

    public static AlertUpdate read(long at) {
        return AlertUpdate.builder().read(true).readAt(at).updatedAt(at).build();
    }

    /**
     * Apply this update to an in-memory copy of the alert.
     */
    public Alert applyTo(Alert alert) {
        Alert.AlertBuilder b = alert.toBuilder();
        if (status != null) b.status(status);
        if (currentValue != null) b.currentValue(currentValue);
        if (previousValue != null) b.previousValue(previousValue);
        if (clearPreviousValue) b.previousValue(null);
        if (message != null) b.message(message);
        if (detail != null) b.detail(detail);
        if (read != null) b.read(read);
        if (readAt != null) b.readAt(readAt);
        if (emailSent != null) b.emailSent(emailSent);
        if (chatSent != null) b.chatSent(chatSent);
        if (updatedAt != null) b.updatedAt(updatedAt);
        if (resolvedAt != null) b.resolvedAt(resolvedAt);
        return b.build();
    }
}
