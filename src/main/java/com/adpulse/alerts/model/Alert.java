package com.adpulse.alerts.model;

import com.adpulse.alerts.model.detail.AlertDetail;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    /**
     * Listing order for operators: unread first, then most severe, then newest.
     */
    public static final Comparator<Alert> INBOX_ORDER = Comparator
            .comparing(Alert::isRead)
            .thenComparing(Alert::getPriority, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingLong(Alert::getCreatedAt).reversed());

    private String id;
    private String campaignId;
    private String recipientId;

    private AlertType type;
    private AlertPriority priority;
    private AlertStatus status;

    private String title;
    private String message;
    private double threshold;
    private double currentValue;
    private Double previousValue;       // null when the detector has no baseline (impression loss)
    private AlertDetail detail;

    private boolean read;
    private long readAt;                // 0 until read

    private boolean emailSent;
    private boolean chatSent;

    private long createdAt;
    private long updatedAt;
    private long resolvedAt;            // 0 until resolved or dismissed
}
