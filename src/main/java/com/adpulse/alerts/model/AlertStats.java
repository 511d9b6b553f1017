package com.adpulse.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertStats {
    private long totalActive;
    private long unread;
    private long lastWeek;                          // created in the trailing window
    private Map<AlertPriority, Long> byPriority;    // ACTIVE only
    private Map<AlertType, Long> byType;            // ACTIVE, created in the trailing window
    private Map<AlertStatus, Long> byStatus;
}
