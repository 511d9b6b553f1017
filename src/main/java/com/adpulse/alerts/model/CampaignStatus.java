package com.adpulse.alerts.model;

public enum CampaignStatus {
    ENABLED,
    PAUSED,
    REMOVED
}
