package com.adpulse.alerts.model;

public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    DISMISSED;

    /**
     * RESOLVED and DISMISSED are final; only alerts in these states may be deleted.
     */
    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED;
    }
}
