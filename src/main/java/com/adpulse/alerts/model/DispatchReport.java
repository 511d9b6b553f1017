package com.adpulse.alerts.model;

/**
 * Per-channel outcome of one dispatch. A channel is true only on confirmed success.
 */
public record DispatchReport(String alertId, boolean realtimeDelivered, boolean emailSent, boolean chatSent) {

    public boolean fullyDelivered() {
        return realtimeDelivered && emailSent && chatSent;
    }
}
