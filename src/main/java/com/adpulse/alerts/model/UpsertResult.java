package com.adpulse.alerts.model;

/**
 * Alert returned by the deduplicator together with what happened to it.
 */
public record UpsertResult(Alert alert, Outcome outcome) {

    public enum Outcome {
        CREATED,
        REFRESHED,
        UNCHANGED
    }

    /**
     * Whether the store was written, i.e. the alert is worth (re)notifying.
     */
    public boolean changed() {
        return outcome != Outcome.UNCHANGED;
    }
}
