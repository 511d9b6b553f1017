package com.adpulse.alerts.exception;

/** Metrics could not be fetched for a campaign; the campaign is skipped for the run. */
public class ProviderException extends AlertEngineException {
    private static final long serialVersionUID = 8854930121843769112L;

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
