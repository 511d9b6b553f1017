package com.adpulse.alerts.exception;

/** A notification channel failed to deliver. */
public class ChannelException extends AlertEngineException {
    private static final long serialVersionUID = 2381148879504170326L;

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
