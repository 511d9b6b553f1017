package com.adpulse.alerts.exception;

/**
 * Base of every failure the alert engine raises on purpose.
 */
public class AlertEngineException extends RuntimeException {
    private static final long serialVersionUID = 4210559381760314427L;

    public AlertEngineException(String message) {
        super(message);
    }

    public AlertEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
