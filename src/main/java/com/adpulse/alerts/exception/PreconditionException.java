package com.adpulse.alerts.exception;

/** The operation is not allowed in the alert's current state. */
public class PreconditionException extends AlertEngineException {
    private static final long serialVersionUID = 7290164415562385011L;

    public PreconditionException(String message) {
        super(message);
    }

    public PreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
