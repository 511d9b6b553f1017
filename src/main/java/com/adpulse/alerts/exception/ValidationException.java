package com.adpulse.alerts.exception;

/** Malformed identifier or input, rejected before any side effect. */
public class ValidationException extends AlertEngineException {
    private static final long serialVersionUID = -1952846061290846716L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
