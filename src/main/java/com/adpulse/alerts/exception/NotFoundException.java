package com.adpulse.alerts.exception;

/** The campaign or alert does not exist. */
public class NotFoundException extends AlertEngineException {
    private static final long serialVersionUID = 6627018353120397051L;

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
