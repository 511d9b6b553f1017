package com.adpulse.alerts.exception;

/** The caller does not own the alert or campaign it tried to access. */
public class PermissionDeniedException extends AlertEngineException {
    private static final long serialVersionUID = -3071405596410183212L;

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
