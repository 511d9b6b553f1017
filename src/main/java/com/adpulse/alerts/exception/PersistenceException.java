package com.adpulse.alerts.exception;

/** The alert store rejected or failed a read or write. */
public class PersistenceException extends AlertEngineException {
    private static final long serialVersionUID = -5468302210937446013L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
