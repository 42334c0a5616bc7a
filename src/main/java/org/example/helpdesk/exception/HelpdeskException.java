package org.example.helpdesk.exception;

/**
 * Base exception class for all help desk exceptions.
 * Carries a stable error code alongside the message.
 */
public abstract class HelpdeskException extends RuntimeException {

    private final String errorCode;

    protected HelpdeskException(String message) {
        super(message);
        this.errorCode = "HELPDESK_ERROR";
    }

    protected HelpdeskException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected HelpdeskException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
