package org.example.helpdesk.exception;

/**
 * Thrown when a token fails signature, structure, issuer or lifetime checks.
 * The public message is the same for every cause; the reason is kept for logs.
 */
public class InvalidTokenException extends HelpdeskException {

    private static final String ERROR_CODE = "INVALID_TOKEN";
    public static final String MESSAGE = "Invalid or expired token";

    private final String reason;

    public InvalidTokenException(String reason) {
        super(MESSAGE, ERROR_CODE);
        this.reason = reason;
    }

    public InvalidTokenException(String reason, Throwable cause) {
        super(MESSAGE, ERROR_CODE, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
