package org.example.helpdesk.exception;

/**
 * Exception thrown when an operation is not allowed in the current state,
 * such as a disallowed status transition or deleting a referenced user.
 */
public class InvalidOperationException extends HelpdeskException {

    private static final String ERROR_CODE = "INVALID_OPERATION";

    public InvalidOperationException(String message) {
        super(message, ERROR_CODE);
    }

    public InvalidOperationException(String operation, String reason) {
        super(String.format("Cannot %s: %s", operation, reason), ERROR_CODE);
    }
}
