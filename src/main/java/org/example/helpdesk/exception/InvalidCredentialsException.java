package org.example.helpdesk.exception;

/**
 * Thrown when login fails. The message never says whether the email exists.
 */
public class InvalidCredentialsException extends HelpdeskException {

    private static final String ERROR_CODE = "INVALID_CREDENTIALS";

    public InvalidCredentialsException() {
        super("Invalid email or password", ERROR_CODE);
    }
}
