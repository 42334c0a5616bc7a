package org.example.helpdesk.exception;

/**
 * Thrown when a protected route is called without a usable bearer token.
 */
public class UnauthenticatedException extends HelpdeskException {

    private static final String ERROR_CODE = "UNAUTHENTICATED";

    public UnauthenticatedException(String message) {
        super(message, ERROR_CODE);
    }
}
