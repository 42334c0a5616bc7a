package org.example.helpdesk.exception;

/**
 * Exception thrown when registering or creating a user with an email that is already taken.
 */
public class DuplicateEmailException extends HelpdeskException {

    private static final String ERROR_CODE = "DUPLICATE_EMAIL";

    public DuplicateEmailException(String email) {
        super("User with email " + email + " already exists", ERROR_CODE);
    }
}
