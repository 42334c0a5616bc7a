package org.example.helpdesk.exception;

public class UserNotFoundException extends HelpdeskException {

    private static final String ERROR_CODE = "USER_NOT_FOUND";

    public UserNotFoundException(Long id) {
        super("User not found with id: " + id, ERROR_CODE);
    }
}
