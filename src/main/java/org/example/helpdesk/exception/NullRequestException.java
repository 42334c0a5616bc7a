package org.example.helpdesk.exception;

import lombok.Getter;

/**
 * Exception thrown when a required request body or field is null or missing.
 */
@Getter
public class NullRequestException extends HelpdeskException {

    private static final String ERROR_CODE = "NULL_REQUEST";

    /**
     * The field name that was null.
     */
    private final String field;

    public NullRequestException(String resourceName) {
        super(String.format("%s request cannot be null or empty", resourceName), ERROR_CODE);
        this.field = resourceName;
    }

    public NullRequestException(String resourceName, String message) {
        super(message, ERROR_CODE);
        this.field = resourceName;
    }
}
