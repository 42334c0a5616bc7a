package org.example.helpdesk.exception;

public class InvalidRefreshTokenException extends HelpdeskException {

    private static final String ERROR_CODE = "INVALID_REFRESH_TOKEN";

    public InvalidRefreshTokenException() {
        super("Invalid or expired refresh token", ERROR_CODE);
    }

    public InvalidRefreshTokenException(Throwable cause) {
        super("Invalid or expired refresh token", ERROR_CODE, cause);
    }
}
