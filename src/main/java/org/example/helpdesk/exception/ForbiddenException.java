package org.example.helpdesk.exception;

import lombok.Getter;
import org.example.helpdesk.entity.UserRole;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when the caller is authenticated but not allowed to perform the action.
 *
 * <p>When raised by the role guard, {@code userRole} and {@code requiredRoles}
 * are filled in so the error body can name them. Ownership checks in handlers
 * leave them empty.</p>
 */
@Getter
public class ForbiddenException extends HelpdeskException {

    private static final String ERROR_CODE = "FORBIDDEN";
    public static final String INSUFFICIENT_PERMISSIONS = "Insufficient permissions";

    private final UserRole userRole;
    private final List<UserRole> requiredRoles;

    public ForbiddenException(String message) {
        super(message, ERROR_CODE);
        this.userRole = null;
        this.requiredRoles = Collections.emptyList();
    }

    public ForbiddenException(UserRole userRole, List<UserRole> requiredRoles) {
        super(INSUFFICIENT_PERMISSIONS, ERROR_CODE);
        this.userRole = userRole;
        this.requiredRoles = List.copyOf(requiredRoles);
    }
}
