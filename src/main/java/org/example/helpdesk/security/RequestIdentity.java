package org.example.helpdesk.security;

import org.example.helpdesk.entity.UserRole;

/**
 * Caller identity for the current request, taken from a verified access token.
 * Controllers receive it as a method parameter.
 */
public record RequestIdentity(Long userId, String email, UserRole role) {

    public static final String ATTRIBUTE = RequestIdentity.class.getName();

    public boolean isStaff() {
        return role != null && role.isStaff();
    }

    public boolean hasRole(UserRole candidate) {
        return role == candidate;
    }
}
