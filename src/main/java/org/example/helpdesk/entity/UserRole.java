package org.example.helpdesk.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Role of a user. This is the only input to authorization decisions.
 *
 * <p>The wire value ({@code admin}, {@code agent}, {@code end_user}) is what
 * appears in JSON bodies and in the {@code role} token claim.</p>
 */
public enum UserRole {

    ADMIN("admin"),
    AGENT("agent"),
    END_USER("end_user");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a wire value or constant name, ignoring case.
     */
    public static Optional<UserRole> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim();
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(candidate) || role.name().equalsIgnoreCase(candidate))
                .findFirst();
    }

    @JsonCreator
    public static UserRole fromJson(String raw) {
        return fromValue(raw)
                .orElseThrow(() -> new IllegalArgumentException("Invalid role: " + raw
                        + ". Valid values: admin, agent, end_user"));
    }

    public boolean isStaff() {
        return this == ADMIN || this == AGENT;
    }
}
