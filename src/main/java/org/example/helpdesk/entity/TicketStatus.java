package org.example.helpdesk.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum TicketStatus {

    OPEN("open"),
    IN_PROGRESS("in_progress"),
    RESOLVED("resolved"),
    CLOSED("closed");

    private final String value;

    TicketStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<TicketStatus> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim();
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(candidate) || status.name().equalsIgnoreCase(candidate))
                .findFirst();
    }

    @JsonCreator
    public static TicketStatus fromJson(String raw) {
        return fromValue(raw)
                .orElseThrow(() -> new IllegalArgumentException("Invalid status: " + raw
                        + ". Valid values: open, in_progress, resolved, closed"));
    }
}
