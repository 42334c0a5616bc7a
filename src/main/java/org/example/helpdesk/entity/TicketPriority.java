package org.example.helpdesk.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known ticket priorities and their hours-to-breach.
 *
 * <p>Tickets store priority as free text so that a ticket with an
 * unrecognised priority can still be created; those fall back to the
 * default SLA window.</p>
 */
public enum TicketPriority {

    CRITICAL("critical", 4),
    HIGH("high", 8),
    MEDIUM("medium", 24),
    LOW("low", 72);

    private final String value;
    private final int slaHours;

    TicketPriority(String value, int slaHours) {
        this.value = value;
        this.slaHours = slaHours;
    }

    public String getValue() {
        return value;
    }

    public int getSlaHours() {
        return slaHours;
    }

    public static Optional<TicketPriority> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim();
        return Arrays.stream(values())
                .filter(priority -> priority.value.equalsIgnoreCase(candidate))
                .findFirst();
    }
}
