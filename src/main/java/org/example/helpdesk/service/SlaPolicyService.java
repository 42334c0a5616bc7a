package org.example.helpdesk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketPriority;
import org.example.helpdesk.entity.TicketStatus;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * SLA deadline engine.
 *
 * <p>The deadline is fixed when a ticket is created and never recomputed, even
 * if the priority changes later. A ticket is breached when the current time is
 * strictly after its deadline and it is neither RESOLVED nor CLOSED.
 * {@link #isBreached(Ticket, LocalDateTime)} and {@link #breachedAt(LocalDateTime)}
 * are the in-memory and query forms of the same rule; every breach figure in the
 * API goes through one of them.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlaPolicyService {

    public static final int DEFAULT_SLA_HOURS = TicketPriority.MEDIUM.getSlaHours();

    /** Statuses that can never be in breach. */
    public static final Set<TicketStatus> SLA_STOPPED_STATUSES =
            EnumSet.of(TicketStatus.RESOLVED, TicketStatus.CLOSED);

    private final Clock clock;

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Hours allowed for a priority. Unknown or missing priorities get the default window.
     */
    public int hoursFor(String priority) {
        return TicketPriority.fromValue(priority)
                .map(TicketPriority::getSlaHours)
                .orElse(DEFAULT_SLA_HOURS);
    }

    // ==================== WRITE SIDE ====================

    /**
     * Stamps creation time and the SLA deadline on a new ticket.
     */
    public void onCreate(Ticket ticket) {
        LocalDateTime now = now();
        ticket.setCreatedAt(now);
        ticket.setUpdatedAt(now);
        ticket.setSlaBreachAt(now.plusHours(hoursFor(ticket.getPriority())));
        log.debug("⏱️ SLA deadline set to {} for priority '{}'", ticket.getSlaBreachAt(), ticket.getPriority());
    }

    /**
     * Records the first resolution. Later moves out of and back into RESOLVED
     * keep the original timestamp.
     */
    public void onStatusChange(Ticket ticket, TicketStatus newStatus) {
        if (newStatus == TicketStatus.RESOLVED && ticket.getResolvedAt() == null) {
            ticket.setResolvedAt(now());
            log.debug("⏱️ Ticket {} resolved at {}", ticket.getId(), ticket.getResolvedAt());
        }
    }

    // ==================== BREACH PREDICATE ====================

    public boolean isBreached(Ticket ticket, LocalDateTime now) {
        return ticket.getSlaBreachAt() != null
                && now.isAfter(ticket.getSlaBreachAt())
                && !SLA_STOPPED_STATUSES.contains(ticket.getStatus());
    }

    public boolean isBreached(Ticket ticket) {
        return isBreached(ticket, now());
    }

    /**
     * Query form of {@link #isBreached(Ticket, LocalDateTime)}.
     */
    public Specification<Ticket> breachedAt(LocalDateTime now) {
        return (root, query, cb) -> cb.and(
                cb.isNotNull(root.get("slaBreachAt")),
                cb.lessThan(root.<LocalDateTime>get("slaBreachAt"), now),
                cb.not(root.get("status").in(SLA_STOPPED_STATUSES))
        );
    }
}
