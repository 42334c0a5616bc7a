package org.example.helpdesk.service;

import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.exception.InvalidOperationException;
import org.example.helpdesk.exception.NullRequestException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field rules and state rules for tickets.
 *
 * <p>Bean validation on the request DTOs covers sizes and required fields;
 * this service covers what annotations cannot express: blank-if-present
 * fields, status values and the allowed status transitions.</p>
 */
@Slf4j
@Service
public class TicketValidationService {

    // ==================== CONSTANTS ====================

    /** Status transition rules: current status to allowed next statuses. */
    private static final Map<TicketStatus, Set<TicketStatus>> STATUS_TRANSITIONS = new EnumMap<>(TicketStatus.class);

    static {
        STATUS_TRANSITIONS.put(TicketStatus.OPEN,
                EnumSet.of(TicketStatus.IN_PROGRESS, TicketStatus.RESOLVED, TicketStatus.CLOSED));
        STATUS_TRANSITIONS.put(TicketStatus.IN_PROGRESS,
                EnumSet.of(TicketStatus.OPEN, TicketStatus.RESOLVED, TicketStatus.CLOSED));
        STATUS_TRANSITIONS.put(TicketStatus.RESOLVED,
                EnumSet.of(TicketStatus.OPEN, TicketStatus.IN_PROGRESS, TicketStatus.CLOSED));
        STATUS_TRANSITIONS.put(TicketStatus.CLOSED,
                EnumSet.of(TicketStatus.OPEN));
    }

    private static final String VALID_STATUSES = "open, in_progress, resolved, closed";

    // ==================== CREATE VALIDATION ====================

    /**
     * @throws NullRequestException if request is null
     * @throws IllegalArgumentException if a field rule fails
     */
    public void validateCreateRequest(TicketCreateRequest request) {
        log.debug("Validating create request...");

        if (request == null) {
            throw new NullRequestException("request", "Ticket create request cannot be null");
        }

        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(request.getTitle())) {
            errors.add("Title is required");
        }
        if (request.getRequesterId() != null && request.getRequesterId() <= 0) {
            errors.add("Requester ID must be a positive number");
        }
        throwIfErrors(errors);
    }

    // ==================== UPDATE VALIDATION ====================

    /**
     * @return the parsed target status, or null if the request does not change it
     */
    public TicketStatus validateUpdateRequest(Long id, TicketUpdateRequest request) {
        log.debug("Validating update request for ticket ID: {}", id);

        validateId(id, "Ticket ID");
        if (request == null) {
            throw new NullRequestException("request", "Ticket update request cannot be null");
        }

        List<String> errors = new ArrayList<>();

        String title = request.getTitle();
        if (title != null && !StringUtils.hasText(title)) {
            errors.add("Title cannot be blank if provided");
        }

        TicketStatus status = null;
        if (request.getStatus() != null) {
            status = TicketStatus.fromValue(request.getStatus()).orElse(null);
            if (status == null) {
                errors.add("Invalid status: " + request.getStatus() + ". Valid values: " + VALID_STATUSES);
            }
        }

        throwIfErrors(errors);
        return status;
    }

    // ==================== STATUS VALIDATION ====================

    /**
     * Parses a status value.
     *
     * @throws NullRequestException if status is null
     * @throws IllegalArgumentException if status is unknown
     */
    public TicketStatus parseStatus(String status) {
        if (status == null) {
            throw new NullRequestException("status", "Status cannot be null");
        }
        if (!StringUtils.hasText(status)) {
            throw new IllegalArgumentException("Status cannot be empty");
        }
        return TicketStatus.fromValue(status)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid status: " + status + ". Valid values: " + VALID_STATUSES));
    }

    /**
     * Same status is allowed as a no-op.
     *
     * @throws InvalidOperationException if the transition is not allowed
     */
    public void validateStatusTransition(TicketStatus current, TicketStatus next) {
        if (current == null || next == null) {
            throw new IllegalArgumentException("Current status and new status cannot be null");
        }
        if (current == next) {
            log.debug("Status unchanged: {}", current);
            return;
        }

        Set<TicketStatus> allowed = STATUS_TRANSITIONS.getOrDefault(current, EnumSet.noneOf(TicketStatus.class));
        if (!allowed.contains(next)) {
            log.warn("Invalid status transition: {} -> {}", current, next);
            throw new InvalidOperationException("update status",
                    String.format("cannot transition from '%s' to '%s'", current.getValue(), next.getValue()));
        }
        log.debug("Status transition {} -> {} is valid", current, next);
    }

    // ==================== TICKET STATE VALIDATION ====================

    /**
     * @throws InvalidOperationException if the ticket is resolved or closed
     */
    public void validateTicketCanBeDeleted(Ticket ticket) {
        if (ticket == null) {
            throw new NullRequestException("ticket", "Ticket cannot be null");
        }
        if (ticket.getStatus() == TicketStatus.RESOLVED) {
            throw new InvalidOperationException("delete ticket",
                    "resolved tickets cannot be deleted for audit purposes");
        }
        if (ticket.getStatus() == TicketStatus.CLOSED) {
            throw new InvalidOperationException("delete ticket",
                    "closed tickets cannot be deleted for audit purposes");
        }
    }

    // ==================== ID VALIDATION ====================

    public void validateId(Long id, String fieldName) {
        if (id == null) {
            throw new NullRequestException(fieldName, fieldName + " cannot be null");
        }
        if (id <= 0) {
            throw new IllegalArgumentException(fieldName + " must be a positive number");
        }
    }

    private void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            String errorMessage = String.join("; ", errors);
            log.warn("Validation failed: {}", errorMessage);
            throw new IllegalArgumentException(errorMessage);
        }
    }
}
