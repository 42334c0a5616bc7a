package org.example.helpdesk.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.PagedResponse;
import org.example.helpdesk.dto.TicketAssignRequest;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.dto.TicketFilter;
import org.example.helpdesk.dto.TicketStatusUpdateRequest;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.security.RequestIdentity;
import org.example.helpdesk.security.RequireRole;
import org.example.helpdesk.service.TicketService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketService ticketService;

    // ==================== CREATE ====================

    /**
     * Create a new ticket.
     * POST /api/v1/tickets
     */
    @PostMapping
    public ResponseEntity<TicketDTO> createTicket(@Valid @RequestBody TicketCreateRequest request,
                                                  RequestIdentity identity) {
        log.info("POST /api/v1/tickets - Creating ticket");
        return new ResponseEntity<>(ticketService.createTicket(request, identity), HttpStatus.CREATED);
    }

    // ==================== READ ====================

    /**
     * Get a ticket by ID.
     * GET /api/v1/tickets/{id}
     */
    @GetMapping("/{id:\\d+}")
    public ResponseEntity<TicketDTO> getTicketById(@PathVariable Long id, RequestIdentity identity) {
        log.debug("GET /api/v1/tickets/{}", id);
        return ResponseEntity.ok(ticketService.getTicketById(id, identity));
    }

    /**
     * List tickets with filters and pagination.
     * GET /api/v1/tickets
     */
    @GetMapping
    public ResponseEntity<PagedResponse<TicketDTO>> getTickets(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String priority,
            @RequestParam(name = "requester_id", required = false) Long requesterId,
            @RequestParam(name = "assignee_id", required = false) Long assigneeId,
            @RequestParam(defaultValue = "false") boolean assignedToMe,
            @RequestParam(defaultValue = "false") boolean slaBreached,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size,
            RequestIdentity identity) {

        log.debug("GET /api/v1/tickets - page: {}, size: {}", page, size);
        TicketFilter filter = TicketFilter.builder()
                .status(status)
                .priority(priority)
                .requesterId(requesterId)
                .assigneeId(assigneeId)
                .assignedToMe(assignedToMe)
                .slaBreached(slaBreached)
                .build();
        return ResponseEntity.ok(ticketService.getTickets(filter, page, size, identity));
    }

    /**
     * Most recent tickets.
     * GET /api/v1/tickets/recent
     */
    @GetMapping("/recent")
    public ResponseEntity<List<TicketDTO>> getRecentTickets(
            @RequestParam(defaultValue = "5") int limit,
            RequestIdentity identity) {
        log.debug("GET /api/v1/tickets/recent - limit: {}", limit);
        return ResponseEntity.ok(ticketService.getRecentTickets(limit, identity));
    }

    // ==================== UPDATE ====================

    /**
     * Update a ticket.
     * PUT /api/v1/tickets/{id}
     */
    @PutMapping("/{id:\\d+}")
    public ResponseEntity<TicketDTO> updateTicket(@PathVariable Long id,
                                                  @Valid @RequestBody TicketUpdateRequest request,
                                                  RequestIdentity identity) {
        log.info("PUT /api/v1/tickets/{}", id);
        return ResponseEntity.ok(ticketService.updateTicket(id, request, identity));
    }

    /**
     * Update ticket status.
     * PATCH /api/v1/tickets/{id}/status
     */
    @PatchMapping("/{id:\\d+}/status")
    public ResponseEntity<TicketDTO> updateTicketStatus(@PathVariable Long id,
                                                        @Valid @RequestBody TicketStatusUpdateRequest request,
                                                        RequestIdentity identity) {
        log.info("PATCH /api/v1/tickets/{}/status", id);
        return ResponseEntity.ok(ticketService.updateTicketStatus(id, request.getStatus(), identity));
    }

    /**
     * Assign a ticket.
     * POST /api/v1/tickets/{id}/assign
     */
    @PostMapping("/{id:\\d+}/assign")
    @RequireRole({UserRole.ADMIN, UserRole.AGENT})
    public ResponseEntity<TicketDTO> assignTicket(@PathVariable Long id,
                                                  @Valid @RequestBody TicketAssignRequest request) {
        log.info("POST /api/v1/tickets/{}/assign - assignee {}", id, request.getAssigneeId());
        return ResponseEntity.ok(ticketService.assignTicket(id, request.getAssigneeId()));
    }

    // ==================== DELETE ====================

    /**
     * Delete a ticket.
     * DELETE /api/v1/tickets/{id}
     */
    @DeleteMapping("/{id:\\d+}")
    @RequireRole({UserRole.ADMIN, UserRole.AGENT})
    public ResponseEntity<Void> deleteTicket(@PathVariable Long id) {
        log.info("DELETE /api/v1/tickets/{}", id);
        ticketService.deleteTicket(id);
        return ResponseEntity.noContent().build();
    }
}
