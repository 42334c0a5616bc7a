package org.example.helpdesk.service;

import org.example.helpdesk.dto.PagedResponse;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.dto.TicketFilter;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.example.helpdesk.security.RequestIdentity;

import java.util.List;

/**
 * Service interface for ticket operations.
 *
 * <p>Role checks happen before these methods are reached. Ownership rules
 * (end users only see and change their own tickets) are enforced here, using
 * the caller identity passed in.</p>
 */
public interface TicketService {

    int DEFAULT_RECENT_LIMIT = 5;
    int MAX_RECENT_LIMIT = 50;
    int DEFAULT_PAGE_SIZE = 10;
    int MAX_PAGE_SIZE = 100;

    /**
     * Create a new ticket and fix its SLA deadline.
     *
     * @throws org.example.helpdesk.exception.NullRequestException if request is null
     * @throws org.example.helpdesk.exception.UserNotFoundException if a staff caller names an unknown requester
     */
    TicketDTO createTicket(TicketCreateRequest request, RequestIdentity caller);

    /**
     * @throws org.example.helpdesk.exception.TicketNotFoundException if not found
     * @throws org.example.helpdesk.exception.ForbiddenException if an end user asks for someone else's ticket
     */
    TicketDTO getTicketById(Long id, RequestIdentity caller);

    PagedResponse<TicketDTO> getTickets(TicketFilter filter, int page, int size, RequestIdentity caller);

    /**
     * Most recent tickets first. Limits above 50 are capped; limits below 1 fall back to 5.
     */
    List<TicketDTO> getRecentTickets(int limit, RequestIdentity caller);

    /**
     * Partial update. A priority change never moves the SLA deadline.
     *
     * @throws org.example.helpdesk.exception.InvalidOperationException if the status transition is not allowed
     */
    TicketDTO updateTicket(Long id, TicketUpdateRequest request, RequestIdentity caller);

    TicketDTO updateTicketStatus(Long id, String status, RequestIdentity caller);

    /**
     * Assigns a ticket to an active agent or admin. An open ticket moves to in_progress.
     */
    TicketDTO assignTicket(Long id, Long assigneeId);

    /**
     * @throws org.example.helpdesk.exception.InvalidOperationException for resolved or closed tickets
     */
    void deleteTicket(Long id);
}
