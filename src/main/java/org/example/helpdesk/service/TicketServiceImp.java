package org.example.helpdesk.service;

import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.PagedResponse;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.dto.TicketFilter;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.exception.ForbiddenException;
import org.example.helpdesk.exception.TicketNotFoundException;
import org.example.helpdesk.mapper.TicketMapper;
import org.example.helpdesk.repository.TicketRepository;
import org.example.helpdesk.security.RequestIdentity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ticket operations on top of the SLA deadline engine.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class TicketServiceImp implements TicketService {

    private final TicketRepository ticketRepository;
    private final TicketMapper ticketMapper;
    private final TicketValidationService validationService;
    private final SlaPolicyService slaPolicyService;
    private final UserService userService;

    // ==================== CREATE ====================

    @Override
    public TicketDTO createTicket(TicketCreateRequest request, RequestIdentity caller) {
        validationService.validateCreateRequest(request);

        Long requesterId = caller.userId();
        if (caller.isStaff() && request.getRequesterId() != null) {
            requesterId = userService.loadUser(request.getRequesterId()).getId();
        }

        log.info("📝 Creating ticket for requester {} (by user {})", requesterId, caller.userId());

        Ticket ticket = ticketMapper.toEntity(request, requesterId);
        slaPolicyService.onCreate(ticket);
        Ticket savedTicket = ticketRepository.save(ticket);

        log.info("✅ Ticket created - id: {}, priority: {}, SLA deadline: {}",
                savedTicket.getId(), savedTicket.getPriority(), savedTicket.getSlaBreachAt());
        return ticketMapper.toDTO(savedTicket);
    }

    // ==================== READ ====================

    @Override
    @Transactional(readOnly = true)
    public TicketDTO getTicketById(Long id, RequestIdentity caller) {
        validationService.validateId(id, "Ticket ID");
        log.debug("🔍 Fetching ticket {}", id);
        return ticketMapper.toDTO(loadVisibleTicket(id, caller));
    }

    @Override
    @Transactional(readOnly = true)
    public PagedResponse<TicketDTO> getTickets(TicketFilter filter, int page, int size, RequestIdentity caller) {
        TicketFilter effective = filter != null ? filter : new TicketFilter();
        int safePage = Math.max(page, 0);
        int safeSize = size < 1 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);

        Pageable pageable = PageRequest.of(safePage, safeSize,
                Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));

        LocalDateTime now = slaPolicyService.now();
        Specification<Ticket> spec = buildFilterSpecification(effective, caller);
        if (effective.isSlaBreached()) {
            spec = spec.and(slaPolicyService.breachedAt(now));
        }

        Page<Ticket> ticketPage = ticketRepository.findAll(spec, pageable);
        List<TicketDTO> ticketDTOs = ticketPage.getContent().stream()
                .map(ticket -> ticketMapper.toDTO(ticket, now))
                .toList();

        log.debug("🔍 Ticket list page {} size {} -> {} of {}",
                safePage, safeSize, ticketDTOs.size(), ticketPage.getTotalElements());
        return PagedResponse.of(ticketPage, ticketDTOs);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TicketDTO> getRecentTickets(int limit, RequestIdentity caller) {
        int safeLimit = limit < 1 ? DEFAULT_RECENT_LIMIT : Math.min(limit, MAX_RECENT_LIMIT);
        Pageable pageable = PageRequest.of(0, safeLimit);

        List<Ticket> tickets = caller.isStaff()
                ? ticketRepository.findRecent(pageable)
                : ticketRepository.findRecentByRequester(caller.userId(), pageable);
        return ticketMapper.toDTOs(tickets);
    }

    // ==================== UPDATE ====================

    @Override
    public TicketDTO updateTicket(Long id, TicketUpdateRequest request, RequestIdentity caller) {
        TicketStatus newStatus = validationService.validateUpdateRequest(id, request);
        Ticket ticket = loadVisibleTicket(id, caller);

        if (StringUtils.hasText(request.getTitle())) {
            ticket.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            ticket.setDescription(request.getDescription().trim());
        }
        if (request.getCategory() != null) {
            ticket.setCategory(request.getCategory().trim());
        }
        if (request.getPriority() != null) {
            // deadline stays where it was set at creation
            ticket.setPriority(TicketMapper.normalizePriority(request.getPriority()));
        }
        if (newStatus != null) {
            applyStatus(ticket, newStatus);
        }

        Ticket updatedTicket = ticketRepository.save(ticket);
        log.info("✅ Ticket updated - id: {}", id);
        return ticketMapper.toDTO(updatedTicket);
    }

    @Override
    public TicketDTO updateTicketStatus(Long id, String status, RequestIdentity caller) {
        validationService.validateId(id, "Ticket ID");
        TicketStatus newStatus = validationService.parseStatus(status);
        Ticket ticket = loadVisibleTicket(id, caller);

        TicketStatus oldStatus = ticket.getStatus();
        if (oldStatus == newStatus) {
            log.debug("Status unchanged for ticket {}: {}", id, oldStatus);
            return ticketMapper.toDTO(ticket);
        }

        applyStatus(ticket, newStatus);
        Ticket updatedTicket = ticketRepository.save(ticket);

        log.info("✅ Status updated - id: {}, {} -> {}", id, oldStatus, newStatus);
        return ticketMapper.toDTO(updatedTicket);
    }

    @Override
    public TicketDTO assignTicket(Long id, Long assigneeId) {
        validationService.validateId(id, "Ticket ID");
        validationService.validateId(assigneeId, "Assignee ID");

        Ticket ticket = ticketRepository.findById(id)
                .orElseThrow(() -> new TicketNotFoundException(id));
        userService.requireActiveStaff(assigneeId);

        ticket.setAssigneeId(assigneeId);
        if (ticket.getStatus() == TicketStatus.OPEN) {
            applyStatus(ticket, TicketStatus.IN_PROGRESS);
        }

        Ticket updatedTicket = ticketRepository.save(ticket);
        log.info("✅ Ticket {} assigned to user {}", id, assigneeId);
        return ticketMapper.toDTO(updatedTicket);
    }

    // ==================== DELETE ====================

    @Override
    public void deleteTicket(Long id) {
        validationService.validateId(id, "Ticket ID");
        log.info("🗑️ Deleting ticket with ID: {}", id);

        Ticket ticket = ticketRepository.findById(id)
                .orElseThrow(() -> new TicketNotFoundException(id));
        validationService.validateTicketCanBeDeleted(ticket);

        ticketRepository.delete(ticket);
        log.info("✅ Ticket deleted - id: {}", id);
    }

    // ==================== HELPER METHODS ====================

    private Ticket loadVisibleTicket(Long id, RequestIdentity caller) {
        Ticket ticket = ticketRepository.findById(id)
                .orElseThrow(() -> new TicketNotFoundException(id));
        if (!caller.isStaff() && !caller.userId().equals(ticket.getRequesterId())) {
            log.warn("⚠️ User {} tried to access ticket {} owned by {}", caller.userId(), id, ticket.getRequesterId());
            throw new ForbiddenException("You can only access your own tickets");
        }
        return ticket;
    }

    private void applyStatus(Ticket ticket, TicketStatus newStatus) {
        validationService.validateStatusTransition(ticket.getStatus(), newStatus);
        ticket.setStatus(newStatus);
        slaPolicyService.onStatusChange(ticket, newStatus);
    }

    /**
     * End users are always restricted to their own tickets whatever filter they send.
     */
    private Specification<Ticket> buildFilterSpecification(TicketFilter filter, RequestIdentity caller) {
        TicketStatus status = StringUtils.hasText(filter.getStatus())
                ? validationService.parseStatus(filter.getStatus())
                : null;
        String priority = StringUtils.hasText(filter.getPriority())
                ? TicketMapper.normalizePriority(filter.getPriority())
                : null;
        Long requesterId = caller.isStaff() ? filter.getRequesterId() : caller.userId();
        Long assigneeId = filter.isAssignedToMe() ? caller.userId() : filter.getAssigneeId();

        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (priority != null) {
                predicates.add(cb.equal(root.get("priority"), priority));
            }
            if (requesterId != null) {
                predicates.add(cb.equal(root.get("requesterId"), requesterId));
            }
            if (assigneeId != null) {
                predicates.add(cb.equal(root.get("assigneeId"), assigneeId));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
