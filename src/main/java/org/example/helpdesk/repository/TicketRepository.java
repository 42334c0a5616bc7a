package org.example.helpdesk.repository;

import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository interface for Ticket entity.
 * Extends JpaRepository for basic CRUD and JpaSpecificationExecutor for the
 * filtered list and the SLA breach query.
 */
@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long>, JpaSpecificationExecutor<Ticket> {

    // ==================== COUNTS ====================

    long countByStatus(TicketStatus status);

    long countByAssigneeId(Long assigneeId);

    /**
     * Tickets in {@code status} whose first resolution falls in {@code [from, to)}.
     * {@code resolvedAt} survives a reopen, so the status has to be matched as well.
     */
    long countByStatusAndResolvedAtGreaterThanEqualAndResolvedAtLessThan(TicketStatus status,
                                                                          LocalDateTime from,
                                                                          LocalDateTime to);

    /**
     * Used before deleting a user: tickets keep weak references to their requester and assignee.
     */
    @Query("SELECT COUNT(t) FROM Ticket t WHERE t.requesterId = :userId OR t.assigneeId = :userId")
    long countReferencingUser(@Param("userId") Long userId);

    // ==================== READ OPERATIONS ====================

    /**
     * Creation and resolution times of tickets currently in the given status
     * that have been resolved at least once.
     */
    @Query("SELECT t.createdAt AS createdAt, t.resolvedAt AS resolvedAt FROM Ticket t "
            + "WHERE t.status = :status AND t.resolvedAt IS NOT NULL")
    List<ResolutionWindow> findResolutionWindows(@Param("status") TicketStatus status);

    @Query("SELECT t FROM Ticket t ORDER BY t.createdAt DESC, t.id DESC")
    List<Ticket> findRecent(Pageable pageable);

    @Query("SELECT t FROM Ticket t WHERE t.requesterId = :requesterId ORDER BY t.createdAt DESC, t.id DESC")
    List<Ticket> findRecentByRequester(@Param("requesterId") Long requesterId, Pageable pageable);

    interface ResolutionWindow {
        LocalDateTime getCreatedAt();

        LocalDateTime getResolvedAt();
    }
}
