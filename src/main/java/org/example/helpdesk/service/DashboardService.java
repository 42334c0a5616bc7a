package org.example.helpdesk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.DashboardStats;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.repository.TicketRepository;
import org.example.helpdesk.security.RequestIdentity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only dashboard counters. "Today" is the current UTC calendar day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DashboardService {

    private final TicketRepository ticketRepository;
    private final SlaPolicyService slaPolicyService;

    public DashboardStats getStats(RequestIdentity caller) {
        LocalDateTime now = slaPolicyService.now();
        LocalDateTime startOfDay = now.toLocalDate().atStartOfDay();

        long assignedToMe = caller.isStaff() ? ticketRepository.countByAssigneeId(caller.userId()) : 0L;

        DashboardStats stats = DashboardStats.builder()
                .totalTickets(ticketRepository.count())
                .openTickets(ticketRepository.countByStatus(TicketStatus.OPEN))
                .assignedToMe(assignedToMe)
                .slaBreaches(ticketRepository.count(slaPolicyService.breachedAt(now)))
                .resolvedToday(ticketRepository.countByStatusAndResolvedAtGreaterThanEqualAndResolvedAtLessThan(
                        TicketStatus.RESOLVED, startOfDay, startOfDay.plusDays(1)))
                .averageResolutionTime(averageResolutionHours())
                .build();

        log.debug("📊 Dashboard stats for user {}: {}", caller.userId(), stats);
        return stats;
    }

    /**
     * Mean hours from creation to first resolution over tickets currently
     * resolved, truncated to whole hours. Zero when there are none.
     */
    long averageResolutionHours() {
        List<TicketRepository.ResolutionWindow> windows =
                ticketRepository.findResolutionWindows(TicketStatus.RESOLVED);
        if (windows.isEmpty()) {
            return 0L;
        }
        long totalSeconds = windows.stream()
                .mapToLong(window -> Duration.between(window.getCreatedAt(), window.getResolvedAt()).getSeconds())
                .sum();
        return totalSeconds / windows.size() / 3600;
    }
}
