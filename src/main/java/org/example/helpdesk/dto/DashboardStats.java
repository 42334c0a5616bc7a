package org.example.helpdesk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard counters. {@code averageResolutionTime} is in whole hours.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardStats {

    private long totalTickets;
    private long openTickets;
    private long assignedToMe;
    private long slaBreaches;
    private long resolvedToday;
    private long averageResolutionTime;
}
