package org.example.helpdesk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query parameters of the ticket list. All fields are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketFilter {

    private String status;
    private String priority;
    private Long requesterId;
    private Long assigneeId;
    private boolean assignedToMe;
    private boolean slaBreached;
}
