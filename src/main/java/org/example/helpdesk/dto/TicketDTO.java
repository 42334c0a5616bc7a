package org.example.helpdesk.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.helpdesk.entity.TicketStatus;

import java.time.LocalDateTime;

/**
 * Data Transfer Object for Ticket.
 * {@code slaBreached} is evaluated when the DTO is built, never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketDTO {

    private Long id;
    private String title;
    private String description;
    private String category;
    private TicketStatus status;
    private String priority;
    private Long requesterId;
    private Long assigneeId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime slaBreachAt;
    private LocalDateTime resolvedAt;
    private boolean slaBreached;
}
