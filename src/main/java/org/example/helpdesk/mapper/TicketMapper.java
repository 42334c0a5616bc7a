package org.example.helpdesk.mapper;

import lombok.RequiredArgsConstructor;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketPriority;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.service.SlaPolicyService;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class TicketMapper {

    private final SlaPolicyService slaPolicyService;

    public TicketDTO toDTO(Ticket ticket) {
        return toDTO(ticket, slaPolicyService.now());
    }

    /**
     * Maps a ticket, evaluating the breach flag at {@code now}.
     */
    public TicketDTO toDTO(Ticket ticket, LocalDateTime now) {
        if (ticket == null) {
            return null;
        }

        return TicketDTO.builder()
                .id(ticket.getId())
                .title(ticket.getTitle())
                .description(ticket.getDescription())
                .category(ticket.getCategory())
                .status(ticket.getStatus())
                .priority(ticket.getPriority())
                .requesterId(ticket.getRequesterId())
                .assigneeId(ticket.getAssigneeId())
                .createdAt(ticket.getCreatedAt())
                .updatedAt(ticket.getUpdatedAt())
                .slaBreachAt(ticket.getSlaBreachAt())
                .resolvedAt(ticket.getResolvedAt())
                .slaBreached(slaPolicyService.isBreached(ticket, now))
                .build();
    }

    /**
     * Maps a list with a single evaluation time so every row agrees.
     */
    public List<TicketDTO> toDTOs(List<Ticket> tickets) {
        LocalDateTime now = slaPolicyService.now();
        return tickets.stream()
                .map(ticket -> toDTO(ticket, now))
                .toList();
    }

    public Ticket toEntity(TicketCreateRequest request, Long requesterId) {
        if (request == null) {
            return null;
        }
        return Ticket.builder()
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .category(request.getCategory())
                .priority(normalizePriority(request.getPriority()))
                .status(TicketStatus.OPEN)
                .requesterId(requesterId)
                .build();
    }

    /**
     * Lower-cases and trims a priority. Blank means medium; unknown values are kept as given.
     */
    public static String normalizePriority(String priority) {
        if (!StringUtils.hasText(priority)) {
            return TicketPriority.MEDIUM.getValue();
        }
        return priority.trim().toLowerCase(Locale.ROOT);
    }
}
