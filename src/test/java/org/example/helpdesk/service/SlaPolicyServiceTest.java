package org.example.helpdesk.service;

import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SlaPolicyService Tests")
class SlaPolicyServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final LocalDateTime NOW_UTC = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    private SlaPolicyService slaPolicyService;

    @BeforeEach
    void setUp() {
        slaPolicyService = new SlaPolicyService(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SlaPolicyService at(LocalDateTime time) {
        return new SlaPolicyService(Clock.fixed(time.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @ParameterizedTest(name = "priority ''{0}'' -> {1}h")
    @CsvSource({"critical, 4", "high, 8", "medium, 24", "low, 72", "CRITICAL, 4", "' High ', 8", "urgent, 24"})
    @DisplayName("hoursFor should map known priorities and default the rest")
    void hoursFor_shouldMapPriorities(String priority, int expectedHours) {
        assertThat(slaPolicyService.hoursFor(priority)).isEqualTo(expectedHours);
    }

    @Test
    @DisplayName("hoursFor should default a missing priority to 24h")
    void hoursFor_shouldDefaultNullPriority() {
        assertThat(slaPolicyService.hoursFor(null)).isEqualTo(24);
    }

    @Test
    @DisplayName("onCreate should stamp created_at and the deadline from the priority")
    void onCreate_shouldStampDeadline() {
        // Arrange
        Ticket ticket = Ticket.builder().title("VPN down").priority("critical").status(TicketStatus.OPEN).build();

        // Act
        slaPolicyService.onCreate(ticket);

        // Assert
        assertThat(ticket.getCreatedAt()).isEqualTo(NOW_UTC);
        assertThat(ticket.getUpdatedAt()).isEqualTo(NOW_UTC);
        assertThat(ticket.getSlaBreachAt()).isEqualTo(NOW_UTC.plusHours(4));
    }

    @Test
    @DisplayName("breach should start strictly after the deadline")
    void isBreached_shouldBeStrictlyAfterDeadline() {
        LocalDateTime deadline = NOW_UTC.plusHours(8);
        Ticket ticket = Ticket.builder().status(TicketStatus.IN_PROGRESS).slaBreachAt(deadline).build();

        assertThat(slaPolicyService.isBreached(ticket, deadline.minusNanos(1))).isFalse();
        assertThat(slaPolicyService.isBreached(ticket, deadline)).isFalse();
        assertThat(slaPolicyService.isBreached(ticket, deadline.plusNanos(1))).isTrue();
    }

    @Test
    @DisplayName("resolved and closed tickets should never be breached")
    void isBreached_shouldBeFalse_forStoppedStatuses() {
        LocalDateTime deadline = NOW_UTC.minusDays(3);
        Ticket resolved = Ticket.builder().status(TicketStatus.RESOLVED).slaBreachAt(deadline).build();
        Ticket closed = Ticket.builder().status(TicketStatus.CLOSED).slaBreachAt(deadline).build();
        Ticket open = Ticket.builder().status(TicketStatus.OPEN).slaBreachAt(deadline).build();

        assertThat(slaPolicyService.isBreached(resolved)).isFalse();
        assertThat(slaPolicyService.isBreached(closed)).isFalse();
        assertThat(slaPolicyService.isBreached(open)).isTrue();
    }

    @Test
    @DisplayName("tickets without a deadline should never be breached")
    void isBreached_shouldBeFalse_withoutDeadline() {
        Ticket ticket = Ticket.builder().status(TicketStatus.OPEN).build();

        assertThat(slaPolicyService.isBreached(ticket)).isFalse();
    }

    @Test
    @DisplayName("resolved_at should keep the first resolution across reopen cycles")
    void onStatusChange_shouldKeepFirstResolution() {
        // Arrange
        Ticket ticket = Ticket.builder().status(TicketStatus.IN_PROGRESS).build();

        // Act
        slaPolicyService.onStatusChange(ticket, TicketStatus.RESOLVED);
        at(NOW_UTC.plusHours(1)).onStatusChange(ticket, TicketStatus.OPEN);
        at(NOW_UTC.plusHours(2)).onStatusChange(ticket, TicketStatus.RESOLVED);

        // Assert
        assertThat(ticket.getResolvedAt()).isEqualTo(NOW_UTC);
    }

    @Test
    @DisplayName("non-resolving status changes should not stamp resolved_at")
    void onStatusChange_shouldIgnoreOtherStatuses() {
        Ticket ticket = Ticket.builder().status(TicketStatus.OPEN).build();

        slaPolicyService.onStatusChange(ticket, TicketStatus.IN_PROGRESS);
        slaPolicyService.onStatusChange(ticket, TicketStatus.CLOSED);

        assertThat(ticket.getResolvedAt()).isNull();
    }
}
