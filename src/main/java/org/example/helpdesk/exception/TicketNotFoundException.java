package org.example.helpdesk.exception;

/**
 * Exception thrown when a ticket is not found in the system.
 */
public class TicketNotFoundException extends HelpdeskException {

    private static final String ERROR_CODE = "TICKET_NOT_FOUND";

    public TicketNotFoundException(Long id) {
        super("Ticket not found with id: " + id, ERROR_CODE);
    }
}
