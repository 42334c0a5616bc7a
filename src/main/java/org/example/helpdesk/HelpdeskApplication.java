package org.example.helpdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Help desk ticketing back end.
 *
 * <p>Provides:
 * <ul>
 *     <li>Token based authentication with access and refresh tokens</li>
 *     <li>Role based access control for admins, agents and end users</li>
 *     <li>Ticket management with per-priority SLA deadlines and breach tracking</li>
 *     <li>Dashboard statistics</li>
 * </ul>
 */
@SpringBootApplication
public class HelpdeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(HelpdeskApplication.class, args);
    }

}
