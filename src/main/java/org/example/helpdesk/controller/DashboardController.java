package org.example.helpdesk.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.DashboardStats;
import org.example.helpdesk.security.RequestIdentity;
import org.example.helpdesk.service.DashboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    /**
     * GET /api/v1/dashboard/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<DashboardStats> getStats(RequestIdentity identity) {
        log.debug("GET /api/v1/dashboard/stats - user {}", identity.userId());
        return ResponseEntity.ok(dashboardService.getStats(identity));
    }
}
