package org.example.helpdesk.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.UserActivationRequest;
import org.example.helpdesk.dto.UserCreateRequest;
import org.example.helpdesk.dto.UserDTO;
import org.example.helpdesk.dto.UserUpdateRequest;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.exception.ForbiddenException;
import org.example.helpdesk.security.RequestIdentity;
import org.example.helpdesk.security.RequireRole;
import org.example.helpdesk.service.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    /**
     * GET /api/v1/users
     */
    @GetMapping
    @RequireRole({UserRole.ADMIN, UserRole.AGENT})
    public ResponseEntity<List<UserDTO>> listUsers(@RequestParam(required = false) UserRole role) {
        log.debug("GET /api/v1/users - role: {}", role);
        return ResponseEntity.ok(userService.listUsers(role));
    }

    /**
     * GET /api/v1/users/{id}. End users may only read their own record.
     */
    @GetMapping("/{id:\\d+}")
    public ResponseEntity<UserDTO> getUser(@PathVariable Long id, RequestIdentity identity) {
        log.debug("GET /api/v1/users/{}", id);
        if (!identity.isStaff() && !identity.userId().equals(id)) {
            throw new ForbiddenException("You can only view your own profile");
        }
        return ResponseEntity.ok(userService.getUser(id));
    }

    /**
     * POST /api/v1/users
     */
    @PostMapping
    @RequireRole(UserRole.ADMIN)
    public ResponseEntity<UserDTO> createUser(@Valid @RequestBody UserCreateRequest request) {
        log.info("POST /api/v1/users - role {}", request.getRole());
        return new ResponseEntity<>(userService.createUser(request), HttpStatus.CREATED);
    }

    /**
     * PUT /api/v1/users/{id}. Role and active flag changes are checked in the service.
     */
    @PutMapping("/{id:\\d+}")
    public ResponseEntity<UserDTO> updateUser(@PathVariable Long id,
                                              @Valid @RequestBody UserUpdateRequest request,
                                              RequestIdentity identity) {
        log.info("PUT /api/v1/users/{} - by user {}", id, identity.userId());
        return ResponseEntity.ok(userService.updateUser(id, request, identity));
    }

    /**
     * PATCH /api/v1/users/{id}/active
     */
    @PatchMapping("/{id:\\d+}/active")
    @RequireRole(UserRole.ADMIN)
    public ResponseEntity<UserDTO> setActive(@PathVariable Long id,
                                             @Valid @RequestBody UserActivationRequest request) {
        log.info("PATCH /api/v1/users/{}/active - {}", id, request.getActive());
        return ResponseEntity.ok(userService.setActive(id, request.getActive()));
    }

    /**
     * DELETE /api/v1/users/{id}
     */
    @DeleteMapping("/{id:\\d+}")
    @RequireRole(UserRole.ADMIN)
    public ResponseEntity<Void> deleteUser(@PathVariable Long id) {
        log.info("DELETE /api/v1/users/{}", id);
        userService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }
}
