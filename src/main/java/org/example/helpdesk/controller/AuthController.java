package org.example.helpdesk.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.AuthResponse;
import org.example.helpdesk.dto.LoginRequest;
import org.example.helpdesk.dto.LogoutRequest;
import org.example.helpdesk.dto.MessageResponse;
import org.example.helpdesk.dto.ProfileResponse;
import org.example.helpdesk.dto.RefreshTokenRequest;
import org.example.helpdesk.dto.RegisterRequest;
import org.example.helpdesk.mapper.UserMapper;
import org.example.helpdesk.security.RequestIdentity;
import org.example.helpdesk.service.AuthService;
import org.example.helpdesk.service.UserService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final UserService userService;
    private final UserMapper userMapper;

    /**
     * POST /api/v1/auth/login
     */
    @PostMapping("/auth/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("POST /api/v1/auth/login");
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * POST /api/v1/auth/register
     */
    @PostMapping("/auth/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("POST /api/v1/auth/register");
        return new ResponseEntity<>(authService.register(request), HttpStatus.CREATED);
    }

    /**
     * POST /api/v1/auth/refresh
     */
    @PostMapping("/auth/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        log.info("POST /api/v1/auth/refresh");
        return ResponseEntity.ok(authService.refresh(request.getRefreshToken()));
    }

    /**
     * POST /api/v1/auth/logout
     */
    @PostMapping("/auth/logout")
    public ResponseEntity<MessageResponse> logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) LogoutRequest request) {
        log.info("POST /api/v1/auth/logout");
        return ResponseEntity.ok(authService.logout(authorization, request));
    }

    /**
     * GET /api/v1/profile
     */
    @GetMapping("/profile")
    public ResponseEntity<ProfileResponse> profile(RequestIdentity identity) {
        log.debug("GET /api/v1/profile - user {}", identity.userId());
        return ResponseEntity.ok(new ProfileResponse(userMapper.toDTO(userService.loadUser(identity.userId()))));
    }
}
