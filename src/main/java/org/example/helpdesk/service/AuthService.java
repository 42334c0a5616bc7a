package org.example.helpdesk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.AuthResponse;
import org.example.helpdesk.dto.LoginRequest;
import org.example.helpdesk.dto.LogoutRequest;
import org.example.helpdesk.dto.MessageResponse;
import org.example.helpdesk.dto.RegisterRequest;
import org.example.helpdesk.dto.TokenPair;
import org.example.helpdesk.entity.User;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.exception.ForbiddenException;
import org.example.helpdesk.exception.UnauthenticatedException;
import org.example.helpdesk.mapper.UserMapper;
import org.example.helpdesk.security.BearerAuthenticationInterceptor;
import org.example.helpdesk.security.JwtTokenService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Login, self-registration, token refresh and logout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserService userService;
    private final JwtTokenService tokenService;
    private final UserMapper userMapper;

    public AuthResponse login(LoginRequest request) {
        log.info("[LOGIN_START] Login attempt | email={}", request.getEmail());

        User user = userService.authenticate(request.getEmail(), request.getPassword());
        TokenPair tokens = tokenService.issueTokenPair(user);

        log.info("[LOGIN_SUCCESS] User logged in | userId={} | role={}", user.getId(), user.getRole());
        return AuthResponse.builder()
                .message("Login successful")
                .user(userMapper.toDTO(user))
                .tokens(tokens)
                .build();
    }

    /**
     * Public registration only ever creates end users; staff accounts are
     * created by an admin.
     *
     * @throws ForbiddenException if a role other than end_user is requested
     */
    public AuthResponse register(RegisterRequest request) {
        log.info("[REGISTER_START] Registration attempt | email={}", request.getEmail());

        UserRole role = request.getRole() != null ? request.getRole() : UserRole.END_USER;
        if (role != UserRole.END_USER) {
            log.warn("[REGISTER_REJECTED] Self-registration with role {} | email={}", role, request.getEmail());
            throw new ForbiddenException("Public registration can only create end_user accounts");
        }

        User user = userService.createUser(request.getEmail(), request.getPassword(),
                request.getFirstName(), request.getLastName(), request.getDepartment(), role);
        TokenPair tokens = tokenService.issueTokenPair(user);

        log.info("[REGISTER_SUCCESS] User registered | userId={}", user.getId());
        return AuthResponse.builder()
                .message("Registration successful")
                .user(userMapper.toDTO(user))
                .tokens(tokens)
                .build();
    }

    public AuthResponse refresh(String refreshToken) {
        TokenPair tokens = tokenService.refresh(refreshToken);
        return AuthResponse.builder()
                .message("Token refreshed successfully")
                .tokens(tokens)
                .build();
    }

    /**
     * Acknowledges a logout. When revocation is enabled the presented access
     * token, and the refresh token if sent, are put on the deny-list; otherwise
     * the client is simply told to drop its tokens.
     */
    public MessageResponse logout(String authorizationHeader, LogoutRequest request) {
        int revoked = 0;

        if (authorizationHeader != null) {
            try {
                String accessToken = BearerAuthenticationInterceptor.extractBearerToken(authorizationHeader);
                if (tokenService.revoke(accessToken)) {
                    revoked++;
                }
            } catch (UnauthenticatedException e) {
                log.debug("[LOGOUT] Ignoring unusable authorization header | reason={}", e.getMessage());
            }
        }
        if (request != null && StringUtils.hasText(request.getRefreshToken())
                && tokenService.revoke(request.getRefreshToken())) {
            revoked++;
        }

        log.info("[LOGOUT] Logout acknowledged | tokensHandled={}", revoked);
        return new MessageResponse("Logged out successfully", "Please remove tokens from client storage");
    }
}
