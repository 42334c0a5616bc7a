package org.example.helpdesk.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.exception.InvalidTokenException;
import org.example.helpdesk.exception.UnauthenticatedException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Authenticates every protected request from its {@code Authorization: Bearer}
 * header and publishes a {@link RequestIdentity} as a request attribute.
 *
 * <p>Only access tokens are accepted here. Failures are thrown and rendered by
 * the global exception handler.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerAuthenticationInterceptor implements HandlerInterceptor {

    static final String BEARER_SCHEME = "Bearer";
    static final String MISSING_HEADER = "Authorization header required";
    static final String MALFORMED_HEADER = "Invalid authorization header format. Use: Bearer <token>";

    private final JwtTokenService tokenService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }

        String token = extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        TokenClaims claims = tokenService.validate(token);

        if (claims.kind() != TokenKind.ACCESS) {
            throw new InvalidTokenException("refresh token used as access token | userId=" + claims.userId());
        }

        RequestIdentity identity = claims.toIdentity();
        request.setAttribute(RequestIdentity.ATTRIBUTE, identity);
        log.debug("[AUTH_OK] {} {} | userId={} | role={}",
                request.getMethod(), request.getRequestURI(), identity.userId(), identity.role());
        return true;
    }

    /**
     * Returns the token of a header shaped exactly {@code Bearer <token>}.
     * Also used by logout, so both read the header the same way.
     *
     * @throws UnauthenticatedException if the header is missing or malformed
     */
    public static String extractBearerToken(String header) {
        if (header == null || header.isEmpty()) {
            throw new UnauthenticatedException(MISSING_HEADER);
        }
        String[] parts = header.split(" ", -1);
        if (parts.length != 2 || !BEARER_SCHEME.equals(parts[0]) || parts[1].isEmpty()) {
            throw new UnauthenticatedException(MALFORMED_HEADER);
        }
        return parts[1];
    }
}
