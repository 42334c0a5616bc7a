package org.example.helpdesk.security;

import org.example.helpdesk.entity.UserRole;

import java.time.Instant;

/**
 * Decoded payload of a verified token. Never persisted.
 *
 * @param tokenId the {@code jti}, used only by the deny-list
 */
public record TokenClaims(
        Long userId,
        String email,
        UserRole role,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt,
        String tokenId
) {

    public RequestIdentity toIdentity() {
        return new RequestIdentity(userId, email, role);
    }
}
