package org.example.helpdesk.security;

import java.time.Instant;

/**
 * Store of revoked token ids, consulted while validating a token.
 */
public interface TokenDenyList {

    boolean isRevoked(String tokenId);

    /**
     * Revokes a token until its own expiry; entries for already expired tokens are not stored.
     */
    void revoke(String tokenId, TokenKind kind, Instant expiresAt);

    boolean isEnabled();
}
