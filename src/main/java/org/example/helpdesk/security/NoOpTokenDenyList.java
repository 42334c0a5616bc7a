package org.example.helpdesk.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Default deny-list: logout is a client-side operation and tokens live until they expire.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "helpdesk.auth.revocation", name = "enabled", havingValue = "false", matchIfMissing = true)
public class NoOpTokenDenyList implements TokenDenyList {

    @Override
    public boolean isRevoked(String tokenId) {
        return false;
    }

    @Override
    public void revoke(String tokenId, TokenKind kind, Instant expiresAt) {
        log.debug("[TOKEN_REVOKE_SKIPPED] Revocation disabled | jti={} | kind={}", tokenId, kind);
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
