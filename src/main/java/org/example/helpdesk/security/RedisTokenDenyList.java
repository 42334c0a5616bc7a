package org.example.helpdesk.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Redis deny-list. One key per revoked {@code jti}, expiring when the token would have.
 *
 * <p>Redis errors propagate, so a token cannot be accepted while the list is unreachable.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "helpdesk.auth.revocation", name = "enabled", havingValue = "true")
public class RedisTokenDenyList implements TokenDenyList {

    static final String REVOKED_PREFIX = "helpdesk:auth:revoked:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    @Override
    public boolean isRevoked(String tokenId) {
        if (tokenId == null) {
            return false;
        }
        return Boolean.TRUE.equals(redisTemplate.hasKey(REVOKED_PREFIX + tokenId));
    }

    @Override
    public void revoke(String tokenId, TokenKind kind, Instant expiresAt) {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        if (tokenId == null || remaining.isNegative() || remaining.isZero()) {
            log.debug("[TOKEN_REVOKE_SKIPPED] Token already expired | jti={}", tokenId);
            return;
        }
        redisTemplate.opsForValue().set(REVOKED_PREFIX + tokenId, kind.name(), remaining);
        log.info("[TOKEN_REVOKED] Token added to deny-list | jti={} | kind={} | ttl={}s",
                tokenId, kind, remaining.toSeconds());
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
