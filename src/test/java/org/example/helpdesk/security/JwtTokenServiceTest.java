package org.example.helpdesk.security;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.example.helpdesk.config.AuthProperties;
import org.example.helpdesk.dto.TokenPair;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.exception.InvalidRefreshTokenException;
import org.example.helpdesk.exception.InvalidTokenException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JwtTokenService.
 * Every service instance shares one secret, so tokens signed by one are
 * verifiable by another constructed with a different clock.
 */
class JwtTokenServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";
    private static final Instant ISSUED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration ACCESS_TTL = Duration.ofMinutes(15);
    private static final Duration REFRESH_TTL = Duration.ofHours(168);

    private AuthProperties properties;
    private JwtTokenService issuer;

    @BeforeEach
    void setUp() {
        properties = new AuthProperties();
        properties.setSecret(SECRET);
        properties.getToken().setAccessTtl(ACCESS_TTL);
        properties.getToken().setRefreshTtl(REFRESH_TTL);
        issuer = serviceAt(ISSUED);
    }

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(properties, new NoOpTokenDenyList(), Clock.fixed(instant, ZoneOffset.UTC));
    }

    // ==================== ROUND TRIP ====================

    @Test
    @DisplayName("validate should return the identity claims of an issued access token")
    void validate_shouldReturnClaims_forIssuedAccessToken() {
        // Act
        TokenPair pair = issuer.issueTokenPair(42L, "agent@helpdesk.test", UserRole.AGENT);
        TokenClaims claims = issuer.validate(pair.getAccessToken());

        // Assert
        assertThat(claims.userId()).isEqualTo(42L);
        assertThat(claims.email()).isEqualTo("agent@helpdesk.test");
        assertThat(claims.role()).isEqualTo(UserRole.AGENT);
        assertThat(claims.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(claims.issuedAt()).isEqualTo(ISSUED);
        assertThat(claims.expiresAt()).isEqualTo(ISSUED.plus(ACCESS_TTL));
        assertThat(claims.tokenId()).isNotBlank();
        assertThat(pair.getExpiresIn()).isEqualTo(900L);
    }

    @Test
    @DisplayName("issued pair should contain tokens of both kinds with independent expiry")
    void issueTokenPair_shouldProduceAccessAndRefreshTokens() {
        TokenPair pair = issuer.issueTokenPair(7L, "user@helpdesk.test", UserRole.END_USER);

        TokenClaims access = issuer.validate(pair.getAccessToken());
        TokenClaims refresh = issuer.validate(pair.getRefreshToken());

        assertThat(access.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(refresh.kind()).isEqualTo(TokenKind.REFRESH);
        assertThat(refresh.expiresAt()).isEqualTo(ISSUED.plus(REFRESH_TTL));
        assertThat(access.tokenId()).isNotEqualTo(refresh.tokenId());
    }

    @Test
    @DisplayName("token payload should carry issuer, subject and snake_case identity claims")
    void issuedToken_shouldCarryWirePayload() throws Exception {
        TokenPair pair = issuer.issueTokenPair(5L, "admin@helpdesk.test", UserRole.ADMIN);

        JWTClaimsSet access = SignedJWT.parse(pair.getAccessToken()).getJWTClaimsSet();
        JWTClaimsSet refresh = SignedJWT.parse(pair.getRefreshToken()).getJWTClaimsSet();

        assertThat(access.getIssuer()).isEqualTo("helpdesk-backend");
        assertThat(access.getSubject()).isEqualTo("admin@helpdesk.test");
        assertThat(access.getLongClaim("user_id")).isEqualTo(5L);
        assertThat(access.getStringClaim("role")).isEqualTo("admin");
        assertThat(access.getClaim("is_refresh")).isNull();
        assertThat(refresh.getBooleanClaim("is_refresh")).isTrue();
    }

    // ==================== EXPIRY BOUNDARY ====================

    @Test
    @DisplayName("access token should be valid one second before expiry")
    void validate_shouldAccept_oneSecondBeforeExpiry() {
        String token = issuer.issueTokenPair(1L, "a@helpdesk.test", UserRole.AGENT).getAccessToken();

        TokenClaims claims = serviceAt(ISSUED.plus(ACCESS_TTL).minusSeconds(1)).validate(token);

        assertThat(claims.userId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("access token should be rejected exactly at expiry")
    void validate_shouldReject_exactlyAtExpiry() {
        String token = issuer.issueTokenPair(1L, "a@helpdesk.test", UserRole.AGENT).getAccessToken();

        JwtTokenService atExpiry = serviceAt(ISSUED.plus(ACCESS_TTL));

        assertThatThrownBy(() -> atExpiry.validate(token))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    @DisplayName("access token should be rejected one second after expiry")
    void validate_shouldReject_oneSecondAfterExpiry() {
        String token = issuer.issueTokenPair(1L, "a@helpdesk.test", UserRole.AGENT).getAccessToken();

        JwtTokenService afterExpiry = serviceAt(ISSUED.plus(ACCESS_TTL).plusSeconds(1));

        assertThatThrownBy(() -> afterExpiry.validate(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("token should be rejected before its not-before time")
    void validate_shouldReject_beforeNotBefore() {
        String token = issuer.issueTokenPair(1L, "a@helpdesk.test", UserRole.AGENT).getAccessToken();

        JwtTokenService early = serviceAt(ISSUED.minusSeconds(1));

        assertThatThrownBy(() -> early.validate(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    // ==================== TAMPERING ====================

    @Test
    @DisplayName("validate should reject a token with a modified signature")
    void validate_shouldReject_tamperedSignature() {
        String token = issuer.issueTokenPair(1L, "a@helpdesk.test", UserRole.AGENT).getAccessToken();
        int signatureStart = token.lastIndexOf('.') + 1;
        char first = token.charAt(signatureStart);
        String tampered = token.substring(0, signatureStart) + (first == 'A' ? 'B' : 'A')
                + token.substring(signatureStart + 1);

        assertThatThrownBy(() -> issuer.validate(tampered))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("validate should reject a token signed with another secret")
    void validate_shouldReject_foreignSecret() {
        AuthProperties other = new AuthProperties();
        other.setSecret("another-secret-that-is-also-long-enough-0123456789");
        JwtTokenService foreign = new JwtTokenService(other, new NoOpTokenDenyList(),
                Clock.fixed(ISSUED, ZoneOffset.UTC));
        String token = foreign.issueTokenPair(1L, "a@helpdesk.test", UserRole.ADMIN).getAccessToken();

        assertThatThrownBy(() -> issuer.validate(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("validate should reject a token from another issuer")
    void validate_shouldReject_wrongIssuer() {
        AuthProperties other = new AuthProperties();
        other.setSecret(SECRET);
        other.setIssuer("someone-else");
        JwtTokenService foreign = new JwtTokenService(other, new NoOpTokenDenyList(),
                Clock.fixed(ISSUED, ZoneOffset.UTC));
        String token = foreign.issueTokenPair(1L, "a@helpdesk.test", UserRole.ADMIN).getAccessToken();

        assertThatThrownBy(() -> issuer.validate(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("validate should reject HMAC algorithms other than HS256")
    void validate_shouldReject_otherHmacAlgorithm() throws Exception {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer("helpdesk-backend")
                .subject("a@helpdesk.test")
                .claim("user_id", 1L)
                .claim("email", "a@helpdesk.test")
                .claim("role", "admin")
                .issueTime(Date.from(ISSUED))
                .expirationTime(Date.from(ISSUED.plus(ACCESS_TTL)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS512), claims);
        jwt.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));
        String token = jwt.serialize();

        assertThatThrownBy(() -> issuer.validate(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("validate should reject malformed and empty input")
    void validate_shouldReject_garbage() {
        assertThatThrownBy(() -> issuer.validate("not-a-token")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> issuer.validate("")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> issuer.validate(null)).isInstanceOf(InvalidTokenException.class);
    }

    // ==================== REFRESH ====================

    @Test
    @DisplayName("refresh should mint a new access token and return the same refresh token")
    void refresh_shouldReturnNewAccessAndSameRefreshToken() {
        TokenPair pair = issuer.issueTokenPair(9L, "u@helpdesk.test", UserRole.END_USER);
        JwtTokenService later = serviceAt(ISSUED.plusSeconds(600));

        TokenPair refreshed = later.refresh(pair.getRefreshToken());

        assertThat(refreshed.getRefreshToken()).isEqualTo(pair.getRefreshToken());
        assertThat(refreshed.getAccessToken()).isNotEqualTo(pair.getAccessToken());
        TokenClaims claims = later.validate(refreshed.getAccessToken());
        assertThat(claims.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(claims.userId()).isEqualTo(9L);
        assertThat(claims.role()).isEqualTo(UserRole.END_USER);
        assertThat(claims.expiresAt()).isEqualTo(ISSUED.plusSeconds(600).plus(ACCESS_TTL));
        // the original access token is still valid too
        assertThat(later.validate(pair.getAccessToken()).userId()).isEqualTo(9L);
    }

    @Test
    @DisplayName("refresh should reject an access token")
    void refresh_shouldReject_accessToken() {
        TokenPair pair = issuer.issueTokenPair(9L, "u@helpdesk.test", UserRole.END_USER);

        assertThatThrownBy(() -> issuer.refresh(pair.getAccessToken()))
                .isInstanceOf(InvalidRefreshTokenException.class)
                .hasMessage("Invalid or expired refresh token");
    }

    @Test
    @DisplayName("refresh should reject an expired refresh token")
    void refresh_shouldReject_expiredRefreshToken() {
        TokenPair pair = issuer.issueTokenPair(9L, "u@helpdesk.test", UserRole.END_USER);
        JwtTokenService afterExpiry = serviceAt(ISSUED.plus(REFRESH_TTL));

        assertThatThrownBy(() -> afterExpiry.refresh(pair.getRefreshToken()))
                .isInstanceOf(InvalidRefreshTokenException.class);
    }

    @Test
    @DisplayName("refresh with rotation should issue a new refresh token and revoke the old one")
    void refresh_withRotation_shouldRevokeOldRefreshToken() {
        TokenDenyList denyList = mock(TokenDenyList.class);
        when(denyList.isEnabled()).thenReturn(true);
        properties.getToken().setRotateRefreshTokens(true);
        JwtTokenService rotating = new JwtTokenService(properties, denyList, Clock.fixed(ISSUED, ZoneOffset.UTC));
        TokenPair pair = rotating.issueTokenPair(3L, "r@helpdesk.test", UserRole.AGENT);
        String oldJti = rotating.validate(pair.getRefreshToken()).tokenId();

        TokenPair refreshed = rotating.refresh(pair.getRefreshToken());

        assertThat(refreshed.getRefreshToken()).isNotEqualTo(pair.getRefreshToken());
        verify(denyList).revoke(eq(oldJti), eq(TokenKind.REFRESH), eq(ISSUED.plus(REFRESH_TTL)));
    }

    // ==================== REVOCATION ====================

    @Test
    @DisplayName("validate should reject a token whose id is on the deny-list")
    void validate_shouldReject_revokedToken() {
        TokenDenyList denyList = mock(TokenDenyList.class);
        JwtTokenService withDenyList = new JwtTokenService(properties, denyList, Clock.fixed(ISSUED, ZoneOffset.UTC));
        String token = withDenyList.issueTokenPair(1L, "a@helpdesk.test", UserRole.AGENT).getAccessToken();
        when(denyList.isRevoked(any())).thenReturn(true);

        assertThatThrownBy(() -> withDenyList.validate(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("revoke should ignore tokens that no longer validate")
    void revoke_shouldIgnoreInvalidToken() {
        TokenDenyList denyList = mock(TokenDenyList.class);
        JwtTokenService withDenyList = new JwtTokenService(properties, denyList, Clock.fixed(ISSUED, ZoneOffset.UTC));

        boolean revoked = withDenyList.revoke("garbage");

        assertThat(revoked).isFalse();
        verify(denyList, never()).revoke(any(), any(), any());
    }

    // ==================== CONFIGURATION ====================

    @Test
    @DisplayName("constructor should fail fast on a secret shorter than 32 bytes")
    void constructor_shouldRejectShortSecret() {
        properties.setSecret("too-short");

        assertThatThrownBy(() -> serviceAt(ISSUED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    @DisplayName("constructor should fail fast when no secret is configured")
    void constructor_shouldRejectMissingSecret() {
        properties.setSecret(null);

        assertThatThrownBy(() -> serviceAt(ISSUED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("helpdesk.auth.secret must be at least 32 bytes long");
    }
}
