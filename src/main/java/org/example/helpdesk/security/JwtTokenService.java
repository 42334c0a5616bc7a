package org.example.helpdesk.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.AuthProperties;
import org.example.helpdesk.dto.TokenPair;
import org.example.helpdesk.entity.User;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.exception.InvalidRefreshTokenException;
import org.example.helpdesk.exception.InvalidTokenException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS256 session tokens with Nimbus JOSE + JWT.
 *
 * <p>Access and refresh tokens carry the same identity claims and differ only
 * in {@code is_refresh} and lifetime. The service never touches the user
 * store: a token stays valid until it expires even if the user is deactivated
 * or their role changes, unless the deny-list is enabled and the token was
 * revoked.</p>
 */
@Service
@Slf4j
public class JwtTokenService {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_IS_REFRESH = "is_refresh";

    private static final int MIN_SECRET_BYTES = 32;

    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final AuthProperties authProperties;
    private final TokenDenyList denyList;
    private final Clock clock;

    public JwtTokenService(AuthProperties authProperties, TokenDenyList denyList, Clock clock) {
        this.authProperties = authProperties;
        this.denyList = denyList;
        this.clock = clock;

        String secret = authProperties.getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "helpdesk.auth.secret must be at least " + MIN_SECRET_BYTES + " bytes long");
        }

        try {
            byte[] key = secret.getBytes(StandardCharsets.UTF_8);
            this.signer = new MACSigner(key);
            this.verifier = new MACVerifier(key);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to initialize JWT service", e);
        }

        if (authProperties.getToken().isRotateRefreshTokens() && !denyList.isEnabled()) {
            log.warn("[JWT_SERVICE_INIT] Refresh rotation is on but revocation is off; "
                    + "rotated refresh tokens stay usable until they expire");
        }
        log.info("[JWT_SERVICE_INIT] JWT Service initialized | algorithm=HS256 | issuer={} | accessTtl={} | refreshTtl={}",
                authProperties.getIssuer(),
                authProperties.getToken().getAccessTtl(),
                authProperties.getToken().getRefreshTtl());
    }

    // ==================== ISSUE ====================

    public TokenPair issueTokenPair(User user) {
        return issueTokenPair(user.getId(), user.getEmail(), user.getRole());
    }

    public TokenPair issueTokenPair(Long userId, String email, UserRole role) {
        log.debug("[TOKEN_PAIR_START] Issuing token pair | userId={} | role={}", userId, role);

        String accessToken = sign(userId, email, role, TokenKind.ACCESS);
        String refreshToken = sign(userId, email, role, TokenKind.REFRESH);

        log.info("[TOKEN_PAIR_SUCCESS] Token pair issued | userId={}", userId);
        return new TokenPair(accessToken, refreshToken, accessTtlSeconds());
    }

    public long accessTtlSeconds() {
        return authProperties.getToken().getAccessTtl().toSeconds();
    }

    // ==================== VALIDATE ====================

    /**
     * Verifies signature, algorithm, issuer and lifetime, then decodes the claims.
     *
     * @throws InvalidTokenException for any failure; the reason is only logged
     */
    public TokenClaims validate(String token) {
        log.debug("[JWT_VERIFY_START] Verifying JWT token");

        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("empty token");
        }

        SignedJWT signedJWT;
        try {
            signedJWT = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new InvalidTokenException("malformed token", e);
        }

        if (!JWSAlgorithm.HS256.equals(signedJWT.getHeader().getAlgorithm())) {
            throw new InvalidTokenException("unexpected signing algorithm " + signedJWT.getHeader().getAlgorithm());
        }

        try {
            if (!signedJWT.verify(verifier)) {
                throw new InvalidTokenException("signature mismatch");
            }
        } catch (JOSEException e) {
            throw new InvalidTokenException("signature verification failed", e);
        }

        TokenClaims claims = decode(signedJWT);

        if (denyList.isRevoked(claims.tokenId())) {
            throw new InvalidTokenException("token revoked | jti=" + claims.tokenId());
        }

        log.debug("[JWT_VERIFY_SUCCESS] Token verified | userId={} | kind={}", claims.userId(), claims.kind());
        return claims;
    }

    private TokenClaims decode(SignedJWT signedJWT) {
        JWTClaimsSet claimsSet;
        Long userId;
        String email;
        String roleValue;
        Boolean refreshFlag;
        try {
            claimsSet = signedJWT.getJWTClaimsSet();
            userId = claimsSet.getLongClaim(CLAIM_USER_ID);
            email = claimsSet.getStringClaim(CLAIM_EMAIL);
            roleValue = claimsSet.getStringClaim(CLAIM_ROLE);
            refreshFlag = claimsSet.getBooleanClaim(CLAIM_IS_REFRESH);
        } catch (ParseException e) {
            throw new InvalidTokenException("unreadable claims", e);
        }

        if (!authProperties.getIssuer().equals(claimsSet.getIssuer())) {
            throw new InvalidTokenException("unexpected issuer " + claimsSet.getIssuer());
        }

        Date expiration = claimsSet.getExpirationTime();
        if (expiration == null) {
            throw new InvalidTokenException("missing exp");
        }

        Instant now = clock.instant();
        Instant expiresAt = expiration.toInstant();
        if (!now.isBefore(expiresAt)) {
            throw new InvalidTokenException("token expired at " + expiresAt);
        }

        Date notBefore = claimsSet.getNotBeforeTime();
        if (notBefore != null && now.isBefore(notBefore.toInstant())) {
            throw new InvalidTokenException("token not valid before " + notBefore.toInstant());
        }

        if (userId == null || email == null || roleValue == null) {
            throw new InvalidTokenException("missing identity claims");
        }
        UserRole role = UserRole.fromValue(roleValue)
                .orElseThrow(() -> new InvalidTokenException("unknown role " + roleValue));

        TokenKind kind = Boolean.TRUE.equals(refreshFlag) ? TokenKind.REFRESH : TokenKind.ACCESS;
        Instant issuedAt = claimsSet.getIssueTime() != null ? claimsSet.getIssueTime().toInstant() : null;

        return new TokenClaims(userId, email, role, kind, issuedAt, expiresAt, claimsSet.getJWTID());
    }

    // ==================== REFRESH ====================

    /**
     * Mints a new access token from a refresh token. The refresh token itself is
     * returned unchanged unless rotation is enabled.
     *
     * @throws InvalidRefreshTokenException if the token is invalid or is an access token
     */
    public TokenPair refresh(String refreshToken) {
        log.debug("[TOKEN_REFRESH_START] Refreshing access token");

        TokenClaims claims;
        try {
            claims = validate(refreshToken);
        } catch (InvalidTokenException e) {
            log.warn("[TOKEN_REFRESH_REJECTED] {}", e.getReason());
            throw new InvalidRefreshTokenException(e);
        }

        if (claims.kind() != TokenKind.REFRESH) {
            log.warn("[TOKEN_REFRESH_REJECTED] Access token presented for refresh | userId={}", claims.userId());
            throw new InvalidRefreshTokenException();
        }

        String accessToken = sign(claims.userId(), claims.email(), claims.role(), TokenKind.ACCESS);
        String nextRefreshToken = refreshToken;

        if (authProperties.getToken().isRotateRefreshTokens()) {
            nextRefreshToken = sign(claims.userId(), claims.email(), claims.role(), TokenKind.REFRESH);
            denyList.revoke(claims.tokenId(), TokenKind.REFRESH, claims.expiresAt());
            log.info("[TOKEN_REFRESH_ROTATED] Refresh token rotated | userId={} | oldJti={}",
                    claims.userId(), claims.tokenId());
        }

        log.info("[TOKEN_REFRESH_SUCCESS] Access token refreshed | userId={}", claims.userId());
        return new TokenPair(accessToken, nextRefreshToken, accessTtlSeconds());
    }

    // ==================== REVOKE ====================

    /**
     * Puts a still-valid token on the deny-list. Tokens that no longer validate
     * need no revocation and are ignored.
     *
     * @return true if the token was valid and handed to the deny-list
     */
    public boolean revoke(String token) {
        TokenClaims claims;
        try {
            claims = validate(token);
        } catch (InvalidTokenException e) {
            log.debug("[TOKEN_REVOKE_SKIPPED] Token not valid | reason={}", e.getReason());
            return false;
        }
        denyList.revoke(claims.tokenId(), claims.kind(), claims.expiresAt());
        return true;
    }

    // ==================== SIGNING ====================

    private String sign(Long userId, String email, UserRole role, TokenKind kind) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Duration ttl = kind == TokenKind.REFRESH
                ? authProperties.getToken().getRefreshTtl()
                : authProperties.getToken().getAccessTtl();

        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder()
                .jwtID(UUID.randomUUID().toString())
                .issuer(authProperties.getIssuer())
                .subject(email)
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLE, role.getValue())
                .issueTime(Date.from(now))
                .notBeforeTime(Date.from(now))
                .expirationTime(Date.from(now.plus(ttl)));
        if (kind == TokenKind.REFRESH) {
            builder.claim(CLAIM_IS_REFRESH, true);
        }

        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.HS256)
                .type(JOSEObjectType.JWT)
                .build();
        SignedJWT signedJWT = new SignedJWT(header, builder.build());
        try {
            signedJWT.sign(signer);
        } catch (JOSEException e) {
            log.error("[TOKEN_SIGN_ERROR] Failed to sign {} token | userId={}", kind, userId, e);
            throw new IllegalStateException("Failed to sign token", e);
        }
        return signedJWT.serialize();
    }
}
