package org.example.helpdesk.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code helpdesk.auth}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "helpdesk.auth")
@Validated
public class AuthProperties {

    /**
     * HMAC secret shared by access and refresh tokens. At least 32 bytes.
     */
    @NotBlank
    private String secret;

    @NotBlank
    private String issuer = "helpdesk-backend";

    /**
     * Adds {@code user_role} and {@code required_roles} to 403 bodies.
     */
    private boolean exposeRequiredRoles = true;

    @Valid
    private TokenConfig token = new TokenConfig();

    private RevocationConfig revocation = new RevocationConfig();

    @Data
    public static class TokenConfig {
        @NotNull
        private Duration accessTtl = Duration.ofMinutes(15);

        @NotNull
        private Duration refreshTtl = Duration.ofHours(168);

        private boolean rotateRefreshTokens = false;
    }

    @Data
    public static class RevocationConfig {
        private boolean enabled = false;
    }
}
