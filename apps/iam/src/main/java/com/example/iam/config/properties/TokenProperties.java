package com.example.iam.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * JWT signing and lifetimes.
 *
 * @param secret    HS256 signing secret, at least 32 bytes
 * @param clockSkew tolerated difference between issuer and verifier clocks
 */
@Validated
@ConfigurationProperties(prefix = "app.token")
public record TokenProperties(
        String issuer,
        @NotBlank @Size(min = 32) String secret,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration clockSkew
) {
    public TokenProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = "iam-platform";
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = Duration.ofMinutes(15);
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = Duration.ofDays(7);
        }
        if (clockSkew == null) {
            clockSkew = Duration.ofSeconds(30);
        }
    }
}
