package com.example.iam.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * TOTP and backup code settings.
 *
 * @param issuer            label shown by authenticator apps
 * @param allowedSkewSteps  time steps accepted on either side of the current one
 * @param maxFailedAttempts consecutive failures before the session is revoked
 */
@ConfigurationProperties(prefix = "app.mfa")
public record MfaProperties(
        String issuer,
        int digits,
        Duration period,
        Integer allowedSkewSteps,
        int backupCodeCount,
        int backupCodeLength,
        int maxFailedAttempts
) {
    public MfaProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = "IAM Platform";
        }
        if (digits < 6 || digits > 8) {
            digits = 6;
        }
        if (period == null || period.isZero() || period.isNegative()) {
            period = Duration.ofSeconds(30);
        }
        if (allowedSkewSteps == null || allowedSkewSteps < 0) {
            allowedSkewSteps = 1;
        }
        if (backupCodeCount <= 0) {
            backupCodeCount = 8;
        }
        if (backupCodeLength <= 0) {
            backupCodeLength = 10;
        }
        if (maxFailedAttempts <= 0) {
            maxFailedAttempts = 5;
        }
    }

    public static MfaProperties defaults() {
        return new MfaProperties(null, 0, null, null, 0, 0, 0);
    }
}
