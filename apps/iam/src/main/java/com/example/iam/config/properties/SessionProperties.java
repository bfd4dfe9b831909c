package com.example.iam.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Session store settings.
 *
 * @param pendingTimeout  how long a session may wait for MFA or token issuance
 * @param maxSessions     upper bound of the in-memory session store
 * @param cleanupInterval period of the expired-session sweep
 * @param maxFailedLogins consecutive password failures that lock a subject out
 * @param lockoutDuration how long a locked subject is refused
 */
@ConfigurationProperties(prefix = "app.session")
public record SessionProperties(
        Duration pendingTimeout,
        long maxSessions,
        Duration cleanupInterval,
        int maxFailedLogins,
        Duration lockoutDuration
) {
    public SessionProperties {
        if (pendingTimeout == null) {
            pendingTimeout = Duration.ofMinutes(10);
        }
        if (maxSessions <= 0) {
            maxSessions = 100_000;
        }
        if (cleanupInterval == null) {
            cleanupInterval = Duration.ofMinutes(5);
        }
        if (maxFailedLogins <= 0) {
            maxFailedLogins = 5;
        }
        if (lockoutDuration == null) {
            lockoutDuration = Duration.ofMinutes(15);
        }
    }
}
