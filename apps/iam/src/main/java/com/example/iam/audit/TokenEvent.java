package com.example.iam.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Session and token lifecycle event emitted by the token service.
 *
 * @param tokenVersion session token version after the event, 0 when not applicable
 * @param detail       free-form reason, never contains secrets
 */
public record TokenEvent(
        String eventId,
        Type type,
        String subjectId,
        String sessionId,
        long tokenVersion,
        String detail,
        Instant timestamp
) {
    public enum Type {
        PASSWORD_VERIFIED,
        AUTHENTICATION_FAILED,
        ACCOUNT_LOCKED,
        MFA_CHALLENGED,
        MFA_VERIFIED,
        MFA_FAILED,
        TOKENS_ISSUED,
        TOKENS_REFRESHED,
        REFRESH_REJECTED,
        REFRESH_REUSE_DETECTED,
        SESSION_REVOKED,
        SESSION_EXPIRED;

        /**
         * Events an operator should look at.
         */
        public boolean isSecuritySignal() {
            return this == AUTHENTICATION_FAILED || this == ACCOUNT_LOCKED || this == MFA_FAILED
                    || this == REFRESH_REJECTED || this == REFRESH_REUSE_DETECTED;
        }
    }

    public static TokenEvent of(Type type, String subjectId, String sessionId, long tokenVersion,
                                String detail, Instant timestamp) {
        return new TokenEvent(UUID.randomUUID().toString(), type, subjectId, sessionId, tokenVersion, detail, timestamp);
    }
}
