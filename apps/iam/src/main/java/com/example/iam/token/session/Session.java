package com.example.iam.token.session;

import com.example.iam.authz.model.TrustLevel;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Server-side session record. Immutable; every change goes through a guarded transition
 * and returns a new instance.
 *
 * @param roleIds           roles captured at authentication and carried by issued tokens
 * @param tokenVersion      incremented on every issuance; a refresh token is valid only for the current value
 * @param failedMfaAttempts consecutive rejected MFA codes
 * @param revocationReason  set once the session is revoked
 */
public record Session(
        String id,
        String subjectId,
        List<String> roleIds,
        SessionState state,
        TrustLevel trustLevel,
        long tokenVersion,
        int failedMfaAttempts,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt,
        String revocationReason
) {
    public Session {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(state, "state");
        roleIds = roleIds == null ? List.of() : List.copyOf(roleIds);
        trustLevel = trustLevel == null ? TrustLevel.NONE : trustLevel;
    }

    public static Session passwordVerified(String id, String subjectId, List<String> roleIds,
                                           Instant now, Instant expiresAt) {
        SessionState state = SessionState.UNAUTHENTICATED.transitionTo(SessionState.PASSWORD_VERIFIED, id);
        return new Session(id, subjectId, roleIds, state, TrustLevel.PASSWORD, 0, 0, now, now, expiresAt, null);
    }

    public Session transitionTo(SessionState target, Instant now) {
        return new Session(id, subjectId, roleIds, state.transitionTo(target, id), trustLevel,
                tokenVersion, failedMfaAttempts, createdAt, now, expiresAt, revocationReason);
    }

    /**
     * MFA_PENDING to MFA_VERIFIED, elevating trust and clearing the failure counter.
     */
    public Session mfaVerified(Instant now) {
        return new Session(id, subjectId, roleIds, state.transitionTo(SessionState.MFA_VERIFIED, id),
                TrustLevel.MFA_ELEVATED, tokenVersion, 0, createdAt, now, expiresAt, revocationReason);
    }

    public Session withFailedMfaAttempt(Instant now) {
        return new Session(id, subjectId, roleIds, state, trustLevel, tokenVersion, failedMfaAttempts + 1,
                createdAt, now, expiresAt, revocationReason);
    }

    /**
     * Moves to ACTIVE with the next token version. Used for first issuance and every refresh.
     */
    public Session issued(Instant now, Instant newExpiresAt) {
        return new Session(id, subjectId, roleIds, state.transitionTo(SessionState.ACTIVE, id), trustLevel,
                tokenVersion + 1, failedMfaAttempts, createdAt, now, newExpiresAt, revocationReason);
    }

    public Session revoked(String reason, Instant now) {
        return new Session(id, subjectId, roleIds, state.transitionTo(SessionState.REVOKED, id), trustLevel,
                tokenVersion, failedMfaAttempts, createdAt, now, expiresAt, reason);
    }

    public boolean isExpired(Instant now) {
        return state == SessionState.EXPIRED || !now.isBefore(expiresAt);
    }
}
