package com.example.iam.token.session;

import com.example.iam.common.exception.IllegalSessionStateException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Session lifecycle. Transitions not listed here are rejected.
 *
 * <pre>
 * UNAUTHENTICATED -> PASSWORD_VERIFIED -> [MFA_PENDING -> MFA_VERIFIED] -> ACTIVE -> ACTIVE (refresh)
 * any non-terminal state -> EXPIRED | REVOKED
 * </pre>
 */
public enum SessionState {
    UNAUTHENTICATED,
    PASSWORD_VERIFIED,
    MFA_PENDING,
    MFA_VERIFIED,
    ACTIVE,
    EXPIRED,
    REVOKED;

    private Set<SessionState> successors() {
        return switch (this) {
            case UNAUTHENTICATED -> EnumSet.of(PASSWORD_VERIFIED, EXPIRED, REVOKED);
            case PASSWORD_VERIFIED -> EnumSet.of(MFA_PENDING, ACTIVE, EXPIRED, REVOKED);
            case MFA_PENDING -> EnumSet.of(MFA_VERIFIED, EXPIRED, REVOKED);
            case MFA_VERIFIED -> EnumSet.of(ACTIVE, EXPIRED, REVOKED);
            case ACTIVE -> EnumSet.of(ACTIVE, EXPIRED, REVOKED);
            case EXPIRED, REVOKED -> EnumSet.noneOf(SessionState.class);
        };
    }

    public boolean canTransitionTo(SessionState target) {
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return this == EXPIRED || this == REVOKED;
    }

    /**
     * @throws IllegalSessionStateException if {@code target} is not a successor of this state
     */
    public SessionState transitionTo(SessionState target, String sessionId) {
        if (!canTransitionTo(target)) {
            throw new IllegalSessionStateException(sessionId, name(), target.name());
        }
        return target;
    }
}
