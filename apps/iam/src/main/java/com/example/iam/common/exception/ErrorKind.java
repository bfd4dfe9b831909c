package com.example.iam.common.exception;

/**
 * Error taxonomy of the engine. Callers switch on the kind to tell
 * "try again" apart from "re-authenticate from scratch".
 */
public enum ErrorKind {
    VALIDATION(false),
    CYCLE(false),
    NOT_FOUND(false),
    AUTHENTICATION(true),
    TOKEN_EXPIRED(true),
    REVOKED_SESSION(true),
    MFA_REQUIRED(true),
    INVALID_SESSION_STATE(true),
    INTERNAL_CONSISTENCY(true),
    UNAVAILABLE(false),
    ACCESS_DENIED(true);

    private final boolean accessRelated;

    ErrorKind(boolean accessRelated) {
        this.accessRelated = accessRelated;
    }

    /**
     * Access-related kinds are reported to end users as a generic "access denied".
     */
    public boolean isAccessRelated() {
        return accessRelated;
    }
}
