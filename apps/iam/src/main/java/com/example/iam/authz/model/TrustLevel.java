package com.example.iam.authz.model;

/**
 * How strongly the current session has been authenticated.
 */
public enum TrustLevel {
    NONE,
    PASSWORD,
    MFA_ELEVATED;

    public boolean isAtLeast(TrustLevel other) {
        return ordinal() >= other.ordinal();
    }
}
