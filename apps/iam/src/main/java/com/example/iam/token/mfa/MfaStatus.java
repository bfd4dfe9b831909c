package com.example.iam.token.mfa;

import java.time.Instant;

public record MfaStatus(
        boolean enabled,
        Instant enrolledAt,
        Instant verifiedAt
) {
    public static MfaStatus notEnrolled() {
        return new MfaStatus(false, null, null);
    }
}
