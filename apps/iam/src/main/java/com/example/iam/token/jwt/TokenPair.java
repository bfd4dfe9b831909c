package com.example.iam.token.jwt;

import java.time.Instant;

/**
 * Access and refresh token issued together for one session version.
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        Instant accessTokenExpiresAt,
        Instant refreshTokenExpiresAt,
        String sessionId,
        long tokenVersion
) {
    @Override
    public String toString() {
        return "TokenPair[sessionId=" + sessionId + ", tokenVersion=" + tokenVersion
                + ", accessTokenExpiresAt=" + accessTokenExpiresAt
                + ", refreshTokenExpiresAt=" + refreshTokenExpiresAt + "]";
    }
}
