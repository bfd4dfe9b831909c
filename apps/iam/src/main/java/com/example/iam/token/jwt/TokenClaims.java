package com.example.iam.token.jwt;

import com.example.iam.authz.model.TrustLevel;

import java.time.Instant;
import java.util.List;

/**
 * Verified content of an access or refresh token.
 *
 * @param tokenId   JWT id ({@code jti})
 * @param version   session token version the token was issued at ({@code ver})
 */
public record TokenClaims(
        String tokenId,
        String subjectId,
        List<String> roleIds,
        String sessionId,
        long version,
        TokenType type,
        TrustLevel trustLevel,
        Instant issuedAt,
        Instant expiresAt
) {
    public TokenClaims {
        roleIds = roleIds == null ? List.of() : List.copyOf(roleIds);
    }
}
