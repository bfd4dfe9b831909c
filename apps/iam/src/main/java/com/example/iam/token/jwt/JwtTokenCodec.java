package com.example.iam.token.jwt;

import com.example.iam.authz.model.TrustLevel;
import com.example.iam.common.exception.AuthenticationException;
import com.example.iam.common.exception.TokenExpiredException;
import com.example.iam.config.properties.TokenProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.util.Date;
import java.util.List;

/**
 * Signs and verifies HS256 JWTs. Verification checks signature, issuer, expiry and
 * token type only; it never consults session state.
 */
@Slf4j
public class JwtTokenCodec {

    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_SESSION = "sid";
    static final String CLAIM_VERSION = "ver";
    static final String CLAIM_TYPE = "typ";
    static final String CLAIM_TRUST_LEVEL = "tl";

    private final SecretKey signingKey;
    private final JwtParser parser;
    private final String issuer;

    public JwtTokenCodec(SecretKey signingKey, TokenProperties properties, Clock clock) {
        this.signingKey = signingKey;
        this.issuer = properties.issuer();
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(properties.issuer())
                .setAllowedClockSkewSeconds(properties.clockSkew().toSeconds())
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    @NonNull
    public String encode(@NonNull TokenClaims claims) {
        return Jwts.builder()
                .setId(claims.tokenId())
                .setIssuer(issuer)
                .setSubject(claims.subjectId())
                .claim(CLAIM_ROLES, claims.roleIds())
                .claim(CLAIM_SESSION, claims.sessionId())
                .claim(CLAIM_VERSION, claims.version())
                .claim(CLAIM_TYPE, claims.type().claimValue())
                .claim(CLAIM_TRUST_LEVEL, claims.trustLevel().name())
                .setIssuedAt(Date.from(claims.issuedAt()))
                .setExpiration(Date.from(claims.expiresAt()))
                .signWith(signingKey)
                .compact();
    }

    /**
     * @throws TokenExpiredException   if the token is past its expiry
     * @throws AuthenticationException if the token is malformed, badly signed or of another type
     */
    @NonNull
    public TokenClaims decode(String token, @NonNull TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN, "Token is missing");
        }
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Token expired at " + e.getClaims().getExpiration().toInstant(), e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN, "Token is invalid", e);
        }

        TokenType type = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class));
        if (type != expectedType) {
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN,
                    "Expected a " + expectedType.claimValue() + " token");
        }
        Object version = claims.get(CLAIM_VERSION);
        String sessionId = claims.get(CLAIM_SESSION, String.class);
        if (!(version instanceof Number) || sessionId == null || claims.getSubject() == null) {
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN,
                    "Token is missing required claims");
        }

        return new TokenClaims(
                claims.getId(),
                claims.getSubject(),
                roles(claims),
                sessionId,
                ((Number) version).longValue(),
                type,
                trustLevel(claims.get(CLAIM_TRUST_LEVEL, String.class)),
                claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                claims.getExpiration().toInstant());
    }

    private static List<String> roles(Claims claims) {
        Object raw = claims.get(CLAIM_ROLES);
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static TrustLevel trustLevel(String raw) {
        if (raw == null) {
            return TrustLevel.NONE;
        }
        try {
            return TrustLevel.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN,
                    "Token carries an unknown trust level", e);
        }
    }
}
