package com.example.iam.token.service;

import com.example.iam.audit.AuditPublisher;
import com.example.iam.audit.TokenEvent;
import com.example.iam.claims.SubjectDirectory;
import com.example.iam.claims.SubjectProfile;
import com.example.iam.common.exception.AuthenticationException;
import com.example.iam.common.exception.IllegalSessionStateException;
import com.example.iam.common.exception.MfaRequiredException;
import com.example.iam.common.exception.RevokedSessionException;
import com.example.iam.common.exception.TokenExpiredException;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.config.properties.MfaProperties;
import com.example.iam.config.properties.SessionProperties;
import com.example.iam.config.properties.TokenProperties;
import com.example.iam.observability.metrics.IamMetrics;
import com.example.iam.token.credential.CredentialStore;
import com.example.iam.token.jwt.JwtTokenCodec;
import com.example.iam.token.jwt.TokenClaims;
import com.example.iam.token.jwt.TokenPair;
import com.example.iam.token.jwt.TokenType;
import com.example.iam.token.mfa.MfaService;
import com.example.iam.token.session.Session;
import com.example.iam.token.session.SessionState;
import com.example.iam.token.session.SessionStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Session lifecycle and token issuance.
 *
 * <p>Every operation that changes a session runs under that session's lock, so two
 * concurrent refreshes of one session never both succeed: the second one sees the
 * incremented token version and is treated as reuse. Locks exist only for sessions
 * the store holds.
 *
 * <p>Consecutive password failures are counted per subject id, known or not; reaching
 * {@code app.session.max-failed-logins} refuses the subject for
 * {@code app.session.lockout-duration}.
 */
@Slf4j
@Service
public class TokenService {

    private final SessionStore sessionStore;
    private final JwtTokenCodec codec;
    private final CredentialStore credentialStore;
    private final PasswordEncoder passwordEncoder;
    private final SubjectDirectory subjectDirectory;
    private final MfaService mfaService;
    private final AuditPublisher auditPublisher;
    private final IamMetrics metrics;
    private final Clock clock;

    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Duration pendingTimeout;
    private final int maxFailedMfaAttempts;
    private final int maxFailedLogins;
    private final Duration lockoutDuration;
    private final String unknownSubjectHash;

    private final ConcurrentHashMap<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();
    private final Cache<String, LoginFailures> loginFailures;

    public TokenService(SessionStore sessionStore,
                        JwtTokenCodec codec,
                        CredentialStore credentialStore,
                        PasswordEncoder passwordEncoder,
                        SubjectDirectory subjectDirectory,
                        MfaService mfaService,
                        AuditPublisher auditPublisher,
                        IamMetrics metrics,
                        TokenProperties tokenProperties,
                        SessionProperties sessionProperties,
                        MfaProperties mfaProperties,
                        Clock clock) {
        this.sessionStore = sessionStore;
        this.codec = codec;
        this.credentialStore = credentialStore;
        this.passwordEncoder = passwordEncoder;
        this.subjectDirectory = subjectDirectory;
        this.mfaService = mfaService;
        this.auditPublisher = auditPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.accessTokenTtl = tokenProperties.accessTokenTtl();
        this.refreshTokenTtl = tokenProperties.refreshTokenTtl();
        this.pendingTimeout = sessionProperties.pendingTimeout();
        this.maxFailedMfaAttempts = mfaProperties.maxFailedAttempts();
        this.maxFailedLogins = sessionProperties.maxFailedLogins();
        this.lockoutDuration = sessionProperties.lockoutDuration();
        this.loginFailures = Caffeine.newBuilder()
                .maximumSize(sessionProperties.maxSessions())
                .expireAfterWrite(lockoutDuration)
                .build();
        // Compared against for unknown subjects so both paths cost one hash check
        this.unknownSubjectHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Verifies a password and opens a session in {@code PASSWORD_VERIFIED}.
     *
     * @throws AuthenticationException with reason {@code INVALID_CREDENTIALS} for an unknown
     *         subject or a wrong password; the two are indistinguishable. Reason
     *         {@code ACCOUNT_LOCKED} while the subject is locked out, whatever the password.
     */
    @NonNull
    public Session authenticate(@NonNull String subjectId, String password) {
        Instant now = clock.instant();
        LoginFailures failures = loginFailures.getIfPresent(subjectId);
        if (failures != null && failures.isLockedAt(now)) {
            metrics.recordLogin(false);
            log.warn("Authentication refused for locked subject {} until {}",
                    StringSanitizer.forLog(subjectId), failures.lockedUntil());
            auditPublisher.publish(TokenEvent.of(TokenEvent.Type.AUTHENTICATION_FAILED, subjectId, null, 0,
                    "account locked", now));
            throw new AuthenticationException(AuthenticationException.Reason.ACCOUNT_LOCKED,
                    "Account temporarily locked");
        }

        Optional<String> hash = credentialStore.findPasswordHash(subjectId);
        boolean matches = password != null && passwordEncoder.matches(password, hash.orElse(unknownSubjectHash));

        if (hash.isEmpty() || !matches) {
            metrics.recordLogin(false);
            log.warn("Authentication failed for subject {}", StringSanitizer.forLog(subjectId));
            auditPublisher.publish(TokenEvent.of(TokenEvent.Type.AUTHENTICATION_FAILED, subjectId, null, 0,
                    "invalid credentials", now));
            recordLoginFailure(subjectId, now);
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_CREDENTIALS,
                    "Invalid credentials");
        }
        loginFailures.invalidate(subjectId);

        var roles = subjectDirectory.find(subjectId)
                .map(SubjectProfile::roleIds)
                .map(ArrayList::new)
                .orElseGet(ArrayList::new);
        roles.sort(String::compareTo);

        Session session = Session.passwordVerified(UUID.randomUUID().toString(), subjectId, roles,
                now, now.plus(pendingTimeout));
        sessionStore.save(session);
        metrics.recordLogin(true);
        log.info("Subject {} authenticated, session {} opened", StringSanitizer.forLog(subjectId), session.id());
        auditPublisher.publish(TokenEvent.of(TokenEvent.Type.PASSWORD_VERIFIED, subjectId, session.id(), 0,
                null, now));
        return session;
    }

    /**
     * Issues the first token pair of a session.
     *
     * <p>Allowed from {@code PASSWORD_VERIFIED} when the subject has no MFA, or from
     * {@code MFA_VERIFIED}. A subject with MFA still in {@code PASSWORD_VERIFIED} is moved
     * to {@code MFA_PENDING} and gets {@link MfaRequiredException} instead of tokens.
     */
    @NonNull
    public TokenPair issueTokens(@NonNull String sessionId) {
        return withSessionLock(sessionId, () -> {
            Instant now = clock.instant();
            Session session = loadLive(sessionId, now);

            if (session.state() == SessionState.PASSWORD_VERIFIED && mfaService.isEnabled(session.subjectId())) {
                Session pending = sessionStore.save(session.transitionTo(SessionState.MFA_PENDING, now));
                log.info("Session {} requires MFA before token issuance", sessionId);
                auditPublisher.publish(TokenEvent.of(TokenEvent.Type.MFA_CHALLENGED, pending.subjectId(),
                        sessionId, pending.tokenVersion(), null, now));
                throw new MfaRequiredException(sessionId);
            }
            if (session.state() == SessionState.MFA_PENDING) {
                throw new MfaRequiredException(sessionId);
            }
            if (session.state() != SessionState.PASSWORD_VERIFIED && session.state() != SessionState.MFA_VERIFIED) {
                throw new IllegalSessionStateException(sessionId, session.state().name(), SessionState.ACTIVE.name());
            }

            Session active = sessionStore.save(session.issued(now, now.plus(refreshTokenTtl)));
            TokenPair pair = mint(active, now);
            log.info("Tokens issued for session {} (version {})", sessionId, active.tokenVersion());
            auditPublisher.publish(TokenEvent.of(TokenEvent.Type.TOKENS_ISSUED, active.subjectId(), sessionId,
                    active.tokenVersion(), active.trustLevel().name(), now));
            return pair;
        });
    }

    /**
     * Checks a TOTP or backup code for a session waiting on MFA.
     * After the configured number of consecutive failures the session is revoked.
     *
     * @throws AuthenticationException  with reason {@code INVALID_MFA_CODE} on a wrong code
     * @throws RevokedSessionException  when the failure limit is reached
     */
    @NonNull
    public Session verifyMfa(@NonNull String sessionId, String code) {
        return withSessionLock(sessionId, () -> {
            Instant now = clock.instant();
            Session session = loadLive(sessionId, now);
            if (session.state() == SessionState.PASSWORD_VERIFIED) {
                session = session.transitionTo(SessionState.MFA_PENDING, now);
            }
            if (session.state() != SessionState.MFA_PENDING) {
                throw new IllegalSessionStateException(sessionId, session.state().name(),
                        SessionState.MFA_VERIFIED.name());
            }

            if (mfaService.verifyMfaCode(session.subjectId(), code)) {
                Session verified = sessionStore.save(session.mfaVerified(now));
                metrics.recordMfaVerification(true);
                auditPublisher.publish(TokenEvent.of(TokenEvent.Type.MFA_VERIFIED, verified.subjectId(), sessionId,
                        verified.tokenVersion(), null, now));
                return verified;
            }

            metrics.recordMfaVerification(false);
            Session failed = session.withFailedMfaAttempt(now);
            auditPublisher.publish(TokenEvent.of(TokenEvent.Type.MFA_FAILED, failed.subjectId(), sessionId,
                    failed.tokenVersion(), "attempt " + failed.failedMfaAttempts(), now));
            if (failed.failedMfaAttempts() >= maxFailedMfaAttempts) {
                revoke(failed, "mfa_attempts_exceeded", now);
                throw new RevokedSessionException(sessionId, "Too many failed MFA attempts");
            }
            sessionStore.save(failed);
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_MFA_CODE, "Invalid MFA code");
        });
    }

    /**
     * Rotates a refresh token. The presented token must carry the session's current
     * version; an older version is a reused token and revokes the whole session.
     */
    @NonNull
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims;
        try {
            claims = codec.decode(refreshToken, TokenType.REFRESH);
        } catch (AuthenticationException e) {
            metrics.recordTokenRefresh(false);
            throw e;
        }

        return withSessionLock(claims.sessionId(), () -> {
            Instant now = clock.instant();
            Session session = sessionStore.findById(claims.sessionId()).orElse(null);
            if (session == null || !session.subjectId().equals(claims.subjectId())) {
                metrics.recordTokenRefresh(false);
                throw new AuthenticationException(AuthenticationException.Reason.SESSION_NOT_FOUND,
                        "Session not found");
            }
            if (session.state() == SessionState.REVOKED) {
                metrics.recordTokenRefresh(false);
                rejected(session, "session revoked", now);
                throw new RevokedSessionException(session.id(), "Session has been revoked");
            }
            if (session.isExpired(now)) {
                metrics.recordTokenRefresh(false);
                expire(session, now);
                throw new TokenExpiredException("Session expired", null);
            }
            if (session.state() != SessionState.ACTIVE) {
                metrics.recordTokenRefresh(false);
                throw new IllegalSessionStateException(session.id(), session.state().name(), SessionState.ACTIVE.name());
            }
            if (claims.version() != session.tokenVersion()) {
                metrics.recordTokenRefresh(false);
                metrics.recordRefreshReuse();
                log.warn("Refresh token reuse on session {} (presented v{}, current v{}), revoking",
                        session.id(), claims.version(), session.tokenVersion());
                auditPublisher.publish(TokenEvent.of(TokenEvent.Type.REFRESH_REUSE_DETECTED, session.subjectId(),
                        session.id(), session.tokenVersion(), "presented version " + claims.version(), now));
                revoke(session, "refresh_token_reuse", now);
                throw new RevokedSessionException(session.id(), "Refresh token reuse detected");
            }

            Session rotated = sessionStore.save(session.issued(now, now.plus(refreshTokenTtl)));
            TokenPair pair = mint(rotated, now);
            metrics.recordTokenRefresh(true);
            auditPublisher.publish(TokenEvent.of(TokenEvent.Type.TOKENS_REFRESHED, rotated.subjectId(),
                    rotated.id(), rotated.tokenVersion(), null, now));
            return pair;
        });
    }

    /**
     * Stateless access-token check: signature, issuer, expiry and type.
     */
    @NonNull
    public TokenClaims verifyAccessToken(String accessToken) {
        return codec.decode(accessToken, TokenType.ACCESS);
    }

    public void revokeSession(@NonNull String sessionId, String reason) {
        withSessionLock(sessionId, () -> {
            Instant now = clock.instant();
            Session session = sessionStore.findById(sessionId)
                    .orElseThrow(() -> new AuthenticationException(AuthenticationException.Reason.SESSION_NOT_FOUND,
                            "Session not found"));
            if (!session.state().isTerminal()) {
                revoke(session, reason != null ? reason : "revoked", now);
            }
            return session;
        });
    }

    public void logout(@NonNull String sessionId) {
        revokeSession(sessionId, "logout");
    }

    public Optional<Session> findSession(String sessionId) {
        return sessionStore.findById(sessionId);
    }

    /**
     * Marks expired sessions and drops them from the store.
     */
    @Scheduled(fixedDelayString = "${app.session.cleanup-interval:PT5M}")
    public void sweepExpiredSessions() {
        Instant now = clock.instant();
        int removed = 0;
        for (Session session : sessionStore.findAll()) {
            if (!now.isBefore(session.expiresAt())) {
                withSessionLock(session.id(), () -> {
                    sessionStore.findById(session.id()).ifPresent(current -> {
                        if (!current.state().isTerminal()) {
                            expire(current, now);
                        }
                        sessionStore.deleteById(current.id());
                    });
                    return null;
                });
                sessionLocks.remove(session.id());
                removed++;
            }
        }
        // Sessions evicted at capacity never reach the loop above
        sessionLocks.keySet().removeIf(id -> sessionStore.findById(id).isEmpty());
        if (removed > 0) {
            log.info("Swept {} expired sessions", removed);
        }
    }

    private Session loadLive(String sessionId, Instant now) {
        Session session = sessionStore.findById(sessionId)
                .orElseThrow(() -> new AuthenticationException(AuthenticationException.Reason.SESSION_NOT_FOUND,
                        "Session not found"));
        if (session.state() == SessionState.REVOKED) {
            throw new RevokedSessionException(sessionId, "Session has been revoked");
        }
        if (session.isExpired(now)) {
            expire(session, now);
            throw new TokenExpiredException("Session expired", null);
        }
        return session;
    }

    private TokenPair mint(Session session, Instant now) {
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant accessExpiry = issuedAt.plus(accessTokenTtl);
        Instant refreshExpiry = issuedAt.plus(refreshTokenTtl);

        String access = codec.encode(new TokenClaims(UUID.randomUUID().toString(), session.subjectId(),
                session.roleIds(), session.id(), session.tokenVersion(), TokenType.ACCESS,
                session.trustLevel(), issuedAt, accessExpiry));
        String refresh = codec.encode(new TokenClaims(UUID.randomUUID().toString(), session.subjectId(),
                session.roleIds(), session.id(), session.tokenVersion(), TokenType.REFRESH,
                session.trustLevel(), issuedAt, refreshExpiry));
        return new TokenPair(access, refresh, accessExpiry, refreshExpiry, session.id(), session.tokenVersion());
    }

    private void revoke(Session session, String reason, Instant now) {
        Session revoked = sessionStore.save(session.revoked(reason, now));
        metrics.recordSessionRevoked(reason);
        log.info("Session {} revoked: {}", session.id(), reason);
        auditPublisher.publish(TokenEvent.of(TokenEvent.Type.SESSION_REVOKED, revoked.subjectId(), revoked.id(),
                revoked.tokenVersion(), reason, now));
    }

    private void expire(Session session, Instant now) {
        if (session.state().isTerminal()) {
            return;
        }
        Session expired = sessionStore.save(session.transitionTo(SessionState.EXPIRED, now));
        metrics.recordSessionExpired();
        auditPublisher.publish(TokenEvent.of(TokenEvent.Type.SESSION_EXPIRED, expired.subjectId(), expired.id(),
                expired.tokenVersion(), null, now));
    }

    private void rejected(Session session, String detail, Instant now) {
        auditPublisher.publish(TokenEvent.of(TokenEvent.Type.REFRESH_REJECTED, session.subjectId(), session.id(),
                session.tokenVersion(), detail, now));
    }

    private void recordLoginFailure(String subjectId, Instant now) {
        LoginFailures updated = loginFailures.asMap().compute(subjectId, (id, previous) -> {
            int count = previous == null || previous.lockExpiredAt(now) ? 1 : previous.count() + 1;
            return new LoginFailures(count, count >= maxFailedLogins ? now.plus(lockoutDuration) : null);
        });
        if (updated.count() == maxFailedLogins) {
            log.warn("Subject {} locked out after {} failed logins until {}",
                    StringSanitizer.forLog(subjectId), updated.count(), updated.lockedUntil());
            auditPublisher.publish(TokenEvent.of(TokenEvent.Type.ACCOUNT_LOCKED, subjectId, null, 0,
                    "locked until " + updated.lockedUntil(), now));
        }
    }

    private <T> T withSessionLock(String sessionId, Supplier<T> action) {
        if (sessionStore.findById(sessionId).isEmpty()) {
            // Nothing to serialize; the action reports the missing session
            return action.get();
        }
        ReentrantLock lock = sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int trackedSessionLocks() {
        return sessionLocks.size();
    }

    private record LoginFailures(int count, Instant lockedUntil) {

        boolean isLockedAt(Instant now) {
            return lockedUntil != null && now.isBefore(lockedUntil);
        }

        boolean lockExpiredAt(Instant now) {
            return lockedUntil != null && !now.isBefore(lockedUntil);
        }
    }
}
