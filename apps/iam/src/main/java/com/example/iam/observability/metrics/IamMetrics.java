package com.example.iam.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Counters and timers for the decision engine and token service.
 * Tag values are bounded to keep metric cardinality low.
 */
@Component
public class IamMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter decisionAllowed;
    private final Counter decisionDenied;
    private final Counter decisionError;
    private final Timer evaluationTimer;

    private final Counter loginSuccess;
    private final Counter loginFailure;
    private final Counter tokenRefresh;
    private final Counter tokenRefreshFailure;
    private final Counter refreshReuseDetected;
    private final Counter mfaSuccess;
    private final Counter mfaFailure;
    private final Counter sessionRevoked;
    private final Counter sessionExpired;

    private final Counter auditEmitFailure;
    private final Counter stateSyncFailure;

    public IamMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.decisionAllowed = Counter.builder("iam.decision")
                .tag("result", "allowed")
                .description("Authorization decisions that allowed access")
                .register(registry);

        this.decisionDenied = Counter.builder("iam.decision")
                .tag("result", "denied")
                .description("Authorization decisions that denied access")
                .register(registry);

        this.decisionError = Counter.builder("iam.decision.error")
                .description("Decisions forced to deny by an internal failure")
                .register(registry);

        this.evaluationTimer = Timer.builder("iam.decision.evaluation")
                .description("Policy evaluation duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.loginSuccess = Counter.builder("iam.auth.login")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Successful password verifications")
                .register(registry);

        this.loginFailure = Counter.builder("iam.auth.login")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Failed password verifications")
                .register(registry);

        this.tokenRefresh = Counter.builder("iam.token.refresh")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Successful token refreshes")
                .register(registry);

        this.tokenRefreshFailure = Counter.builder("iam.token.refresh")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Rejected token refreshes")
                .register(registry);

        this.refreshReuseDetected = Counter.builder("iam.token.refresh.reuse")
                .description("Refresh token reuse detections, each revoking a session")
                .register(registry);

        this.mfaSuccess = Counter.builder("iam.mfa.verify")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Accepted MFA codes")
                .register(registry);

        this.mfaFailure = Counter.builder("iam.mfa.verify")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Rejected MFA codes")
                .register(registry);

        this.sessionRevoked = Counter.builder("iam.session.lifecycle")
                .tag("event", "revoked")
                .description("Sessions revoked")
                .register(registry);

        this.sessionExpired = Counter.builder("iam.session.lifecycle")
                .tag("event", "expired")
                .description("Sessions expired")
                .register(registry);

        this.auditEmitFailure = Counter.builder("iam.audit.emit.failure")
                .description("Audit events the emitter failed to accept")
                .register(registry);

        this.stateSyncFailure = Counter.builder("iam.state.sync.failure")
                .description("Failed reloads from the backing store")
                .register(registry);
    }

    @NonNull
    public Timer.Sample startEvaluation() {
        return Timer.start(registry);
    }

    public void recordDecision(@NonNull Timer.Sample sample, boolean allowed, boolean error, @Nullable String action) {
        sample.stop(evaluationTimer);
        if (allowed) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
        }
        if (error) {
            decisionError.increment();
        }
        registry.counter("iam.decision.by_action",
                Tags.of("result", allowed ? "allowed" : "denied", "action", sanitizeTag(action)))
                .increment();
    }

    public void recordLogin(boolean success) {
        if (success) {
            loginSuccess.increment();
        } else {
            loginFailure.increment();
        }
    }

    public void recordTokenRefresh(boolean success) {
        if (success) {
            tokenRefresh.increment();
        } else {
            tokenRefreshFailure.increment();
        }
    }

    public void recordRefreshReuse() {
        refreshReuseDetected.increment();
    }

    public void recordMfaVerification(boolean success) {
        if (success) {
            mfaSuccess.increment();
        } else {
            mfaFailure.increment();
        }
    }

    public void recordSessionRevoked(@Nullable String reason) {
        sessionRevoked.increment();
        registry.counter("iam.session.revoked.by_reason", Tags.of("reason", sanitizeTag(reason)))
                .increment();
    }

    public void recordSessionExpired() {
        sessionExpired.increment();
    }

    public void recordAuditEmitFailure() {
        auditEmitFailure.increment();
    }

    public void recordStateSyncFailure() {
        stateSyncFailure.increment();
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
