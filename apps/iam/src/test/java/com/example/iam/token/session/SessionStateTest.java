package com.example.iam.token.session;

import com.example.iam.authz.model.TrustLevel;
import com.example.iam.common.exception.IllegalSessionStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SessionState")
class SessionStateTest {

    private static final Instant NOW = Instant.parse("2024-03-05T14:30:00Z");

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "UNAUTHENTICATED, PASSWORD_VERIFIED",
            "PASSWORD_VERIFIED, MFA_PENDING",
            "PASSWORD_VERIFIED, ACTIVE",
            "MFA_PENDING, MFA_VERIFIED",
            "MFA_VERIFIED, ACTIVE",
            "ACTIVE, ACTIVE",
            "ACTIVE, REVOKED",
            "MFA_PENDING, EXPIRED"
    })
    @DisplayName("should allow lifecycle transitions")
    void shouldAllowTransition(SessionState from, SessionState to) {
        assertThat(from.transitionTo(to, "s1")).isEqualTo(to);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "UNAUTHENTICATED, ACTIVE",
            "PASSWORD_VERIFIED, MFA_VERIFIED",
            "MFA_PENDING, ACTIVE",
            "ACTIVE, MFA_PENDING",
            "REVOKED, ACTIVE",
            "EXPIRED, ACTIVE",
            "REVOKED, REVOKED"
    })
    @DisplayName("should reject illegal transitions")
    void shouldRejectTransition(SessionState from, SessionState to) {
        assertThatThrownBy(() -> from.transitionTo(to, "s1"))
                .isInstanceOf(IllegalSessionStateException.class);
    }

    @Test
    @DisplayName("should bump the token version on every issuance")
    void shouldBumpTokenVersion() {
        Session session = Session.passwordVerified("s1", "alice", List.of("viewer"), NOW, NOW.plusSeconds(600));

        Session first = session.issued(NOW, NOW.plus(Duration.ofDays(7)));
        Session second = first.issued(NOW.plusSeconds(60), NOW.plus(Duration.ofDays(8)));

        assertThat(session.tokenVersion()).isZero();
        assertThat(first.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(first.tokenVersion()).isEqualTo(1);
        assertThat(second.tokenVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("should elevate trust and reset failures on MFA verification")
    void shouldElevateOnMfa() {
        Session pending = Session.passwordVerified("s1", "alice", List.of(), NOW, NOW.plusSeconds(600))
                .transitionTo(SessionState.MFA_PENDING, NOW)
                .withFailedMfaAttempt(NOW);

        Session verified = pending.mfaVerified(NOW);

        assertThat(verified.trustLevel()).isEqualTo(TrustLevel.MFA_ELEVATED);
        assertThat(verified.failedMfaAttempts()).isZero();
    }

    @Test
    @DisplayName("should not revoke a session twice")
    void shouldRejectDoubleRevocation() {
        Session revoked = Session.passwordVerified("s1", "alice", List.of(), NOW, NOW.plusSeconds(600))
                .revoked("logout", NOW);

        assertThat(revoked.revocationReason()).isEqualTo("logout");
        assertThatThrownBy(() -> revoked.revoked("again", NOW))
                .isInstanceOf(IllegalSessionStateException.class);
    }
}
