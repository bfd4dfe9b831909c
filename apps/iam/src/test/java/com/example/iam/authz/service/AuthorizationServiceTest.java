package com.example.iam.authz.service;

import com.example.iam.authz.engine.PolicyEvaluator;
import com.example.iam.authz.model.Decision;
import com.example.iam.authz.model.Environment;
import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.ReasonEntry;
import com.example.iam.authz.model.Resource;
import com.example.iam.authz.model.Subject;
import com.example.iam.authz.model.TrustLevel;
import com.example.iam.claims.ClaimsResolver;
import com.example.iam.common.exception.AccessDeniedException;
import com.example.iam.common.exception.AuthenticationException;
import com.example.iam.common.exception.IamException;
import com.example.iam.common.exception.TokenExpiredException;
import com.example.iam.token.jwt.TokenClaims;
import com.example.iam.token.jwt.TokenType;
import com.example.iam.token.service.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static com.example.iam.util.SubjectTestBuilder.aViewer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthorizationService")
class AuthorizationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-05T14:30:00Z");
    private static final Resource DOCUMENT = Resource.of("document", "d1");
    private static final Environment ENVIRONMENT = Environment.at(NOW);

    @Mock
    private PolicyEvaluator evaluator;

    @Mock
    private TokenService tokenService;

    @Mock
    private ClaimsResolver claimsResolver;

    private AuthorizationService service;

    @BeforeEach
    void setUp() {
        service = new AuthorizationService(evaluator, tokenService, claimsResolver);
    }

    private static Decision decision(Outcome outcome) {
        return new Decision("decision-1", "read", "document", "d1", "bob", outcome,
                List.of(ReasonEntry.of(ReasonEntry.Kind.NO_MATCHING_PERMISSION, "test")), false, 1, 1, NOW);
    }

    @Test
    @DisplayName("should emit the evaluator's decision")
    void shouldAuthorize() {
        Subject bob = aViewer("bob");
        when(evaluator.evaluate(bob, "read", DOCUMENT, ENVIRONMENT)).thenReturn(decision(Outcome.ALLOW));

        StepVerifier.create(service.isAllowed(bob, "read", DOCUMENT, ENVIRONMENT))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    @DisplayName("should error with AccessDeniedException carrying only the decision id")
    void shouldRequireAllowed() {
        Subject bob = aViewer("bob");
        when(evaluator.evaluate(bob, "read", DOCUMENT, ENVIRONMENT)).thenReturn(decision(Outcome.DENY));

        StepVerifier.create(service.requireAllowed(bob, "read", DOCUMENT, ENVIRONMENT))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AccessDeniedException.class);
                    AccessDeniedException denied = (AccessDeniedException) error;
                    assertThat(denied.getDecisionId()).isEqualTo("decision-1");
                    assertThat(denied.publicMessage()).isEqualTo(IamException.GENERIC_ACCESS_DENIED);
                })
                .verify();
    }

    @Test
    @DisplayName("should verify the token, resolve claims and evaluate")
    void shouldAuthorizeToken() {
        TokenClaims claims = new TokenClaims("jti-1", "bob", List.of("viewer"), "session-1", 1,
                TokenType.ACCESS, TrustLevel.PASSWORD, NOW, NOW.plusSeconds(900));
        Subject bob = aViewer("bob");
        when(tokenService.verifyAccessToken("access-token")).thenReturn(claims);
        when(claimsResolver.resolve(claims)).thenReturn(bob);
        when(evaluator.evaluate(bob, "read", DOCUMENT, ENVIRONMENT)).thenReturn(decision(Outcome.ALLOW));

        StepVerifier.create(service.authorizeToken("access-token", "read", DOCUMENT, ENVIRONMENT))
                .assertNext(decision -> assertThat(decision.isAllowed()).isTrue())
                .verifyComplete();
    }

    @Test
    @DisplayName("should surface an expired token as an error without evaluating")
    void shouldRejectExpiredToken() {
        when(tokenService.verifyAccessToken("expired"))
                .thenThrow(new TokenExpiredException("Token expired", null));

        StepVerifier.create(service.authorizeToken("expired", "read", DOCUMENT, ENVIRONMENT))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AuthenticationException.class);
                    assertThat(((IamException) error).publicMessage()).isEqualTo(IamException.GENERIC_ACCESS_DENIED);
                })
                .verify();
        verify(evaluator, never()).evaluate(any(), any(), any(), any());
    }
}
