package com.example.iam.authz.service;

import com.example.iam.authz.engine.PolicyEvaluator;
import com.example.iam.authz.model.Decision;
import com.example.iam.authz.model.Environment;
import com.example.iam.authz.model.Resource;
import com.example.iam.authz.model.Subject;
import com.example.iam.claims.ClaimsResolver;
import com.example.iam.common.exception.AccessDeniedException;
import com.example.iam.token.jwt.TokenClaims;
import com.example.iam.token.service.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Reactive entry point for authorization checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationService {

    private final PolicyEvaluator evaluator;
    private final TokenService tokenService;
    private final ClaimsResolver claimsResolver;

    /**
     * Evaluate a request for an already resolved subject.
     *
     * @param subject     Subject built for this request
     * @param action      Action verb
     * @param resource    Target resource
     * @param environment Request environment
     * @return Mono emitting the decision; never errors, failures become an error-flagged deny
     */
    public Mono<Decision> authorize(Subject subject, String action, Resource resource, Environment environment) {
        return Mono.fromCallable(() -> evaluator.evaluate(subject, action, resource, environment));
    }

    /**
     * Check if access is allowed (convenience method).
     */
    public Mono<Boolean> isAllowed(Subject subject, String action, Resource resource, Environment environment) {
        return authorize(subject, action, resource, environment).map(Decision::isAllowed);
    }

    /**
     * Emits the decision when allowed, otherwise errors with {@link AccessDeniedException}.
     */
    public Mono<Decision> requireAllowed(Subject subject, String action, Resource resource, Environment environment) {
        return authorize(subject, action, resource, environment).flatMap(this::allowedOrDenied);
    }

    /**
     * Full control flow for a bearer token: verify the access token, resolve the subject
     * from its claims and evaluate.
     *
     * @return Mono emitting the decision, or an authentication error when the token is
     *         invalid or expired
     */
    public Mono<Decision> authorizeToken(String accessToken, String action, Resource resource,
                                         Environment environment) {
        return Mono.fromCallable(() -> tokenService.verifyAccessToken(accessToken))
                .map(this::resolveSubject)
                .flatMap(subject -> authorize(subject, action, resource, environment))
                .doOnError(e -> log.debug("Token authorization failed: {}", e.getMessage()));
    }

    private Subject resolveSubject(TokenClaims claims) {
        return claimsResolver.resolve(claims);
    }

    private Mono<Decision> allowedOrDenied(Decision decision) {
        if (decision.isAllowed()) {
            return Mono.just(decision);
        }
        return Mono.error(new AccessDeniedException(decision.id()));
    }
}
