package com.example.iam;

import com.example.iam.authz.model.Environment;
import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.Resource;
import com.example.iam.authz.service.AuthorizationService;
import com.example.iam.rbac.graph.RoleGraph;
import com.example.iam.token.credential.CredentialStore;
import com.example.iam.token.jwt.TokenPair;
import com.example.iam.token.service.TokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class IamApplicationTests {

    @Autowired
    private RoleGraph roleGraph;

    @Autowired
    private TokenService tokenService;

    @Autowired
    private AuthorizationService authorizationService;

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Test
    void contextLoads() {
        assertThat(roleGraph.resolvePermissions(List.of("editor")))
                .containsExactlyInAnyOrder("document-read", "document-write");
    }

    @Test
    void shouldAuthorizeSeededSubjectEndToEnd() {
        credentialStore.storePasswordHash("alice", passwordEncoder.encode("s3cret-passphrase"));
        String sessionId = tokenService.authenticate("alice", "s3cret-passphrase").id();
        TokenPair tokens = tokenService.issueTokens(sessionId);
        Resource document = Resource.of("document", "doc-1");

        StepVerifier.create(authorizationService.authorizeToken(tokens.accessToken(), "write", document,
                        Environment.from("10.1.2.3", Instant.now())))
                .assertNext(decision -> assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW))
                .verifyComplete();

        StepVerifier.create(authorizationService.authorizeToken(tokens.accessToken(), "write", document,
                        Environment.from("203.0.113.7", Instant.now())))
                .assertNext(decision -> {
                    assertThat(decision.outcome()).isEqualTo(Outcome.DENY);
                    assertThat(decision.reasons()).first()
                            .satisfies(reason -> assertThat(reason.sourceId()).isEqualTo("deny-write-outside-office"));
                })
                .verifyComplete();

        tokenService.logout(sessionId);
    }
}
