package com.example.iam.config;

import com.example.iam.audit.AuditEmitter;
import com.example.iam.audit.LoggingAuditEmitter;
import com.example.iam.claims.InMemorySubjectDirectory;
import com.example.iam.claims.SubjectDirectory;
import com.example.iam.claims.SubjectProfile;
import com.example.iam.config.properties.BootstrapProperties;
import com.example.iam.config.properties.MfaProperties;
import com.example.iam.config.properties.SessionProperties;
import com.example.iam.config.properties.TokenProperties;
import com.example.iam.persistence.IamState;
import com.example.iam.persistence.IamStateRepository;
import com.example.iam.persistence.InMemoryIamStateRepository;
import com.example.iam.token.credential.CredentialStore;
import com.example.iam.token.credential.InMemoryCredentialStore;
import com.example.iam.token.jwt.JwtTokenCodec;
import com.example.iam.token.mfa.InMemoryMfaEnrollmentStore;
import com.example.iam.token.mfa.MfaEnrollmentStore;
import com.example.iam.token.mfa.MfaService;
import com.example.iam.token.mfa.TotpGenerator;
import com.example.iam.token.session.InMemorySessionStore;
import com.example.iam.token.session.SessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;

/**
 * Wiring for collaborators with a default in-memory implementation.
 * Deployments replace the stores by declaring their own beans.
 */
@Slf4j
@Configuration
public class IamConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecretKey tokenSigningKey(TokenProperties properties) {
        return Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    }

    @Bean
    public JwtTokenCodec jwtTokenCodec(SecretKey tokenSigningKey, TokenProperties properties, Clock clock) {
        return new JwtTokenCodec(tokenSigningKey, properties, clock);
    }

    /**
     * In-memory state seeded from {@code app.iam.bootstrap}.
     */
    @Bean
    @ConditionalOnMissingBean
    public IamStateRepository iamStateRepository(BootstrapProperties bootstrap, Clock clock) {
        IamState seed = new IamState(
                bootstrap.roles().stream().map(BootstrapProperties.RoleSeed::toRole).toList(),
                bootstrap.permissions().stream().map(BootstrapProperties.PermissionSeed::toPermission).toList(),
                bootstrap.policies().stream().map(p -> p.toPolicy(clock.instant())).toList());
        return new InMemoryIamStateRepository(seed);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEmitter auditEmitter(ObjectMapper objectMapper) {
        return new LoggingAuditEmitter(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionStore sessionStore(SessionProperties properties) {
        return new InMemorySessionStore(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubjectDirectory subjectDirectory(BootstrapProperties bootstrap) {
        InMemorySubjectDirectory directory = new InMemorySubjectDirectory();
        bootstrap.subjects().forEach(seed -> directory.save(new SubjectProfile(
                seed.id(),
                seed.roles() == null ? null : new HashSet<>(seed.roles()),
                seed.permissions() == null ? null : new HashSet<>(seed.permissions()),
                seed.attributes() == null ? null : new HashMap<String, Object>(seed.attributes()))));
        log.info("Subject directory seeded with {} subjects", bootstrap.subjects().size());
        return directory;
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialStore credentialStore(BootstrapProperties bootstrap) {
        InMemoryCredentialStore store = new InMemoryCredentialStore();
        bootstrap.subjects().stream()
                .filter(seed -> seed.passwordHash() != null && !seed.passwordHash().isBlank())
                .forEach(seed -> store.storePasswordHash(seed.id(), seed.passwordHash()));
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public MfaEnrollmentStore mfaEnrollmentStore() {
        return new InMemoryMfaEnrollmentStore();
    }

    @Bean
    public TotpGenerator totpGenerator(MfaProperties properties) {
        return new TotpGenerator(properties);
    }

    @Bean
    public MfaService mfaService(MfaEnrollmentStore store, TotpGenerator totpGenerator,
                                 PasswordEncoder passwordEncoder, MfaProperties properties, Clock clock) {
        return new MfaService(store, totpGenerator, passwordEncoder, properties, clock);
    }
}
