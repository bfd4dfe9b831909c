package com.example.iam.token.session;

import com.example.iam.common.util.StringSanitizer;
import com.example.iam.config.properties.SessionProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed session store for single-node deployments and tests.
 * Bounded by {@code app.session.max-sessions}; expiry is handled by the token service sweep.
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Cache<String, Session> sessions;

    public InMemorySessionStore(SessionProperties properties) {
        this.sessions = Caffeine.newBuilder()
                .maximumSize(properties.maxSessions())
                .removalListener((String id, Session session, RemovalCause cause) -> {
                    if (cause == RemovalCause.SIZE) {
                        log.warn("Session store at capacity ({}), evicted session {}",
                                properties.maxSessions(), StringSanitizer.forLog(id));
                    }
                })
                .build();
        log.info("In-memory session store initialized (max-sessions={})", properties.maxSessions());
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    @Override
    public Session save(Session session) {
        sessions.put(session.id(), session);
        return session;
    }

    @Override
    public void deleteById(String sessionId) {
        sessions.invalidate(sessionId);
    }

    @Override
    public Collection<Session> findAll() {
        return List.copyOf(sessions.asMap().values());
    }
}
