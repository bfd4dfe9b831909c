package com.example.iam.token.session;

import java.util.Collection;
import java.util.Optional;

public interface SessionStore {

    Optional<Session> findById(String sessionId);

    Session save(Session session);

    void deleteById(String sessionId);

    Collection<Session> findAll();
}
