package com.example.iam.token.credential;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, String> hashes = new ConcurrentHashMap<>();

    @Override
    public Optional<String> findPasswordHash(String subjectId) {
        return subjectId == null ? Optional.empty() : Optional.ofNullable(hashes.get(subjectId));
    }

    @Override
    public void storePasswordHash(String subjectId, String passwordHash) {
        hashes.put(subjectId, passwordHash);
    }
}
