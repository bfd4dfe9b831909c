package com.example.iam.token.credential;

import java.util.Optional;

/**
 * Password hashes by subject id. Hashing scheme is the encoder's concern.
 */
public interface CredentialStore {

    Optional<String> findPasswordHash(String subjectId);

    void storePasswordHash(String subjectId, String passwordHash);
}
