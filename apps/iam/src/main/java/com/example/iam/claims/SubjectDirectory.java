package com.example.iam.claims;

import java.util.Optional;

/**
 * Source of subject profiles. Implementations must return current data on every call;
 * subjects are rebuilt per request.
 */
public interface SubjectDirectory {

    Optional<SubjectProfile> find(String subjectId);

    void save(SubjectProfile profile);
}
