package com.example.iam.token.mfa;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

public class InMemoryMfaEnrollmentStore implements MfaEnrollmentStore {

    private final ConcurrentHashMap<String, MfaEnrollment> enrollments = new ConcurrentHashMap<>();

    @Override
    public Optional<MfaEnrollment> find(String subjectId) {
        return subjectId == null ? Optional.empty() : Optional.ofNullable(enrollments.get(subjectId));
    }

    @Override
    public void save(MfaEnrollment enrollment) {
        enrollments.put(enrollment.subjectId(), enrollment);
    }

    @Override
    public Optional<MfaEnrollment> update(String subjectId, UnaryOperator<MfaEnrollment> update) {
        return Optional.ofNullable(enrollments.computeIfPresent(subjectId, (id, current) -> update.apply(current)));
    }

    @Override
    public void delete(String subjectId) {
        enrollments.remove(subjectId);
    }
}
