package com.example.iam.token.mfa;

import java.util.Optional;
import java.util.function.UnaryOperator;

public interface MfaEnrollmentStore {

    Optional<MfaEnrollment> find(String subjectId);

    void save(MfaEnrollment enrollment);

    /**
     * Applies {@code update} atomically with respect to other updates of the same subject.
     * Returning the argument unchanged leaves the stored value untouched.
     *
     * @return the stored enrollment after the update, empty if none existed
     */
    Optional<MfaEnrollment> update(String subjectId, UnaryOperator<MfaEnrollment> update);

    void delete(String subjectId);
}
