package com.example.iam.authz.model;

import java.time.Instant;
import java.util.List;

/**
 * Write-once result of an evaluation.
 *
 * @param reasons            ordered chain of the permissions or policies that determined the outcome
 * @param error              set when the decision was forced to DENY by an internal failure
 * @param roleGraphVersion   role graph snapshot the evaluation read
 * @param policyStoreVersion policy store snapshot the evaluation read
 */
public record Decision(
        String id,
        String action,
        String resourceType,
        String resourceId,
        String subjectId,
        Outcome outcome,
        List<ReasonEntry> reasons,
        boolean error,
        long roleGraphVersion,
        long policyStoreVersion,
        Instant timestamp
) {
    public Decision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }

    public boolean isDenied() {
        return outcome == Outcome.DENY;
    }
}
