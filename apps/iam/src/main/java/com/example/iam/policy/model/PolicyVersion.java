package com.example.iam.policy.model;

import java.time.Instant;

/**
 * History entry recorded for every accepted policy write.
 */
public record PolicyVersion(
        String policyId,
        int version,
        Policy policy,
        Instant recordedAt
) {
}
