package com.example.iam.authz.model;

/**
 * One link of a decision's reason chain.
 *
 * @param sourceId id of the permission or policy, or null for synthetic reasons
 * @param version  version of that permission or policy at evaluation time, 0 when not applicable
 */
public record ReasonEntry(
        Kind kind,
        String sourceId,
        int version,
        String detail
) {
    public enum Kind {
        PERMISSION,
        NO_MATCHING_PERMISSION,
        POLICY_ALLOW,
        POLICY_DENY,
        UNKNOWN_ACTION,
        UNKNOWN_RESOURCE_TYPE,
        EVALUATION_ERROR
    }

    public static ReasonEntry permission(String permissionId, int version, String detail) {
        return new ReasonEntry(Kind.PERMISSION, permissionId, version, detail);
    }

    public static ReasonEntry policy(String policyId, int version, boolean deny, String detail) {
        return new ReasonEntry(deny ? Kind.POLICY_DENY : Kind.POLICY_ALLOW, policyId, version, detail);
    }

    public static ReasonEntry of(Kind kind, String detail) {
        return new ReasonEntry(kind, null, 0, detail);
    }

    @Override
    public String toString() {
        return sourceId == null ? kind + ": " + detail : kind + " " + sourceId + "@v" + version + ": " + detail;
    }
}
