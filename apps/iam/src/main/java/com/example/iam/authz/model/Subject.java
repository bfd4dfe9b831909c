package com.example.iam.authz.model;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The authenticated caller as seen by one evaluation.
 * Rebuilt for every request from token claims and the subject directory.
 *
 * @param roleIds       roles carried by the access token
 * @param permissionIds permissions granted directly to the subject
 * @param attributes    subject attributes addressable as {@code subject.<name>}
 * @param sessionId     session the token belongs to, null when evaluated outside a session
 */
public record Subject(
        String id,
        Set<String> roleIds,
        Set<String> permissionIds,
        boolean mfaEnabled,
        TrustLevel trustLevel,
        Map<String, Object> attributes,
        String sessionId
) {
    public Subject {
        Objects.requireNonNull(id, "id");
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        permissionIds = permissionIds == null ? Set.of() : Set.copyOf(permissionIds);
        trustLevel = trustLevel == null ? TrustLevel.NONE : trustLevel;
        attributes = Attributes.copyOf(attributes);
    }

    public static Subject withRoles(String id, String... roleIds) {
        return new Subject(id, Set.of(roleIds), Set.of(), false, TrustLevel.PASSWORD, Map.of(), null);
    }

    public boolean isMfaElevated() {
        return trustLevel == TrustLevel.MFA_ELEVATED;
    }
}
