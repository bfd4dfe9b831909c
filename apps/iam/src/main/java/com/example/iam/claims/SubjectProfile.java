package com.example.iam.claims;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directory entry of a subject.
 *
 * @param roleIds       roles assigned to the subject, copied into tokens at issuance
 * @param permissionIds permissions granted directly, outside any role
 */
public record SubjectProfile(
        String subjectId,
        Set<String> roleIds,
        Set<String> permissionIds,
        Map<String, Object> attributes
) {
    public SubjectProfile {
        Objects.requireNonNull(subjectId, "subjectId");
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        permissionIds = permissionIds == null ? Set.of() : Set.copyOf(permissionIds);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static SubjectProfile withRoles(String subjectId, String... roleIds) {
        return new SubjectProfile(subjectId, Set.of(roleIds), Set.of(), Map.of());
    }
}
