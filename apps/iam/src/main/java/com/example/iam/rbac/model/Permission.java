package com.example.iam.rbac.model;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * A grant to perform one action on one resource type.
 * Never mutated: redefining a permission produces a new version.
 */
public record Permission(
        String id,
        String resourceType,
        String action,
        PermissionScope scope,
        int version
) {
    public Permission {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(action, "action");
        if (scope == null) {
            scope = PermissionScope.ALL;
        }
        if (version <= 0) {
            version = 1;
        }
    }

    public static Permission of(String id, String resourceType, String action) {
        return new Permission(id, resourceType, action, PermissionScope.ALL, 1);
    }

    /**
     * Check whether this permission covers the action on the resource.
     *
     * @param subjectId id of the requesting subject
     * @param ownerId   owner of the target resource, may be null
     */
    public boolean covers(String requestedType, String requestedAction,
                          String subjectId, @Nullable String ownerId) {
        if (!resourceType.equals(requestedType) || !action.equals(requestedAction)) {
            return false;
        }
        return switch (scope) {
            case ALL -> true;
            case OWN -> subjectId != null && subjectId.equals(ownerId);
        };
    }

    /**
     * Same grant, ignoring id and version.
     */
    public boolean sameGrantAs(Permission other) {
        return resourceType.equals(other.resourceType)
                && action.equals(other.action)
                && scope == other.scope;
    }

    public Permission nextVersion(String newResourceType, String newAction, PermissionScope newScope) {
        return new Permission(id, newResourceType, newAction, newScope, version + 1);
    }
}
