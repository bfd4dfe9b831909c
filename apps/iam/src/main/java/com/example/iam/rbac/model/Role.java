package com.example.iam.rbac.model;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A role: directly granted permission ids plus parent role ids it inherits from.
 * Copy-on-write; every mutation returns a new instance.
 */
public record Role(
        String id,
        String name,
        Set<String> permissionIds,
        Set<String> parentIds
) {
    public Role {
        Objects.requireNonNull(id, "id");
        if (name == null || name.isBlank()) {
            name = id;
        }
        permissionIds = permissionIds == null ? Set.of() : Set.copyOf(permissionIds);
        parentIds = parentIds == null ? Set.of() : Set.copyOf(parentIds);
    }

    public static Role of(String id, String name) {
        return new Role(id, name, Set.of(), Set.of());
    }

    public Role withPermission(String permissionId) {
        Set<String> updated = new HashSet<>(permissionIds);
        updated.add(permissionId);
        return new Role(id, name, updated, parentIds);
    }

    public Role withoutPermission(String permissionId) {
        Set<String> updated = new HashSet<>(permissionIds);
        updated.remove(permissionId);
        return new Role(id, name, updated, parentIds);
    }

    public Role withParent(String parentId) {
        Set<String> updated = new HashSet<>(parentIds);
        updated.add(parentId);
        return new Role(id, name, permissionIds, updated);
    }

    public Role withoutParent(String parentId) {
        Set<String> updated = new HashSet<>(parentIds);
        updated.remove(parentId);
        return new Role(id, name, permissionIds, updated);
    }
}
