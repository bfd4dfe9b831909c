package com.example.iam.rbac.graph;

import com.example.iam.common.util.StringSanitizer;
import com.example.iam.rbac.model.Permission;
import com.example.iam.rbac.model.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable point-in-time view of the role graph.
 *
 * <p>Roles reference parents and permissions by id only, so cycle detection and
 * closure resolution are plain graph walks over the id maps.
 */
@Slf4j
public final class RoleGraphSnapshot {

    private static final RoleGraphSnapshot EMPTY = new RoleGraphSnapshot(0L, Map.of(), Map.of());

    private final long version;
    private final Map<String, Role> roles;
    // All versions of each permission, oldest first
    private final Map<String, List<Permission>> permissions;
    private final Set<String> knownActions;
    private final Set<String> knownResourceTypes;

    RoleGraphSnapshot(long version, Map<String, Role> roles, Map<String, List<Permission>> permissions) {
        this.version = version;
        this.roles = Map.copyOf(roles);
        Map<String, List<Permission>> copy = new HashMap<>();
        permissions.forEach((id, versions) -> copy.put(id, List.copyOf(versions)));
        this.permissions = Collections.unmodifiableMap(copy);

        Set<String> actions = new HashSet<>();
        Set<String> types = new HashSet<>();
        this.permissions.values().forEach(versions -> {
            Permission current = versions.get(versions.size() - 1);
            actions.add(current.action());
            types.add(current.resourceType());
        });
        this.knownActions = Set.copyOf(actions);
        this.knownResourceTypes = Set.copyOf(types);
    }

    public static RoleGraphSnapshot empty() {
        return EMPTY;
    }

    public long version() {
        return version;
    }

    public Optional<Role> role(String roleId) {
        return Optional.ofNullable(roles.get(roleId));
    }

    public Collection<Role> roles() {
        return roles.values();
    }

    /**
     * Current (latest) version of a permission.
     */
    public Optional<Permission> permission(String permissionId) {
        List<Permission> versions = permissions.get(permissionId);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.get(versions.size() - 1));
    }

    public Optional<Permission> permission(String permissionId, int permissionVersion) {
        List<Permission> versions = permissions.get(permissionId);
        if (versions == null) {
            return Optional.empty();
        }
        return versions.stream().filter(p -> p.version() == permissionVersion).findFirst();
    }

    public List<Permission> permissionHistory(String permissionId) {
        return permissions.getOrDefault(permissionId, List.of());
    }

    Map<String, Role> roleMap() {
        return roles;
    }

    Map<String, List<Permission>> permissionMap() {
        return permissions;
    }

    public boolean isKnownAction(String action) {
        return knownActions.contains(action);
    }

    public boolean isKnownResourceType(String resourceType) {
        return knownResourceTypes.contains(resourceType);
    }

    /**
     * Union of the directly granted permissions of every role reachable from the
     * given roles through parent edges. Unknown role ids are skipped.
     *
     * <p>Runs in O(roles + edges): each role is expanded at most once.
     */
    public Set<String> resolvePermissions(Collection<String> roleIds) {
        Set<String> resolved = new LinkedHashSet<>();
        for (Role role : closure(roleIds)) {
            resolved.addAll(role.permissionIds());
        }
        return resolved;
    }

    /**
     * Every role reachable from the given roles, start roles included.
     */
    public List<Role> closure(Collection<String> roleIds) {
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(roleIds);
        List<Role> reached = new ArrayList<>();

        while (!pending.isEmpty()) {
            String roleId = pending.pop();
            if (!visited.add(roleId)) {
                continue;
            }
            Role role = roles.get(roleId);
            if (role == null) {
                log.warn("Dangling role reference skipped during resolution: {} (graph version {})",
                        StringSanitizer.forLog(roleId), version);
                continue;
            }
            reached.add(role);
            for (String parentId : role.parentIds()) {
                if (!visited.contains(parentId)) {
                    pending.push(parentId);
                }
            }
        }
        return reached;
    }

    /**
     * Whether {@code to} is reachable from {@code from} by following parent edges.
     */
    public boolean canReach(String from, String to) {
        if (from.equals(to)) {
            return true;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!visited.add(current)) {
                continue;
            }
            Role role = roles.get(current);
            if (role == null) {
                continue;
            }
            for (String parentId : role.parentIds()) {
                if (parentId.equals(to)) {
                    return true;
                }
                pending.push(parentId);
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoleGraphSnapshot other)) return false;
        return roles.equals(other.roles) && permissions.equals(other.permissions);
    }

    @Override
    public int hashCode() {
        return roles.hashCode() * 31 + permissions.hashCode();
    }
}
