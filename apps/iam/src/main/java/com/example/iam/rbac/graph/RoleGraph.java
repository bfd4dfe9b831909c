package com.example.iam.rbac.graph;

import com.example.iam.common.exception.CycleException;
import com.example.iam.common.exception.IamException;
import com.example.iam.common.exception.NotFoundException;
import com.example.iam.common.exception.UnavailableException;
import com.example.iam.common.exception.ValidationException;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.persistence.IamStateRepository;
import com.example.iam.rbac.model.Permission;
import com.example.iam.rbac.model.PermissionScope;
import com.example.iam.rbac.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Role graph with copy-on-write snapshots.
 *
 * <p>Readers take {@link #snapshot()} and never block. Writers are serialized by a single
 * lock, build a new snapshot, persist the change and only then publish the snapshot, so a
 * failed write leaves the graph untouched.
 */
@Slf4j
@Component
public class RoleGraph {

    private final AtomicReference<RoleGraphSnapshot> current = new AtomicReference<>(RoleGraphSnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();
    private final IamStateRepository repository;

    public RoleGraph(IamStateRepository repository) {
        this.repository = repository;
    }

    @NonNull
    public RoleGraphSnapshot snapshot() {
        return current.get();
    }

    /**
     * Transitive permission closure of the given roles against the current snapshot.
     */
    @NonNull
    public Set<String> resolvePermissions(@NonNull Collection<String> roleIds) {
        return snapshot().resolvePermissions(roleIds);
    }

    @NonNull
    public Role getRole(@NonNull String roleId) {
        return snapshot().role(roleId).orElseThrow(() -> new NotFoundException("role", roleId));
    }

    @NonNull
    public Permission getPermission(@NonNull String permissionId) {
        return snapshot().permission(permissionId)
                .orElseThrow(() -> new NotFoundException("permission", permissionId));
    }

    @NonNull
    public Role addRole(@NonNull String roleId, String name) {
        if (!StringSanitizer.isValidId(roleId)) {
            throw new ValidationException("Invalid role id: " + StringSanitizer.forLog(roleId));
        }
        return write(snapshot -> {
            if (snapshot.role(roleId).isPresent()) {
                throw new ValidationException("Role already exists: " + roleId);
            }
            return Role.of(roleId, name);
        });
    }

    /**
     * Defines a permission, or records a new version of it when the grant changes.
     * Existing versions stay available for audit.
     */
    @NonNull
    public Permission definePermission(@NonNull String permissionId, @NonNull String resourceType,
                                       @NonNull String action, PermissionScope scope) {
        if (!StringSanitizer.isValidId(permissionId)) {
            throw new ValidationException("Invalid permission id: " + StringSanitizer.forLog(permissionId));
        }
        if (resourceType.isBlank() || action.isBlank()) {
            throw new ValidationException("Permission resource type and action are required");
        }
        PermissionScope effectiveScope = scope != null ? scope : PermissionScope.ALL;

        writeLock.lock();
        try {
            RoleGraphSnapshot base = current.get();
            Permission candidate = base.permission(permissionId)
                    .map(existing -> existing.nextVersion(resourceType, action, effectiveScope))
                    .orElseGet(() -> new Permission(permissionId, resourceType, action, effectiveScope, 1));

            Permission previous = base.permission(permissionId).orElse(null);
            if (previous != null && previous.sameGrantAs(candidate)) {
                return previous;
            }

            Map<String, List<Permission>> permissions = new HashMap<>(base.permissionMap());
            List<Permission> versions = new ArrayList<>(permissions.getOrDefault(permissionId, List.of()));
            versions.add(candidate);
            permissions.put(permissionId, versions);

            persist(() -> repository.persistPermission(candidate), "permission " + permissionId);
            current.set(new RoleGraphSnapshot(base.version() + 1, base.roleMap(), permissions));
            log.info("Permission {} defined at version {}", permissionId, candidate.version());
            return candidate;
        } finally {
            writeLock.unlock();
        }
    }

    @NonNull
    public Role grantPermission(@NonNull String roleId, @NonNull String permissionId) {
        return write(snapshot -> {
            Role role = snapshot.role(roleId).orElseThrow(() -> new NotFoundException("role", roleId));
            if (snapshot.permission(permissionId).isEmpty()) {
                throw new NotFoundException("permission", permissionId);
            }
            return role.withPermission(permissionId);
        });
    }

    @NonNull
    public Role revokePermission(@NonNull String roleId, @NonNull String permissionId) {
        return write(snapshot -> {
            Role role = snapshot.role(roleId).orElseThrow(() -> new NotFoundException("role", roleId));
            return role.withoutPermission(permissionId);
        });
    }

    /**
     * Makes {@code childId} inherit from {@code parentId}.
     *
     * @throws CycleException when the parent already inherits from the child (or they are
     *                        the same role); the graph is unchanged
     */
    @NonNull
    public Role addParent(@NonNull String childId, @NonNull String parentId) {
        return write(snapshot -> {
            Role child = snapshot.role(childId).orElseThrow(() -> new NotFoundException("role", childId));
            if (snapshot.role(parentId).isEmpty()) {
                throw new NotFoundException("role", parentId);
            }
            if (snapshot.canReach(parentId, childId)) {
                log.warn("Rejected role edge {} -> {}: would create an inheritance cycle",
                        StringSanitizer.forLog(childId), StringSanitizer.forLog(parentId));
                throw new CycleException("Adding parent " + parentId + " to role " + childId
                        + " would create an inheritance cycle");
            }
            return child.withParent(parentId);
        });
    }

    @NonNull
    public Role removeParent(@NonNull String childId, @NonNull String parentId) {
        return write(snapshot -> {
            Role child = snapshot.role(childId).orElseThrow(() -> new NotFoundException("role", childId));
            return child.withoutParent(parentId);
        });
    }

    /**
     * Replaces the whole graph with state loaded from the backing store.
     * Rejects the load if it contains an inheritance cycle.
     */
    public void replaceAll(@NonNull Collection<Role> roles, @NonNull Collection<Permission> permissions) {
        Map<String, Role> roleMap = new HashMap<>();
        roles.forEach(role -> roleMap.put(role.id(), role));

        Map<String, List<Permission>> permissionMap = new HashMap<>();
        permissions.stream()
                .sorted(Comparator.comparing(Permission::id).thenComparingInt(Permission::version))
                .forEach(p -> permissionMap.computeIfAbsent(p.id(), id -> new ArrayList<>()).add(p));

        writeLock.lock();
        try {
            RoleGraphSnapshot candidate = new RoleGraphSnapshot(current.get().version() + 1, roleMap, permissionMap);
            for (Role role : roleMap.values()) {
                for (String parentId : role.parentIds()) {
                    if (candidate.canReach(parentId, role.id())) {
                        throw new CycleException("Loaded role graph contains a cycle through role " + role.id());
                    }
                }
            }
            current.set(candidate);
            log.info("Role graph replaced (roles={}, permissions={}, version={})",
                    roleMap.size(), permissionMap.size(), candidate.version());
        } finally {
            writeLock.unlock();
        }
    }

    private Role write(Function<RoleGraphSnapshot, Role> mutation) {
        writeLock.lock();
        try {
            RoleGraphSnapshot base = current.get();
            Role updated = mutation.apply(base);

            Map<String, Role> roles = new HashMap<>(base.roleMap());
            roles.put(updated.id(), updated);
            long nextVersion = base.version() + 1;

            persist(() -> repository.persistRole(updated, nextVersion), "role " + updated.id());
            current.set(new RoleGraphSnapshot(nextVersion, roles, base.permissionMap()));
            log.debug("Role {} written at graph version {}", updated.id(), nextVersion);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    private void persist(Runnable action, String description) {
        try {
            action.run();
        } catch (IamException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to persist {}: {}", description, e.getMessage());
            throw new UnavailableException("Backing store rejected write of " + description, e);
        }
    }
}
