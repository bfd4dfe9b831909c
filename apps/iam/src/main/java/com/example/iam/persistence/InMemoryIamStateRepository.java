package com.example.iam.persistence;

import com.example.iam.policy.model.Policy;
import com.example.iam.rbac.model.Permission;
import com.example.iam.rbac.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of IamStateRepository for single-pod deployments and tests.
 */
@Slf4j
public class InMemoryIamStateRepository implements IamStateRepository {

    private final ConcurrentHashMap<String, Role> roles = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Permission> permissions = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, Policy> policies = new ConcurrentHashMap<>();

    public InMemoryIamStateRepository() {
        this(IamState.empty());
    }

    public InMemoryIamStateRepository(@NonNull IamState seed) {
        seed.roles().forEach(role -> roles.put(role.id(), role));
        permissions.addAll(seed.permissions());
        seed.policies().forEach(policy -> policies.put(policy.id(), policy));
        log.info("In-memory IAM state repository initialized (roles={}, permissions={}, policies={})",
                roles.size(), permissions.size(), policies.size());
    }

    @Override
    @NonNull
    public IamState loadAll() {
        List<Permission> orderedPermissions = new ArrayList<>(permissions);
        orderedPermissions.sort(Comparator.comparing(Permission::id).thenComparingInt(Permission::version));
        return new IamState(new ArrayList<>(roles.values()), orderedPermissions, new ArrayList<>(policies.values()));
    }

    @Override
    public void persistRole(@NonNull Role role, long graphVersion) {
        roles.put(role.id(), role);
        log.debug("Persisted role {} at graph version {}", role.id(), graphVersion);
    }

    @Override
    public void persistPermission(@NonNull Permission permission) {
        permissions.add(permission);
        log.debug("Persisted permission {} v{}", permission.id(), permission.version());
    }

    @Override
    public void persistPolicy(@NonNull Policy policy) {
        policies.merge(policy.id(), policy,
                (existing, incoming) -> incoming.version() >= existing.version() ? incoming : existing);
        log.debug("Persisted policy {} v{}", policy.id(), policy.version());
    }
}
