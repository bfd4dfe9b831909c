package com.example.iam.persistence;

import com.example.iam.policy.model.Policy;
import com.example.iam.rbac.model.Permission;
import com.example.iam.rbac.model.Role;

import java.util.List;

/**
 * Everything the engine needs from the backing store in one load.
 *
 * @param permissions every stored version of every permission
 */
public record IamState(
        List<Role> roles,
        List<Permission> permissions,
        List<Policy> policies
) {
    public IamState {
        roles = roles == null ? List.of() : List.copyOf(roles);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public static IamState empty() {
        return new IamState(List.of(), List.of(), List.of());
    }
}
