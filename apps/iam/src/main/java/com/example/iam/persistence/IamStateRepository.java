package com.example.iam.persistence;

import com.example.iam.policy.model.Policy;
import com.example.iam.rbac.model.Permission;
import com.example.iam.rbac.model.Role;
import org.springframework.lang.NonNull;

/**
 * Durable store behind the role graph and policy store.
 * Implementations throw {@link com.example.iam.common.exception.UnavailableException}
 * when the store cannot be reached; the schema is theirs to decide.
 */
public interface IamStateRepository {

    /**
     * Loads all roles, permission versions and policies.
     */
    @NonNull
    IamState loadAll();

    /**
     * Persists a role as of the given role-graph version.
     */
    void persistRole(@NonNull Role role, long graphVersion);

    /**
     * Persists a new permission version. Earlier versions are kept.
     */
    void persistPermission(@NonNull Permission permission);

    /**
     * Persists a policy version.
     */
    void persistPolicy(@NonNull Policy policy);
}
