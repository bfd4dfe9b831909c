package com.example.iam.rbac.model;

/**
 * Scope qualifier of a permission.
 */
public enum PermissionScope {
    /**
     * Only resources owned by the subject.
     */
    OWN,

    /**
     * Every resource of the permission's type.
     */
    ALL
}
