package com.example.iam.common.exception;

import lombok.Getter;

/**
 * A referenced role, permission, policy or session does not exist.
 * Fatal only when the missing entity is the primary lookup target.
 */
@Getter
public class NotFoundException extends IamException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(ErrorKind.NOT_FOUND, entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
