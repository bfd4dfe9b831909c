package com.example.iam.common.exception;

import lombok.Getter;

/**
 * Raised by callers that require an Allow decision. Carries only the decision id;
 * the reason chain stays in the audit record.
 */
@Getter
public class AccessDeniedException extends IamException {

    private final String decisionId;

    public AccessDeniedException(String decisionId) {
        super(ErrorKind.ACCESS_DENIED, GENERIC_ACCESS_DENIED);
        this.decisionId = decisionId;
    }
}
