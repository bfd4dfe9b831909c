package com.example.iam.common.exception;

import lombok.Getter;

// Tokens cannot be issued until the session completes MFA elevation.
@Getter
public class MfaRequiredException extends IamException {

    private final String sessionId;

    public MfaRequiredException(String sessionId) {
        super(ErrorKind.MFA_REQUIRED, "MFA verification required before token issuance");
        this.sessionId = sessionId;
    }
}
