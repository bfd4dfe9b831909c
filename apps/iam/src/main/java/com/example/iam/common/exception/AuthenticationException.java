package com.example.iam.common.exception;

import lombok.Getter;

/**
 * Bad credential or unusable token.
 */
@Getter
public class AuthenticationException extends IamException {

    public enum Reason {
        INVALID_CREDENTIALS,
        INVALID_TOKEN,
        INVALID_MFA_CODE,
        SESSION_NOT_FOUND,
        ACCOUNT_LOCKED
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        super(ErrorKind.AUTHENTICATION, message);
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
        this.reason = reason;
    }

    protected AuthenticationException(ErrorKind kind, Reason reason, String message, Throwable cause) {
        super(kind, message, cause);
        this.reason = reason;
    }
}
