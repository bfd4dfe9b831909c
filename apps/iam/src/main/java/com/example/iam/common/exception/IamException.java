package com.example.iam.common.exception;

import lombok.Getter;

/**
 * Base class for all errors raised by the decision engine and token service.
 */
@Getter
public abstract class IamException extends RuntimeException {

    public static final String GENERIC_ACCESS_DENIED = "access denied";

    private final ErrorKind kind;

    protected IamException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected IamException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Message safe to show to an end user. Authentication and authorization
     * failures never reveal why access was refused.
     */
    public String publicMessage() {
        return kind.isAccessRelated() ? GENERIC_ACCESS_DENIED : getMessage();
    }
}
