package com.example.iam.common.exception;

// An evaluation produced a decision without a traceable reason.
public class InternalConsistencyException extends IamException {

    public InternalConsistencyException(String message) {
        super(ErrorKind.INTERNAL_CONSISTENCY, message);
    }

    public InternalConsistencyException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL_CONSISTENCY, message, cause);
    }
}
