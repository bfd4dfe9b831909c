package com.example.iam.common.exception;

// Malformed role, permission or policy input, rejected before any state change.
public class ValidationException extends IamException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
