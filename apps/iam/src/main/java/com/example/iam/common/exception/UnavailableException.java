package com.example.iam.common.exception;

// The backing store could not be reached. Retrying is the caller's decision.
public class UnavailableException extends IamException {

    public UnavailableException(String message) {
        super(ErrorKind.UNAVAILABLE, message);
    }

    public UnavailableException(String message, Throwable cause) {
        super(ErrorKind.UNAVAILABLE, message, cause);
    }
}
