package com.example.iam.common.exception;

// A role-graph write would close an inheritance cycle.
public class CycleException extends IamException {

    public CycleException(String message) {
        super(ErrorKind.CYCLE, message);
    }

    public CycleException(String message, Throwable cause) {
        super(ErrorKind.CYCLE, message, cause);
    }
}
