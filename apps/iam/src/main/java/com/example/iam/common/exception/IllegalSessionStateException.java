package com.example.iam.common.exception;

import lombok.Getter;

/**
 * A session operation was called from a state that does not allow it.
 */
@Getter
public class IllegalSessionStateException extends IamException {

    private final String sessionId;
    private final String currentState;
    private final String attemptedState;

    public IllegalSessionStateException(String sessionId, String currentState, String attemptedState) {
        super(ErrorKind.INVALID_SESSION_STATE,
                "Illegal session transition " + currentState + " -> " + attemptedState);
        this.sessionId = sessionId;
        this.currentState = currentState;
        this.attemptedState = attemptedState;
    }
}
