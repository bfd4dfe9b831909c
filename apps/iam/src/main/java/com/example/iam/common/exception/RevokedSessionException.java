package com.example.iam.common.exception;

import lombok.Getter;

/**
 * The session was revoked, either explicitly or because a rotated-out
 * refresh token was presented again.
 */
@Getter
public class RevokedSessionException extends IamException {

    private final String sessionId;

    public RevokedSessionException(String sessionId, String message) {
        super(ErrorKind.REVOKED_SESSION, message);
        this.sessionId = sessionId;
    }
}
