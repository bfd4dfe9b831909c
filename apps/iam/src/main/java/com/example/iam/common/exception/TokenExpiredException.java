package com.example.iam.common.exception;

// Expired access or refresh token. Distinct from a bad signature so callers can refresh instead of re-login.
public class TokenExpiredException extends AuthenticationException {

    public TokenExpiredException(String message, Throwable cause) {
        super(ErrorKind.TOKEN_EXPIRED, Reason.INVALID_TOKEN, message, cause);
    }
}
