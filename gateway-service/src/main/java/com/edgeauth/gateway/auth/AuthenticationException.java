package com.edgeauth.gateway.auth;

import lombok.Getter;

@Getter
public class AuthenticationException extends RuntimeException {

    private final AuthFailure failure;

    public AuthenticationException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AuthenticationException(AuthFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
