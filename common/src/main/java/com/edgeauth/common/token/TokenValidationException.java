package com.edgeauth.common.token;

import lombok.Getter;

@Getter
public class TokenValidationException extends RuntimeException {

    private final TokenError error;

    public TokenValidationException(TokenError error, String message) {
        super(message);
        this.error = error;
    }

    public TokenValidationException(TokenError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
