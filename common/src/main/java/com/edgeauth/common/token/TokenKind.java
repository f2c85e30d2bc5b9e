package com.edgeauth.common.token;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TokenKind {

    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    public static TokenKind fromClaim(String value) {
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown token type: " + value);
    }
}
