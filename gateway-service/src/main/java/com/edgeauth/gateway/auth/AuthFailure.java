package com.edgeauth.gateway.auth;

import com.edgeauth.common.response.ErrorCode;
import com.edgeauth.common.token.TokenError;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a request could not be authenticated. Token problems all collapse to one
 * client-facing error; header and key-distribution problems stay distinct.
 */
@Getter
@RequiredArgsConstructor
public enum AuthFailure {

    MISSING_CREDENTIALS(ErrorCode.MISSING_CREDENTIALS),
    MALFORMED_HEADER(ErrorCode.MALFORMED_AUTH_HEADER),
    KEY_UNAVAILABLE(ErrorCode.KEY_UNAVAILABLE),
    MALFORMED_TOKEN(ErrorCode.INVALID_TOKEN),
    SIGNATURE_INVALID(ErrorCode.INVALID_TOKEN),
    EXPIRED(ErrorCode.INVALID_TOKEN),
    NOT_YET_VALID(ErrorCode.INVALID_TOKEN),
    WRONG_ALGORITHM(ErrorCode.INVALID_TOKEN),
    WRONG_TOKEN_TYPE(ErrorCode.INVALID_TOKEN);

    private final ErrorCode errorCode;

    // token failures share their names with TokenError
    public static AuthFailure from(TokenError error) {
        return valueOf(error.name());
    }
}
