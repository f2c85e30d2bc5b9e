package com.edgeauth.common.token;

public enum TokenError {
    MALFORMED_TOKEN,
    SIGNATURE_INVALID,
    EXPIRED,
    NOT_YET_VALID,
    WRONG_ALGORITHM
}
