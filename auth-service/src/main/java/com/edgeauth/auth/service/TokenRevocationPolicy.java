package com.edgeauth.auth.service;

import com.edgeauth.common.token.TokenClaims;

/**
 * Decides whether an otherwise valid refresh token is still honoured. Register a
 * bean of this type to back logout with a revocation store.
 */
public interface TokenRevocationPolicy {

    boolean isRevoked(TokenClaims refreshClaims);

    /**
     * @return {@code true} only if the token will be rejected from now on
     */
    boolean revoke(TokenClaims refreshClaims);
}
