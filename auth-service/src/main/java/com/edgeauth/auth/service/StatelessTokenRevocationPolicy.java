package com.edgeauth.auth.service;

import com.edgeauth.common.token.TokenClaims;

/**
 * Stateless tokens: nothing is ever revoked, a refresh token stays valid until it expires.
 */
public class StatelessTokenRevocationPolicy implements TokenRevocationPolicy {

    @Override
    public boolean isRevoked(TokenClaims refreshClaims) {
        return false;
    }

    @Override
    public boolean revoke(TokenClaims refreshClaims) {
        return false;
    }
}
