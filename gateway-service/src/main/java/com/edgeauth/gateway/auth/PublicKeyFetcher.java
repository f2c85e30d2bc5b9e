package com.edgeauth.gateway.auth;

import java.security.PublicKey;

/**
 * Source of the issuer's verification key. Implementations block and must
 * bound their own waiting time.
 */
public interface PublicKeyFetcher {

    PublicKey fetch() throws KeyUnavailableException;
}
