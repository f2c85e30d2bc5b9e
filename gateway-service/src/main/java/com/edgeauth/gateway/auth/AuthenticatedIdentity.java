package com.edgeauth.gateway.auth;

/**
 * Caller identity taken from a verified access token; lives for one request.
 */
public record AuthenticatedIdentity(String subjectId, String email, boolean admin) {

    public static final String EXCHANGE_ATTRIBUTE = AuthenticatedIdentity.class.getName();
}
