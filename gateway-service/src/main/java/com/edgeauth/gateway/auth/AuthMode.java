package com.edgeauth.gateway.auth;

public enum AuthMode {
    /** reject the request unless it carries a valid access token */
    REQUIRED,
    /** attach identity when a valid access token is present, pass through otherwise */
    OPTIONAL
}
