package com.edgeauth.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),
    UNAUTHORIZED(401, "C004", "Unauthorized"),

    // Auth
    INVALID_TOKEN(401, "A001", "Invalid or expired token"),
    DUPLICATE_EMAIL(409, "A002", "Email already exists"),
    LOGIN_FAILED(401, "A003", "Invalid credentials"),
    MISSING_CREDENTIALS(401, "A005", "Authorization header required"),
    MALFORMED_AUTH_HEADER(401, "A006", "Invalid authorization header format. Expected 'Bearer <token>'"),
    KEY_UNAVAILABLE(503, "A007", "Authentication service unavailable"),

    // Gateway
    UNKNOWN_BACKEND(404, "G001", "Unknown service"),
    BACKEND_UNAVAILABLE(502, "G002", "Service is unavailable"),
    INTERNAL_PROXY_ERROR(500, "G003", "Failed to create proxy request");

    private final int status;
    private final String code;
    private final String message;
}
