package com.edgeauth.auth.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Logout acknowledgement. {@code tokenRevoked} tells the client whether the refresh
 * token actually stopped working; with stateless tokens it stays valid until expiry.
 */
public record LogoutResponse(
        String message,
        @JsonProperty("token_revoked") boolean tokenRevoked
) {
    public static LogoutResponse of(boolean tokenRevoked) {
        return new LogoutResponse(
                tokenRevoked
                        ? "Logged out, refresh token revoked"
                        : "Logged out, tokens remain valid until they expire",
                tokenRevoked);
    }
}
