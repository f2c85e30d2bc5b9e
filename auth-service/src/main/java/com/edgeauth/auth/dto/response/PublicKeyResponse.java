package com.edgeauth.auth.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PublicKeyResponse(
        @JsonProperty("public_key") String publicKey,
        String algorithm,
        @JsonProperty("key_type") String keyType
) {
    public static PublicKeyResponse rsa(String publicKeyPem, String algorithm) {
        return new PublicKeyResponse(publicKeyPem, algorithm, "RSA");
    }
}
