package com.edgeauth.auth.controller;

import com.edgeauth.auth.dto.response.PublicKeyResponse;
import com.edgeauth.auth.service.KeyManager;
import com.edgeauth.common.token.JwtTokenCodec;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
public class PublicKeyController {

    private final PublicKeyResponse publicKeyResponse;

    public PublicKeyController(KeyManager keyManager) {
        this.publicKeyResponse = PublicKeyResponse.rsa(keyManager.exportPublicKeyPem(), JwtTokenCodec.ALGORITHM);
    }

    @GetMapping(value = "/api/v1/auth/public-key", produces = "application/json")
    public ResponseEntity<PublicKeyResponse> publicKey() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(Duration.ofHours(1)).cachePublic())
                .body(publicKeyResponse);
    }
}
