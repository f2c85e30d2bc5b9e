package com.edgeauth.auth.service;

import com.edgeauth.auth.config.JwtProperties;
import com.edgeauth.common.token.PemKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.InvalidParameterException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * Owns the issuer's RSA signing key pair. The pair is fixed for the lifetime of
 * the process and read without synchronization.
 */
@Slf4j
@Component
public class KeyManager {

    public static final int MIN_KEY_SIZE = 2048;

    private final KeyPair keyPair;
    private final String publicKeyPem;

    @Autowired
    public KeyManager(JwtProperties properties) {
        this(loadOrGenerate(properties));
    }

    KeyManager(KeyPair keyPair) {
        if (!(keyPair.getPublic() instanceof RSAPublicKey)) {
            throw new IllegalArgumentException("Signing key pair must be RSA");
        }
        this.keyPair = keyPair;
        this.publicKeyPem = PemKeys.encodePublicKey(keyPair.getPublic());
    }

    public static KeyPair generateKeyPair(int bitSize) {
        if (bitSize < MIN_KEY_SIZE) {
            throw new IllegalArgumentException(
                    "RSA key size must be at least " + MIN_KEY_SIZE + " bits, got " + bitSize);
        }
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(bitSize, new SecureRandom());
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException | InvalidParameterException e) {
            throw new IllegalStateException("Failed to generate RSA key pair", e);
        }
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public RSAPublicKey getPublicKey() {
        return (RSAPublicKey) keyPair.getPublic();
    }

    public String exportPublicKeyPem() {
        return publicKeyPem;
    }

    private static KeyPair loadOrGenerate(JwtProperties properties) {
        if (properties.hasConfiguredKeyPair()) {
            RSAPublicKey publicKey = PemKeys.parsePublicKey(properties.getPublicKey());
            PrivateKey privateKey = PemKeys.parsePrivateKey(properties.getPrivateKey());
            if (!(privateKey instanceof RSAPrivateKey)
                    || !((RSAPrivateKey) privateKey).getModulus().equals(publicKey.getModulus())) {
                throw new IllegalStateException("Configured jwt.private-key and jwt.public-key do not form a pair");
            }
            log.info("JWT keys loaded from configuration, key_size={}", publicKey.getModulus().bitLength());
            return new KeyPair(publicKey, privateKey);
        }

        if (hasText(properties.getPrivateKey()) || hasText(properties.getPublicKey())) {
            throw new IllegalStateException("jwt.private-key and jwt.public-key must be configured together");
        }

        KeyPair generated = generateKeyPair(properties.getKeySize());
        log.warn("No JWT key pair configured; generated an ephemeral {}-bit pair. "
                + "Tokens issued before a restart will fail verification.", properties.getKeySize());
        return generated;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
