package com.edgeauth.gateway.auth;

import com.edgeauth.common.token.JwtTokenCodec;
import com.edgeauth.common.token.PemKeys;
import com.edgeauth.gateway.config.GatewayProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.security.PublicKey;
import java.time.Duration;

/**
 * Fetches the PEM public key from the issuer's public-key endpoint.
 */
@Slf4j
@Component
public class IssuerPublicKeyClient implements PublicKeyFetcher {

    private final WebClient webClient;
    private final String publicKeyPath;
    private final Duration timeout;

    public IssuerPublicKeyClient(GatewayProperties properties, WebClient.Builder webClientBuilder) {
        GatewayProperties.Issuer issuer = properties.getIssuer();
        this.webClient = webClientBuilder.baseUrl(issuer.getBaseUrl()).build();
        this.publicKeyPath = issuer.getPublicKeyPath();
        this.timeout = issuer.getFetchTimeout();
    }

    @Override
    public PublicKey fetch() {
        PublicKeyPayload payload;
        try {
            payload = webClient.get()
                    .uri(publicKeyPath)
                    .retrieve()
                    .bodyToMono(PublicKeyPayload.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            log.error("Failed to fetch public key from issuer: {}", e.getMessage());
            throw new KeyUnavailableException("Failed to fetch public key", e);
        }

        if (payload == null || payload.publicKey() == null) {
            throw new KeyUnavailableException("Issuer returned no public key");
        }
        if (payload.algorithm() != null && !JwtTokenCodec.ALGORITHM.equals(payload.algorithm())) {
            throw new KeyUnavailableException("Issuer advertises unsupported algorithm " + payload.algorithm());
        }

        try {
            return PemKeys.parsePublicKey(payload.publicKey());
        } catch (IllegalArgumentException e) {
            throw new KeyUnavailableException("Issuer returned an unparseable public key", e);
        }
    }

    record PublicKeyPayload(
            @JsonProperty("public_key") String publicKey,
            String algorithm,
            @JsonProperty("key_type") String keyType
    ) {}
}
