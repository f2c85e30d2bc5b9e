package com.edgeauth.gateway.auth;

import com.edgeauth.gateway.TestTokens;
import com.edgeauth.gateway.config.GatewayProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssuerPublicKeyClientTest {

    // generous enough for the first request of a cold WebClient connection pool
    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(3);
    private static final String PATH = "/api/v1/auth/public-key";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static KeyPair keyPair;

    private WireMockServer wireMockServer;
    private IssuerPublicKeyClient client;

    @BeforeAll
    static void generateKeyPair() {
        keyPair = TestTokens.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        GatewayProperties properties = new GatewayProperties();
        properties.getIssuer().setBaseUrl(wireMockServer.baseUrl());
        properties.getIssuer().setFetchTimeout(FETCH_TIMEOUT);
        client = new IssuerPublicKeyClient(properties, WebClient.builder());
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    void fetch_parsesPemFromIssuer() throws Exception {
        stubPublicKey(200, body(TestTokens.publicKeyPem(keyPair), "RS256"));

        PublicKey key = client.fetch();

        assertThat(key.getEncoded()).isEqualTo(keyPair.getPublic().getEncoded());
    }

    @Test
    void fetch_issuerError_throwsKeyUnavailable() {
        stubPublicKey(500, "{\"code\":\"C003\",\"error\":\"Internal server error\"}");

        assertThatThrownBy(() -> client.fetch()).isInstanceOf(KeyUnavailableException.class);
    }

    @Test
    void fetch_unparseablePem_throwsKeyUnavailable() throws Exception {
        stubPublicKey(200, body("-----BEGIN PUBLIC KEY-----\nnot-a-key\n-----END PUBLIC KEY-----", "RS256"));

        assertThatThrownBy(() -> client.fetch())
                .isInstanceOf(KeyUnavailableException.class)
                .hasMessageContaining("unparseable");
    }

    @Test
    void fetch_unexpectedAlgorithm_throwsKeyUnavailable() throws Exception {
        stubPublicKey(200, body(TestTokens.publicKeyPem(keyPair), "HS256"));

        assertThatThrownBy(() -> client.fetch())
                .isInstanceOf(KeyUnavailableException.class)
                .hasMessageContaining("HS256");
    }

    @Test
    void fetch_slowIssuer_timesOut() throws Exception {
        wireMockServer.stubFor(get(urlEqualTo(PATH))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body(TestTokens.publicKeyPem(keyPair), "RS256"))
                        .withFixedDelay((int) FETCH_TIMEOUT.multipliedBy(2).toMillis())));

        assertThatThrownBy(() -> client.fetch()).isInstanceOf(KeyUnavailableException.class);
    }

    @Test
    void fetch_issuerDown_throwsKeyUnavailable() {
        wireMockServer.stop();

        assertThatThrownBy(() -> client.fetch()).isInstanceOf(KeyUnavailableException.class);
    }

    private void stubPublicKey(int status, String body) {
        wireMockServer.stubFor(get(urlEqualTo(PATH))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    private static String body(String pem, String algorithm) throws Exception {
        return OBJECT_MAPPER.writeValueAsString(Map.of(
                "public_key", pem,
                "algorithm", algorithm,
                "key_type", "RSA"));
    }
}
