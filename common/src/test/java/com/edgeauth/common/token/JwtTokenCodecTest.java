package com.edgeauth.common.token;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenCodecTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(30);
    private static final TokenSubject ALICE = new TokenSubject("42", "alice@example.com", true);

    private static KeyPair keyPair;
    private static KeyPair otherKeyPair;

    @BeforeAll
    static void generateKeyPairs() throws Exception {
        KeyPairGenerator gen = KeyPairGenerator.getInstance("RSA");
        gen.initialize(2048);
        keyPair = gen.generateKeyPair();
        otherKeyPair = gen.generateKeyPair();
    }

    @Test
    void verify_signedToken_returnsSameClaims() {
        JwtTokenCodec codec = codecAt(NOW);
        String token = codec.sign(ALICE, TokenKind.ACCESS, keyPair.getPrivate(), "edgeauth", TTL);

        TokenClaims claims = codec.verify(token, keyPair.getPublic());

        assertThat(claims.subject()).isEqualTo(ALICE);
        assertThat(claims.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(claims.issuer()).isEqualTo("edgeauth");
        assertThat(claims.issuedAt()).isEqualTo(NOW);
        assertThat(claims.notBefore()).isEqualTo(NOW);
        assertThat(claims.expiresAt()).isEqualTo(NOW.plus(TTL));
    }

    @Test
    void verify_refreshKind_isPreserved() {
        JwtTokenCodec codec = codecAt(NOW);
        String token = codec.sign(ALICE, TokenKind.REFRESH, keyPair.getPrivate(), "edgeauth", Duration.ofDays(7));

        assertThat(codec.verify(token, keyPair.getPublic()).kind()).isEqualTo(TokenKind.REFRESH);
    }

    @Test
    void verify_withDifferentKeyPair_failsWithSignatureInvalid() {
        JwtTokenCodec codec = codecAt(NOW);
        String token = codec.sign(ALICE, TokenKind.ACCESS, otherKeyPair.getPrivate(), "edgeauth", TTL);

        assertThatThrownBy(() -> codec.verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.SIGNATURE_INVALID);
    }

    @Test
    void verify_tamperedPayload_failsWithSignatureInvalid() {
        JwtTokenCodec codec = codecAt(NOW);
        String token = codec.sign(ALICE, TokenKind.ACCESS, keyPair.getPrivate(), "edgeauth", TTL);
        String[] parts = token.split("\\.");
        String forgedPayload = base64Url("{\"sub\":\"1\",\"email\":\"mallory@example.com\",\"is_admin\":true,"
                + "\"type\":\"access\",\"iat\":" + NOW.getEpochSecond() + ",\"nbf\":" + NOW.getEpochSecond()
                + ",\"exp\":" + NOW.plus(TTL).getEpochSecond() + "}");

        assertThatThrownBy(() -> codec.verify(parts[0] + "." + forgedPayload + "." + parts[2], keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.SIGNATURE_INVALID);
    }

    @Test
    void verify_oneSecondBeforeExpiry_succeeds() {
        String token = codecAt(NOW).sign(ALICE, TokenKind.ACCESS, keyPair.getPrivate(), "edgeauth", TTL);

        TokenClaims claims = codecAt(NOW.plus(TTL).minusSeconds(1)).verify(token, keyPair.getPublic());

        assertThat(claims.subjectId()).isEqualTo("42");
    }

    @Test
    void verify_atExpiry_failsWithExpired() {
        String token = codecAt(NOW).sign(ALICE, TokenKind.ACCESS, keyPair.getPrivate(), "edgeauth", TTL);
        JwtTokenCodec later = codecAt(NOW.plus(TTL));

        assertThatThrownBy(() -> later.verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.EXPIRED);
    }

    @Test
    void verify_wellAfterExpiry_failsWithExpired() {
        String token = codecAt(NOW).sign(ALICE, TokenKind.ACCESS, keyPair.getPrivate(), "edgeauth", TTL);
        JwtTokenCodec later = codecAt(NOW.plus(Duration.ofDays(1)));

        assertThatThrownBy(() -> later.verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.EXPIRED);
    }

    @Test
    void verify_beforeNotBefore_failsWithNotYetValid() {
        String token = codecAt(NOW).sign(ALICE, TokenKind.ACCESS, keyPair.getPrivate(), "edgeauth", TTL);
        JwtTokenCodec earlier = codecAt(NOW.minusSeconds(5));

        assertThatThrownBy(() -> earlier.verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.NOT_YET_VALID);
    }

    @Test
    void verify_hmacSignedToken_failsWithWrongAlgorithm() {
        String token = Jwts.builder()
                .subject("42")
                .claim("type", "access")
                .issuedAt(Date.from(NOW))
                .notBefore(Date.from(NOW))
                .expiration(Date.from(NOW.plus(TTL)))
                .signWith(Jwts.SIG.HS256.key().build())
                .compact();

        assertThatThrownBy(() -> codecAt(NOW).verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.WRONG_ALGORITHM);
    }

    @Test
    void verify_unsignedToken_failsWithWrongAlgorithm() {
        String token = base64Url("{\"alg\":\"none\"}") + "."
                + base64Url("{\"sub\":\"42\",\"type\":\"access\"}") + ".";

        assertThatThrownBy(() -> codecAt(NOW).verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.WRONG_ALGORITHM);
    }

    @Test
    void verify_garbage_failsWithMalformed() {
        assertThatThrownBy(() -> codecAt(NOW).verify("invalid-token", keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.MALFORMED_TOKEN);
    }

    @Test
    void verify_headerNotJson_failsWithMalformed() {
        String token = base64Url("not-json") + ".e30.c2ln";

        assertThatThrownBy(() -> codecAt(NOW).verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.MALFORMED_TOKEN);
    }

    @Test
    void verify_unknownTokenType_failsWithMalformed() {
        String token = Jwts.builder()
                .subject("42")
                .claim("type", "session")
                .issuedAt(Date.from(NOW))
                .notBefore(Date.from(NOW))
                .expiration(Date.from(NOW.plus(TTL)))
                .signWith(keyPair.getPrivate(), Jwts.SIG.RS256)
                .compact();

        assertThatThrownBy(() -> codecAt(NOW).verify(token, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.MALFORMED_TOKEN);
    }

    @Test
    void verify_nullToken_failsWithMalformed() {
        assertThatThrownBy(() -> codecAt(NOW).verify(null, keyPair.getPublic()))
                .isInstanceOf(TokenValidationException.class)
                .extracting(e -> ((TokenValidationException) e).getError())
                .isEqualTo(TokenError.MALFORMED_TOKEN);
    }

    private static JwtTokenCodec codecAt(Instant instant) {
        return new JwtTokenCodec(Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static String base64Url(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
