package com.edgeauth.common.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.security.SecurityException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;

/**
 * Signs and verifies RS256 tokens carrying {@link TokenClaims}.
 *
 * <p>Verification applies no clock-skew leeway: a token is expired once
 * {@code now >= exp} and not yet valid while {@code now < nbf}.
 */
public class JwtTokenCodec {

    public static final String ALGORITHM = "RS256";

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ADMIN = "is_admin";
    static final String CLAIM_TYPE = "type";

    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JwtTokenCodec(Clock clock) {
        this.clock = clock;
    }

    public String sign(TokenSubject subject, TokenKind kind, PrivateKey privateKey, String issuer, Duration ttl) {
        // JWT numeric dates have second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return Jwts.builder()
                .issuer(issuer)
                .subject(subject.subjectId())
                .claim(CLAIM_EMAIL, subject.email())
                .claim(CLAIM_ADMIN, subject.admin())
                .claim(CLAIM_TYPE, kind.getClaimValue())
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(privateKey, Jwts.SIG.RS256)
                .compact();
    }

    public TokenClaims verify(String token, PublicKey publicKey) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(TokenError.MALFORMED_TOKEN, "Token is empty");
        }
        requireExpectedAlgorithm(token);

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(publicKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenValidationException(TokenError.EXPIRED, "Token has expired", e);
        } catch (PrematureJwtException e) {
            throw new TokenValidationException(TokenError.NOT_YET_VALID, "Token is not yet valid", e);
        } catch (SecurityException e) {
            throw new TokenValidationException(TokenError.SIGNATURE_INVALID, "Token signature is invalid", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenValidationException(TokenError.MALFORMED_TOKEN, "Token is malformed: " + e.getMessage(), e);
        }

        TokenClaims tokenClaims = toTokenClaims(claims);
        // the parser only rejects now > exp
        if (!clock.instant().isBefore(tokenClaims.expiresAt())) {
            throw new TokenValidationException(TokenError.EXPIRED, "Token has expired");
        }
        return tokenClaims;
    }

    private void requireExpectedAlgorithm(String token) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenValidationException(TokenError.MALFORMED_TOKEN, "Token must have three segments");
        }

        JsonNode header;
        try {
            byte[] decoded = Base64.getUrlDecoder().decode(parts[0]);
            header = objectMapper.readTree(new String(decoded, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | IOException e) {
            throw new TokenValidationException(TokenError.MALFORMED_TOKEN, "Token header is not valid JSON", e);
        }

        JsonNode alg = header == null ? null : header.get("alg");
        if (alg == null || !alg.isTextual()) {
            throw new TokenValidationException(TokenError.MALFORMED_TOKEN, "Token header has no algorithm");
        }
        if (!ALGORITHM.equals(alg.asText())) {
            throw new TokenValidationException(TokenError.WRONG_ALGORITHM,
                    "Unexpected signing algorithm: " + alg.asText());
        }
    }

    private TokenClaims toTokenClaims(Claims claims) {
        try {
            String subject = claims.getSubject();
            Date issuedAt = claims.getIssuedAt();
            Date notBefore = claims.getNotBefore();
            Date expiration = claims.getExpiration();
            if (subject == null || issuedAt == null || notBefore == null || expiration == null) {
                throw new TokenValidationException(TokenError.MALFORMED_TOKEN, "Token is missing registered claims");
            }

            Boolean admin = claims.get(CLAIM_ADMIN, Boolean.class);
            return new TokenClaims(
                    subject,
                    claims.get(CLAIM_EMAIL, String.class),
                    Boolean.TRUE.equals(admin),
                    TokenKind.fromClaim(claims.get(CLAIM_TYPE, String.class)),
                    claims.getIssuer(),
                    issuedAt.toInstant(),
                    notBefore.toInstant(),
                    expiration.toInstant()
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenValidationException(TokenError.MALFORMED_TOKEN, "Token claims are invalid: " + e.getMessage(), e);
        }
    }
}
