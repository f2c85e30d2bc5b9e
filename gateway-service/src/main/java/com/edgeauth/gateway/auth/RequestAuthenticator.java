package com.edgeauth.gateway.auth;

import com.edgeauth.common.token.JwtTokenCodec;
import com.edgeauth.common.token.TokenClaims;
import com.edgeauth.common.token.TokenKind;
import com.edgeauth.common.token.TokenValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.PublicKey;

@Slf4j
@Component
@RequiredArgsConstructor
public class RequestAuthenticator {

    private static final String BEARER_SCHEME = "Bearer";

    private final PublicKeyCache keyCache;
    private final JwtTokenCodec codec;

    /**
     * Verifies an {@code Authorization} header value. Errors are signalled as
     * {@link AuthenticationException}.
     */
    public Mono<AuthenticatedIdentity> authenticate(String authorizationHeader) {
        String token;
        try {
            token = extractBearerToken(authorizationHeader);
        } catch (AuthenticationException e) {
            return Mono.error(e);
        }

        PublicKey cachedKey = keyCache.peek();
        if (cachedKey != null) {
            return Mono.fromCallable(() -> verify(token, cachedKey));
        }

        // cold or expired cache: the fetch blocks, keep it off the event loop
        return Mono.fromCallable(keyCache::getKey)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(KeyUnavailableException.class,
                        e -> new AuthenticationException(AuthFailure.KEY_UNAVAILABLE, e.getMessage(), e))
                .map(key -> verify(token, key));
    }

    String extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isEmpty()) {
            throw new AuthenticationException(AuthFailure.MISSING_CREDENTIALS, "Authorization header missing");
        }

        String[] parts = authorizationHeader.split(" ", 2);
        if (parts.length != 2 || !BEARER_SCHEME.equals(parts[0]) || parts[1].isEmpty()) {
            throw new AuthenticationException(AuthFailure.MALFORMED_HEADER, "Authorization header is not 'Bearer <token>'");
        }
        return parts[1];
    }

    private AuthenticatedIdentity verify(String token, PublicKey publicKey) {
        TokenClaims claims;
        try {
            claims = codec.verify(token, publicKey);
        } catch (TokenValidationException e) {
            throw new AuthenticationException(AuthFailure.from(e.getError()), e.getMessage(), e);
        }

        if (claims.kind() != TokenKind.ACCESS) {
            throw new AuthenticationException(AuthFailure.WRONG_TOKEN_TYPE,
                    "Expected access token, got " + claims.kind().getClaimValue());
        }
        return new AuthenticatedIdentity(claims.subjectId(), claims.email(), claims.admin());
    }
}
