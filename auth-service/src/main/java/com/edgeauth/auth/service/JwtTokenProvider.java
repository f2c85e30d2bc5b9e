package com.edgeauth.auth.service;

import com.edgeauth.auth.config.JwtProperties;
import com.edgeauth.auth.domain.User;
import com.edgeauth.common.token.JwtTokenCodec;
import com.edgeauth.common.token.TokenClaims;
import com.edgeauth.common.token.TokenKind;
import com.edgeauth.common.token.TokenSubject;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class JwtTokenProvider {

    private final KeyManager keyManager;
    private final JwtTokenCodec codec;
    private final JwtProperties properties;

    public String createAccessToken(User user) {
        return createToken(user, TokenKind.ACCESS);
    }

    public String createRefreshToken(User user) {
        return createToken(user, TokenKind.REFRESH);
    }

    public TokenClaims parseToken(String token) {
        return codec.verify(token, keyManager.getPublicKey());
    }

    public long getAccessTokenExpirySeconds() {
        return properties.getAccessTokenTtl().toSeconds();
    }

    private String createToken(User user, TokenKind kind) {
        TokenSubject subject = new TokenSubject(String.valueOf(user.getId()), user.getEmail(), user.isAdmin());
        return codec.sign(subject, kind, keyManager.getPrivateKey(), properties.getIssuer(), ttlOf(kind));
    }

    private Duration ttlOf(TokenKind kind) {
        return kind == TokenKind.ACCESS ? properties.getAccessTokenTtl() : properties.getRefreshTokenTtl();
    }
}
