package com.edgeauth.common.token;

import java.time.Instant;

/**
 * Payload of a verified token. Immutable; changing any field means signing a new token.
 */
public record TokenClaims(
        String subjectId,
        String email,
        boolean admin,
        TokenKind kind,
        String issuer,
        Instant issuedAt,
        Instant notBefore,
        Instant expiresAt
) {

    public TokenSubject subject() {
        return new TokenSubject(subjectId, email, admin);
    }
}
