package com.edgeauth.common.token;

/**
 * Identity fields a token is issued for.
 */
public record TokenSubject(
        String subjectId,
        String email,
        boolean admin
) {
}
