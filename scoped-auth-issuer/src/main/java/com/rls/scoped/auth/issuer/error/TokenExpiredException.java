package com.rls.scoped.auth.issuer.error;

import java.time.Instant;

import lombok.Getter;

/**
 * Signature checked out but the token is at or past its {@code exp}.
 */
@Getter
public class TokenExpiredException extends TokenException {

    private static final long serialVersionUID = 1L;

    private final Instant expiresAt;

    public TokenExpiredException(Instant expiresAt) {
        super("token expired at " + expiresAt);
        this.expiresAt = expiresAt;
    }
}
