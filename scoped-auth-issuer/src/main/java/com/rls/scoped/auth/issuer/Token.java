package com.rls.scoped.auth.issuer;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A signed token together with the claims it encodes. Immutable; a refresh yields a new instance.
 */
public record Token(String value, ClaimSet claims, Instant expiresAt) {

    public Token {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static Token of(String value, ClaimSet claims) {
        return new Token(value, claims, Instant.ofEpochSecond(claims.expiresAt()));
    }

    public Duration remaining(Instant now) {
        return Duration.between(now, expiresAt);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Token(sub=" + claims.subject() + ", role=" + claims.role() + ", expiresAt=" + expiresAt + ", value=****)";
    }
}
