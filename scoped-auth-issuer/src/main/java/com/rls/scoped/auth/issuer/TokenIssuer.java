package com.rls.scoped.auth.issuer;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Issues user-scoped tokens for row-level-security backends. Implementations hold no per-user state
 * and may be called concurrently.
 */
public interface TokenIssuer {

    /**
     * @throws com.rls.scoped.auth.issuer.error.ClientException if {@code subject} is null or blank
     * @throws com.rls.scoped.auth.issuer.error.ValidationException on invalid validity or custom claims
     * @throws com.rls.scoped.auth.issuer.error.TokenException if signing fails
     */
    Token issue(String subject, String role, Map<String, ?> customClaims, Duration validity, Instant now);

    ClaimSet verify(String token);
}
