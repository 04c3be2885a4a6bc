package com.rls.scoped.auth.issuer;

/**
 * Turns claim sets into compact signed tokens and back.
 */
public interface TokenSigner {

    String sign(ClaimSet claims);

    /**
     * @throws com.rls.scoped.auth.issuer.error.InvalidSignatureException if the token is malformed or its
     *         signature does not match
     * @throws com.rls.scoped.auth.issuer.error.TokenExpiredException if the current time is at or past {@code exp}
     */
    ClaimSet verify(String token);
}
