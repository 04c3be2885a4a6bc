package com.rls.scoped.auth.issuer.error;

/**
 * Signing, issuance or verification failure.
 */
public class TokenException extends ScopedAuthException {

    private static final long serialVersionUID = 1L;

    public TokenException(String message) {
        super(message);
    }

    public TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
