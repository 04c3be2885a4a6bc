package com.rls.scoped.auth.issuer.error;

/**
 * Malformed input to claim building or session options. Never retried.
 */
public class ValidationException extends ScopedAuthException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }
}
