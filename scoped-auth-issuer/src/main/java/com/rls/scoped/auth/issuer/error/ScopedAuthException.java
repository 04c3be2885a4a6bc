package com.rls.scoped.auth.issuer.error;

/**
 * Base type of every error raised by the scoped auth library.
 */
public class ScopedAuthException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ScopedAuthException(String message) {
        super(message);
    }

    public ScopedAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
