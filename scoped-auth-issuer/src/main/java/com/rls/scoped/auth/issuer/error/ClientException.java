package com.rls.scoped.auth.issuer.error;

/**
 * Misuse by the calling code: an empty subject, or a discarded session.
 */
public class ClientException extends ScopedAuthException {

    private static final long serialVersionUID = 1L;

    public ClientException(String message) {
        super(message);
    }
}
