package com.rls.scoped.auth.issuer.error;

/**
 * The token was not signed with our secret, or was altered after signing.
 */
public class InvalidSignatureException extends TokenException {

    private static final long serialVersionUID = 1L;

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
