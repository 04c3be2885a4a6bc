package com.rls.scoped.auth;

/**
 * A remote client that authenticates with a bearer token which can be swapped after construction.
 */
public interface CredentialedClient {

    void applyBearerToken(String token);
}
