package com.rls.scoped.auth;

/**
 * One operation against the wrapped remote client.
 *
 * @param <E> checked exception the operation may throw, passed through to the caller unchanged
 */
@FunctionalInterface
public interface RemoteCall<C, R, E extends Exception> {

    R call(C client) throws E;
}
