package com.rls.scoped.auth;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import com.rls.scoped.auth.issuer.Token;

/**
 * Wraps a remote client so that every operation runs under a currently valid token.
 *
 * <p>Each call first obtains a token from the {@link TokenRefreshCoordinator}, pushes it into the client if it
 * is newer than the one the client already holds, and then forwards the call. Results and exceptions of the
 * call pass through untouched; nothing here retries the remote operation.
 */
public final class ScopedSession<C extends CredentialedClient> implements AutoCloseable {

    private final TokenRefreshCoordinator coordinator;
    private final C client;
    private final BackgroundTokenRefresher backgroundRefresher;

    private final Object credentialLock = new Object();
    private Token applied;

    /**
     * @param appliedToken the token {@code client} was constructed with
     * @param backgroundRefresher optional, closed together with the session
     */
    public ScopedSession(TokenRefreshCoordinator coordinator, C client, Token appliedToken,
                         BackgroundTokenRefresher backgroundRefresher) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.client = Objects.requireNonNull(client, "client");
        this.applied = Objects.requireNonNull(appliedToken, "appliedToken");
        this.backgroundRefresher = backgroundRefresher;
    }

    public <R, E extends Exception> R execute(RemoteCall<? super C, R, E> call) throws E {
        applyCredential(coordinator.getValidToken());
        return call.call(client);
    }

    /**
     * The call starts only once the credential step, including any refresh in flight, has completed.
     * If that step fails the returned future fails with the {@code TokenException} and the client is not touched.
     */
    public <R> CompletableFuture<R> executeAsync(Function<? super C, ? extends CompletionStage<R>> call) {
        return coordinator.getValidTokenAsync().thenCompose(token -> {
            applyCredential(token);
            return call.apply(client);
        });
    }

    /**
     * A currently valid token, refreshed first if needed.
     */
    public Token token() {
        return coordinator.getValidToken();
    }

    public RefreshState state() {
        return coordinator.state();
    }

    public String subject() {
        return coordinator.subject();
    }

    @Override
    public void close() {
        if (backgroundRefresher != null) {
            backgroundRefresher.close();
        }
        coordinator.discard();
    }

    private void applyCredential(Token token) {
        synchronized (credentialLock) {
            // a slow caller must not put back a token older than what another caller already applied
            if (!token.expiresAt().isAfter(applied.expiresAt())) {
                return;
            }
            client.applyBearerToken(token.value());
            applied = token;
        }
    }
}
