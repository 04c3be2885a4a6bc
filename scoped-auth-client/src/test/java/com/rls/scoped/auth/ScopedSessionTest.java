package com.rls.scoped.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rls.scoped.auth.issuer.Token;
import com.rls.scoped.auth.issuer.error.ClientException;
import com.rls.scoped.auth.issuer.error.TokenException;

@ExtendWith(MockitoExtension.class)
class ScopedSessionTest {

    private static final Instant T0 = Instant.parse("2026-01-16T10:00:00Z");

    interface InventoryClient extends CredentialedClient {

        List<String> listItems() throws IOException;

        CompletableFuture<Integer> countItems();
    }

    @Mock
    private InventoryClient client;

    private final MutableClock clock = new MutableClock(T0);
    private final ScriptedIssuer issuer = new ScriptedIssuer(clock);
    private final AtomicReference<String> constructedWith = new AtomicReference<>();
    private ScopedSession<InventoryClient> session;

    @BeforeEach
    void setUp() {
        ScopedSessionFactory factory = new ScopedSessionFactory(ScriptedIssuer.CONFIG, issuer, clock, Runnable::run,
            HttpClient.newHttpClient());
        ScopedSessionOptions options = ScopedSessionOptions.builder()
            .subject("u1")
            .role("authenticated")
            .validity(Duration.ofSeconds(3600))
            .refreshThreshold(Duration.ofSeconds(60))
            .build();
        session = factory.open(options, token -> {
            constructedWith.set(token);
            return client;
        });
    }

    @Test
    void clientIsBuiltWithTheInitialToken() {
        Token initial = session.token();

        assertEquals(constructedWith.get(), initial.value());
        assertEquals(initial.claims(), issuer.verify(constructedWith.get()));
        assertEquals("u1", initial.claims().subject());
        assertEquals("authenticated", initial.claims().role());
        assertEquals(T0.getEpochSecond() + 3600, initial.claims().expiresAt());
    }

    @Test
    void forwardsWithoutRefreshWhileFresh() throws IOException {
        when(client.listItems()).thenReturn(List.of("apple"));
        clock.set(T0.plusSeconds(10));

        assertEquals(List.of("apple"), session.execute(InventoryClient::listItems));

        verify(client, never()).applyBearerToken(anyString());
        assertEquals(1, issuer.calls());
    }

    @Test
    void refreshesAndAppliesCredentialBeforeForwarding() throws IOException {
        when(client.listItems()).thenReturn(List.of("apple"));
        clock.set(T0.plusSeconds(3590));

        session.execute(InventoryClient::listItems);

        Token refreshed = session.token();
        assertEquals(T0.plusSeconds(3590 + 3600), refreshed.expiresAt());
        InOrder order = inOrder(client);
        order.verify(client).applyBearerToken(refreshed.value());
        order.verify(client).listItems();
        assertEquals(2, issuer.calls());
        assertEquals(RefreshState.FRESH, session.state());
    }

    @Test
    void appliesEachNewCredentialOnlyOnce() throws IOException {
        clock.set(T0.plusSeconds(3590));

        session.execute(InventoryClient::listItems);
        session.execute(InventoryClient::listItems);

        verify(client).applyBearerToken(anyString());
    }

    @Test
    void remoteErrorsPassThroughUnchanged() throws IOException {
        IOException failure = new IOException("connection reset");
        when(client.listItems()).thenThrow(failure);

        assertSame(failure, assertThrows(IOException.class, () -> session.execute(InventoryClient::listItems)));
        verify(client).listItems();
    }

    @Test
    void refreshFailureStopsBeforeTheRemoteCall() throws IOException {
        clock.set(T0.plusSeconds(3590));
        issuer.failNext(new TokenException("signing failed"));

        assertThrows(TokenException.class, () -> session.execute(InventoryClient::listItems));

        verify(client, never()).listItems();
        verify(client, never()).applyBearerToken(anyString());
        assertEquals(RefreshState.STALE, session.state());
    }

    @Test
    void asyncCallRunsAfterCredentialRefresh() throws Exception {
        when(client.countItems()).thenReturn(CompletableFuture.completedFuture(3));
        clock.set(T0.plusSeconds(3590));

        assertEquals(3, session.executeAsync(InventoryClient::countItems).get());

        InOrder order = inOrder(client);
        order.verify(client).applyBearerToken(anyString());
        order.verify(client).countItems();
    }

    @Test
    void asyncRefreshFailureNeverReachesClient() {
        clock.set(T0.plusSeconds(3590));
        issuer.failNext(new TokenException("signing failed"));

        CompletableFuture<Integer> result = session.executeAsync(InventoryClient::countItems);

        ExecutionException ex = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(TokenException.class, ex.getCause());
        verify(client, never()).countItems();
    }

    @Test
    void closedSessionRejectsCalls() throws IOException {
        session.close();

        assertEquals(RefreshState.DISCARDED, session.state());
        assertThrows(ClientException.class, () -> session.execute(InventoryClient::listItems));
        verify(client, never()).listItems();
    }

    @Test
    void sessionsForTheSameSubjectAreIndependent() {
        ScopedSessionFactory factory = new ScopedSessionFactory(ScriptedIssuer.CONFIG, issuer, clock, Runnable::run,
            HttpClient.newHttpClient());
        clock.set(T0.plusSeconds(100));
        ScopedSession<InventoryClient> other = factory.open(
            ScopedSessionOptions.builder().subject("u1").customClaims(Map.of("tenant_id", "other")).build(),
            token -> client);

        assertEquals(T0.plusSeconds(3700), other.token().expiresAt());
        other.close();

        assertEquals(RefreshState.DISCARDED, other.state());
        assertEquals(RefreshState.FRESH, session.state());
        assertEquals(T0.plusSeconds(3600), session.token().expiresAt());
    }
}
