package com.rls.scoped.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import com.rls.scoped.auth.issuer.Token;
import com.rls.scoped.auth.issuer.TokenIssuer;
import com.rls.scoped.auth.issuer.error.ClientException;
import com.rls.scoped.auth.issuer.error.ScopedAuthException;
import com.rls.scoped.auth.issuer.error.TokenException;
import com.rls.scoped.auth.issuer.error.ValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the current token of one session and re-issues it lazily once it is within the refresh threshold
 * of expiry.
 *
 * <p>At most one re-issuance runs at a time. The first caller to see a stale token starts it; everyone
 * arriving while it runs waits on the same future and gets the same token or the same failure. A failed
 * re-issuance leaves the old token in place, so the next call tries again.
 */
@Slf4j
public final class TokenRefreshCoordinator implements AutoCloseable {

    private final TokenIssuer issuer;
    private final ScopedSessionOptions options;
    private final Clock clock;
    private final Executor executor;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private Token current;
    private CompletableFuture<Token> inFlight;
    private boolean discarded;

    /**
     * Mints the initial token right away.
     *
     * @param executor runs re-issuance started from {@link #getValidTokenAsync()}
     */
    public TokenRefreshCoordinator(TokenIssuer issuer, ScopedSessionOptions options, Clock clock, Executor executor) {
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Objects.requireNonNull(executor, "executor");
        checkTiming(options.getValidity(), options.getRefreshThreshold());
        this.current = issue();
    }

    /**
     * Returns a token whose remaining lifetime exceeds the refresh threshold, re-issuing first if needed.
     *
     * @throws ClientException if the session was discarded
     * @throws TokenException if the re-issuance this call waited on failed
     */
    public Token getValidToken() {
        Ticket ticket = acquire();
        if (ticket.fresh() != null) {
            return ticket.fresh();
        }
        if (ticket.initiator()) {
            refresh(ticket.flight());
        }
        return await(ticket.flight());
    }

    /**
     * Non-blocking variant of {@link #getValidToken()}. Waiters attach to the shared in-flight future;
     * the re-issuance itself runs on this coordinator's executor.
     */
    public CompletableFuture<Token> getValidTokenAsync() {
        Ticket ticket;
        try {
            ticket = acquire();
        } catch (ClientException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (ticket.fresh() != null) {
            return CompletableFuture.completedFuture(ticket.fresh());
        }
        if (ticket.initiator()) {
            CompletableFuture<Token> flight = ticket.flight();
            try {
                executor.execute(() -> refresh(flight));
            } catch (RejectedExecutionException e) {
                fail(flight, new TokenException("token refresh could not be scheduled", e));
            }
        }
        // a copy, so one caller cancelling cannot complete the shared future for everyone else
        return ticket.flight().copy();
    }

    public RefreshState state() {
        lock.lock();
        try {
            if (discarded) {
                return RefreshState.DISCARDED;
            }
            if (inFlight != null) {
                return RefreshState.REFRESHING;
            }
            return isFresh(current) ? RefreshState.FRESH : RefreshState.STALE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The token held right now, without any freshness check.
     */
    public Token currentToken() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    public String subject() {
        return options.getSubject();
    }

    /**
     * Makes the session unusable. A re-issuance already running is left to finish.
     */
    public void discard() {
        lock.lock();
        try {
            if (discarded) {
                return;
            }
            discarded = true;
        } finally {
            lock.unlock();
        }
        log.debug("Discarded scoped token session");
    }

    public boolean isDiscarded() {
        lock.lock();
        try {
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        discard();
    }

    private Ticket acquire() {
        lock.lock();
        try {
            if (discarded) {
                throw new ClientException("scoped session already discarded");
            }
            if (isFresh(current)) {
                return new Ticket(current, null, false);
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                return new Ticket(null, inFlight, true);
            }
            return new Ticket(null, inFlight, false);
        } finally {
            lock.unlock();
        }
    }

    private void refresh(CompletableFuture<Token> flight) {
        log.debug("Refreshing stale scoped token");
        Token fresh;
        try {
            fresh = issue();
        } catch (TokenException e) {
            fail(flight, e);
            return;
        } catch (RuntimeException e) {
            fail(flight, new TokenException("token refresh failed", e));
            return;
        } catch (Error e) {
            fail(flight, new TokenException("token refresh failed", e));
            throw e;
        }

        lock.lock();
        try {
            current = fresh;
            inFlight = null;
        } finally {
            lock.unlock();
        }
        log.debug("Refreshed scoped token, now expires at {}", fresh.expiresAt());
        flight.complete(fresh);
    }

    private void fail(CompletableFuture<Token> flight, TokenException failure) {
        lock.lock();
        try {
            inFlight = null;
        } finally {
            lock.unlock();
        }
        log.warn("Failed to refresh scoped token", failure);
        flight.completeExceptionally(failure);
    }

    private Token issue() {
        return issuer.issue(
            options.getSubject(),
            options.getRole(),
            options.getCustomClaims(),
            options.getValidity(),
            clock.instant()
        );
    }

    private boolean isFresh(Token token) {
        return token.remaining(clock.instant()).compareTo(options.getRefreshThreshold()) > 0;
    }

    private static Token await(CompletableFuture<Token> flight) {
        try {
            return flight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ScopedAuthException failure) {
                throw failure;
            }
            throw new TokenException("token refresh failed", e.getCause());
        }
    }

    private static void checkTiming(Duration validity, Duration threshold) {
        if (validity == null || threshold == null) {
            throw new ValidationException("validity and refresh threshold are required");
        }
        if (threshold.isNegative()) {
            throw new ValidationException("refresh threshold cannot be negative, got " + threshold);
        }
        // tokens carry whole seconds only
        Duration effective = Duration.ofSeconds(validity.getSeconds());
        if (threshold.compareTo(effective) >= 0) {
            throw new ValidationException("refresh threshold " + threshold + " must be shorter than validity " + effective);
        }
    }

    private record Ticket(Token fresh, CompletableFuture<Token> flight, boolean initiator) {}
}
