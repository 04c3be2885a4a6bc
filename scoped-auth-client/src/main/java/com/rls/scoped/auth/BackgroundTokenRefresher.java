package com.rls.scoped.auth;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.rls.scoped.auth.issuer.error.ClientException;
import com.rls.scoped.auth.issuer.error.TokenException;

import lombok.extern.slf4j.Slf4j;

/**
 * Proactively keeps a session's token fresh. Goes through {@link TokenRefreshCoordinator#getValidToken()},
 * so it never races a caller-triggered refresh.
 */
@Slf4j
public class BackgroundTokenRefresher implements AutoCloseable {

    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "scoped-token-refresher");
        thread.setDaemon(true);
        return thread;
    });

    public BackgroundTokenRefresher(TokenRefreshCoordinator coordinator, Duration interval) {
        long millis = interval.toMillis();
        if (millis <= 0) {
            throw new IllegalArgumentException("background refresh interval must be positive, got " + interval);
        }
        ses.scheduleWithFixedDelay(() -> refreshIfNeeded(coordinator), millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }

    private void refreshIfNeeded(TokenRefreshCoordinator coordinator) {
        if (coordinator.isDiscarded()) {
            ses.shutdown();
            return;
        }
        try {
            coordinator.getValidToken();
        } catch (ClientException e) {
            log.debug("Session discarded, stopping background refresh");
            ses.shutdown();
        } catch (TokenException e) {
            // the coordinator stays STALE, so the next tick or caller retries
            log.warn("Background refresh of scoped token failed", e);
        }
    }
}
