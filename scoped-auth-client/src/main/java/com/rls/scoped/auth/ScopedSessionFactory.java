package com.rls.scoped.auth;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;

import com.rls.scoped.auth.issuer.HmacScopedTokenIssuer;
import com.rls.scoped.auth.issuer.ScopedAuthConfig;
import com.rls.scoped.auth.issuer.Token;
import com.rls.scoped.auth.issuer.TokenIssuer;
import com.rls.scoped.auth.issuer.error.ClientException;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point: opens user-scoped sessions, or mints a single token for short-lived use.
 * Sessions opened here share nothing but the config and the issuer; each has its own token and lock.
 */
@Slf4j
public final class ScopedSessionFactory {

    private final ScopedAuthConfig config;
    private final TokenIssuer issuer;
    private final Clock clock;
    private final Executor executor;
    private final HttpClient httpClient;

    public ScopedSessionFactory(ScopedAuthConfig config) {
        this(config, new HmacScopedTokenIssuer(config), Clock.systemUTC(), ForkJoinPool.commonPool(),
            HttpClient.newHttpClient());
    }

    public ScopedSessionFactory(ScopedAuthConfig config, TokenIssuer issuer, Clock clock, Executor executor,
                                HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * One token, no refresh. Suited to work that finishes well within {@code options.validity}.
     */
    public Token mintToken(ScopedSessionOptions options) {
        requireSubject(options);
        return issuer.issue(options.getSubject(), options.getRole(), options.getCustomClaims(),
            options.getValidity(), clock.instant());
    }

    /**
     * @param clientFactory builds the remote client from the initial token string
     */
    public <C extends CredentialedClient> ScopedSession<C> open(ScopedSessionOptions options,
                                                                Function<String, C> clientFactory) {
        requireSubject(options);
        Objects.requireNonNull(clientFactory, "clientFactory");

        TokenRefreshCoordinator coordinator = new TokenRefreshCoordinator(issuer, options, clock, executor);
        Token initial = coordinator.currentToken();
        C client = Objects.requireNonNull(clientFactory.apply(initial.value()), "clientFactory returned null");

        BackgroundTokenRefresher refresher = options.getBackgroundRefreshInterval() == null
            ? null
            : new BackgroundTokenRefresher(coordinator, options.getBackgroundRefreshInterval());
        log.debug("Opened scoped session, token expires at {}, background refresh {}",
            initial.expiresAt(), refresher == null ? "off" : "every " + options.getBackgroundRefreshInterval());
        return new ScopedSession<>(coordinator, client, initial, refresher);
    }

    public ScopedSession<RestDataClient> openRest(ScopedSessionOptions options) {
        URI serviceUrl = URI.create(config.getServiceUrl());
        return open(options, token -> new RestDataClient(httpClient, serviceUrl, config.getApiKey(), token));
    }

    private static void requireSubject(ScopedSessionOptions options) {
        Objects.requireNonNull(options, "options");
        if (options.getSubject() == null || options.getSubject().isBlank()) {
            throw new ClientException("subject cannot be empty");
        }
    }
}
