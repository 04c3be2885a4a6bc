package com.rls.scoped.auth;

import java.time.Duration;
import java.util.Map;

import com.rls.scoped.auth.issuer.ClaimBuilder;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-session token parameters. {@code backgroundRefreshInterval} is null unless proactive refresh is wanted.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class ScopedSessionOptions {

    public static final Duration DEFAULT_VALIDITY = Duration.ofHours(1);
    public static final Duration DEFAULT_REFRESH_THRESHOLD = Duration.ofSeconds(60);

    private final String subject;

    @Builder.Default
    private final String role = ClaimBuilder.DEFAULT_ROLE;

    @Builder.Default
    private final Map<String, ?> customClaims = Map.of();

    @Builder.Default
    private final Duration validity = DEFAULT_VALIDITY;

    @Builder.Default
    private final Duration refreshThreshold = DEFAULT_REFRESH_THRESHOLD;

    private final Duration backgroundRefreshInterval;

    public static ScopedSessionOptions forSubject(String subject) {
        return builder().subject(subject).build();
    }
}
