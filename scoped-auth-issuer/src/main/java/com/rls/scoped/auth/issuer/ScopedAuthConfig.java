package com.rls.scoped.auth.issuer;

import java.net.URI;
import java.util.Map;

import com.rls.scoped.auth.issuer.error.ConfigurationException;

import lombok.Builder;
import lombok.Getter;

/**
 * Endpoint and secrets shared by every session built from it.
 * Immutable once built; {@link #toString()} never prints the secrets.
 */
@Getter
public final class ScopedAuthConfig {

    public static final String ENV_SERVICE_URL = "SUPABASE_URL";
    public static final String ENV_API_KEY = "SUPABASE_KEY";
    public static final String ENV_JWT_SECRET = "SUPABASE_JWT_SECRET";

    private final String serviceUrl;
    private final String apiKey;
    private final String jwtSecret;

    @Builder
    private ScopedAuthConfig(String serviceUrl, String apiKey, String jwtSecret) {
        this.serviceUrl = validUrl(serviceUrl);
        this.apiKey = nonBlank("apiKey", apiKey);
        this.jwtSecret = nonBlank("jwtSecret", jwtSecret);
    }

    public static ScopedAuthConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ScopedAuthConfig fromEnvironment(Map<String, String> env) {
        return ScopedAuthConfig.builder()
            .serviceUrl(env.get(ENV_SERVICE_URL))
            .apiKey(env.get(ENV_API_KEY))
            .jwtSecret(env.get(ENV_JWT_SECRET))
            .build();
    }

    /**
     * Value of the {@code iss} claim the backend's auth service would put in its own tokens.
     */
    public String issuerUrl() {
        return serviceUrl + "/auth/v1";
    }

    @Override
    public String toString() {
        return "ScopedAuthConfig(serviceUrl=" + serviceUrl + ", apiKey=****, jwtSecret=****)";
    }

    private static String nonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(field, "cannot be empty");
        }
        return value;
    }

    private static String validUrl(String value) {
        String url = nonBlank("serviceUrl", value).trim();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("serviceUrl", "is not a valid URL");
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme) || uri.getHost() == null) {
            throw new ConfigurationException("serviceUrl", "must be an absolute http(s) URL");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
