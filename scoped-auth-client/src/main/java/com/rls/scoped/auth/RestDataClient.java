package com.rls.scoped.auth;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Minimal client for a PostgREST-style data API. Every request carries the project API key and the
 * current user token; row-level-security policies on the backend see the token's claims.
 */
public final class RestDataClient implements CredentialedClient {

    private static final String REST_PATH = "/rest/v1/";

    private final HttpClient http;
    private final String restBase;
    private final String apiKey;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;
    private volatile String bearerToken;

    public RestDataClient(HttpClient http, URI serviceUrl, String apiKey, String bearerToken) {
        this(http, serviceUrl, apiKey, bearerToken,
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false),
            Duration.ofSeconds(10));
    }

    public RestDataClient(HttpClient http, URI serviceUrl, String apiKey, String bearerToken,
                          ObjectMapper mapper, Duration requestTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        String base = Objects.requireNonNull(serviceUrl, "serviceUrl").toString();
        this.restBase = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + REST_PATH;
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.bearerToken = Objects.requireNonNull(bearerToken, "bearerToken");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public void applyBearerToken(String token) {
        this.bearerToken = Objects.requireNonNull(token, "token");
    }

    /**
     * {@code GET /rest/v1/{table}?{query}}, where {@code query} is a raw PostgREST filter string such as
     * {@code select=id,name&owner_id=eq.42}. Values in it must already be percent-encoded.
     *
     * @throws DataApiException also when {@code query} does not form a valid URI
     */
    public JsonNode select(String table, String query) {
        String uri = restBase + pathSegment(table) + (query == null || query.isBlank() ? "" : "?" + query);
        return send(request(uri).GET());
    }

    public JsonNode insert(String table, Object rows) {
        return send(request(restBase + pathSegment(table))
            .header("Content-Type", "application/json")
            .header("Prefer", "return=representation")
            .POST(HttpRequest.BodyPublishers.ofByteArray(toJson(rows))));
    }

    public JsonNode rpc(String function, Map<String, ?> params) {
        return send(request(restBase + "rpc/" + pathSegment(function))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(toJson(params == null ? Map.of() : params))));
    }

    private HttpRequest.Builder request(String uri) {
        URI target;
        try {
            target = URI.create(uri);
        } catch (IllegalArgumentException e) {
            throw new DataApiException("Invalid request URI " + uri, e);
        }
        return HttpRequest.newBuilder(target)
            .timeout(requestTimeout)
            .header("apikey", apiKey)
            .header("Authorization", "Bearer " + bearerToken)
            .header("Accept", "application/json");
    }

    private JsonNode send(HttpRequest.Builder builder) {
        HttpRequest req = builder.build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int sc = resp.statusCode();
            if (sc < 200 || sc >= 300) {
                throw new DataApiException(sc, resp.body());
            }
            String body = resp.body();
            return body == null || body.isBlank() ? mapper.nullNode() : mapper.readTree(body);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DataApiException("Interrupted while calling " + req.uri().getPath(), ie);
        } catch (IOException e) {
            throw new DataApiException("Failed to call " + req.uri().getPath(), e);
        }
    }

    private byte[] toJson(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable to JSON", e);
        }
    }

    private static String pathSegment(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("table or function name cannot be empty");
        }
        return URLEncoder.encode(name, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
