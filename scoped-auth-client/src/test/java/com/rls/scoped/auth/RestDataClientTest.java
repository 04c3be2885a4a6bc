package com.rls.scoped.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

class RestDataClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private URI baseUri;
    private final List<String> authorizations = new CopyOnWriteArrayList<>();
    private final List<String> requestBodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/rest/v1/items", exchange -> {
            record(exchange);
            if ("POST".equals(exchange.getRequestMethod())) {
                assertEquals("return=representation", exchange.getRequestHeaders().getFirst("Prefer"));
                respond(exchange, 201, "[{\"id\":2,\"name\":\"pear\"}]");
            } else {
                assertEquals("select=id,name&owner_id=eq.u1", exchange.getRequestURI().getRawQuery());
                respond(exchange, 200, "[{\"id\":1,\"name\":\"apple\"}]");
            }
        });
        server.createContext("/rest/v1/rpc/add_numbers", exchange -> {
            record(exchange);
            respond(exchange, 200, "5");
        });
        server.createContext("/rest/v1/secret_items", exchange -> {
            record(exchange);
            respond(exchange, 401, "{\"message\":\"JWT expired\"}");
        });
        server.createContext("/rest/v1/empty", exchange -> {
            record(exchange);
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void selectSendsApiKeyAndBearerToken() {
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), baseUri, "anon-key", "token-1");

        JsonNode rows = client.select("items", "select=id,name&owner_id=eq.u1");

        assertEquals("apple", rows.get(0).get("name").asText());
        assertEquals(List.of("Bearer token-1"), authorizations);
    }

    @Test
    void appliedTokenIsUsedByLaterRequests() {
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), URI.create(baseUri + "/"), "anon-key", "token-1");

        client.select("items", "select=id,name&owner_id=eq.u1");
        client.applyBearerToken("token-2");
        client.select("items", "select=id,name&owner_id=eq.u1");

        assertEquals(List.of("Bearer token-1", "Bearer token-2"), authorizations);
    }

    @Test
    void insertPostsJsonRows() throws IOException {
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), baseUri, "anon-key", "token-1");

        JsonNode created = client.insert("items", List.of(Map.of("name", "pear")));

        assertEquals(2, created.get(0).get("id").asInt());
        assertEquals("pear", MAPPER.readTree(requestBodies.get(0)).get(0).get("name").asText());
    }

    @Test
    void rpcPostsParameters() throws IOException {
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), baseUri, "anon-key", "token-1");

        JsonNode sum = client.rpc("add_numbers", Map.of("a", 2, "b", 3));

        assertEquals(5, sum.asInt());
        assertEquals(2, MAPPER.readTree(requestBodies.get(0)).get("a").asInt());
    }

    @Test
    void emptyResponseBodyIsNullNode() {
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), baseUri, "anon-key", "token-1");

        assertTrue(client.select("empty", null).isNull());
    }

    @Test
    void errorStatusBecomesDataApiException() {
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), baseUri, "anon-key", "token-1");

        DataApiException ex = assertThrows(DataApiException.class, () -> client.select("secret_items", ""));

        assertEquals(401, ex.getStatusCode());
        assertTrue(ex.getBody().contains("JWT expired"));
    }

    @Test
    void unreachableServerBecomesDataApiException() {
        server.stop(0);
        server = null;
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), baseUri, "anon-key", "token-1");

        DataApiException ex = assertThrows(DataApiException.class, () -> client.select("items", null));

        assertEquals(-1, ex.getStatusCode());
    }

    @Test
    void unencodedQueryBecomesDataApiException() {
        RestDataClient client = new RestDataClient(HttpClient.newHttpClient(), baseUri, "anon-key", "token-1");

        DataApiException ex = assertThrows(DataApiException.class, () -> client.select("items", "name=eq.green apple"));

        assertEquals(-1, ex.getStatusCode());
        assertTrue(authorizations.isEmpty());
    }

    private void record(HttpExchange exchange) throws IOException {
        assertEquals("anon-key", exchange.getRequestHeaders().getFirst("apikey"));
        authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
        requestBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
