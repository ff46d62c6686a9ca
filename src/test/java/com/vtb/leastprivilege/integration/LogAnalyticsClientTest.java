package com.vtb.leastprivilege.integration;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.vtb.leastprivilege.collector.ActivityQueryResult;
import com.vtb.leastprivilege.collector.QueryErrorKind;
import com.vtb.leastprivilege.config.AnalyzerConfig;
import com.vtb.leastprivilege.models.ActivityWindow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LogAnalyticsClientTest {

    private static final ActivityWindow WINDOW = ActivityWindow.builder()
        .start(Instant.parse("2024-05-01T00:00:00Z"))
        .end(Instant.parse("2024-05-31T00:00:00Z"))
        .maxEntries(500)
        .build();

    private HttpServer server;
    private StubHandler handler;
    private LogAnalyticsClient client;

    @BeforeEach
    void setUp() throws Exception {
        handler = new StubHandler();
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/workspaces/ws-1/query", handler);
        server.start();

        AnalyzerConfig.LogAnalytics settings = AnalyzerConfig.defaults().getLogAnalytics();
        settings.setEndpoint("http://localhost:" + server.getAddress().getPort());
        settings.setTimeoutSec(5);
        client = new LogAnalyticsClient(settings, "ws-1", () -> "test-token");
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void parsesRowsOfSuccessfulResponse() {
        handler.respond(200, """
            {"tables":[{"name":"PrimaryResult",
              "columns":[{"name":"RequestMethod","type":"string"},{"name":"CleanUri","type":"string"}],
              "rows":[["GET","https://graph.microsoft.com/v1.0/users"],
                      ["PATCH","https://graph.microsoft.com/v1.0/users/1"]]}]}
            """);

        ActivityQueryResult result = client.query("sp-1", WINDOW);

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(2, result.getActivities().size());
        assertEquals("PATCH", result.getActivities().get(1).getMethod());
        assertEquals("https://graph.microsoft.com/v1.0/users/1", result.getActivities().get(1).getUri());

        assertEquals("Bearer test-token", handler.authorization);
        assertTrue(handler.requestBody.contains("ServicePrincipalId == 'sp-1'"), handler.requestBody);
        assertTrue(handler.requestBody.contains("take 500"));
        assertTrue(handler.requestBody.contains("2024-05-01T00:00:00Z/2024-05-31T00:00:00Z"));
    }

    @Test
    void responseSizeErrorIsSizeExceeded() {
        handler.respond(400, """
            {"error":{"code":"BadArgumentError","message":"Query result too large",
              "innererror":{"code":"ResponseSizeError","message":"Response size too large"}}}
            """);

        ActivityQueryResult result = client.query("sp-1", WINDOW);

        assertEquals(QueryErrorKind.SIZE_EXCEEDED, result.getErrorKind());
    }

    @Test
    void partialErrorWithSuccessStatusIsSizeExceeded() {
        handler.respond(200, """
            {"tables":[],"error":{"code":"PartialError","message":"partial",
              "details":[{"code":"E_QUERY_RESULT_SET_TOO_LARGE","message":"too many records"}]}}
            """);

        ActivityQueryResult result = client.query("sp-1", WINDOW);

        assertEquals(QueryErrorKind.SIZE_EXCEEDED, result.getErrorKind());
    }

    @Test
    void forbiddenIsOtherError() {
        handler.respond(403, """
            {"error":{"code":"InsufficientAccessError","message":"The provided credentials have insufficient access"}}
            """);

        ActivityQueryResult result = client.query("sp-1", WINDOW);

        assertEquals(QueryErrorKind.OTHER, result.getErrorKind());
        assertTrue(result.getMessage().contains("403"), result.getMessage());
        assertTrue(result.getMessage().contains("InsufficientAccessError"));
    }

    @Test
    void nonJsonServerErrorIsOtherError() {
        handler.respond(500, "<html>Internal Server Error</html>");

        ActivityQueryResult result = client.query("sp-1", WINDOW);

        assertEquals(QueryErrorKind.OTHER, result.getErrorKind());
        assertTrue(result.getMessage().contains("500"));
    }

    @Test
    void invalidPrincipalIdIsRejectedWithoutRequest() {
        ActivityQueryResult result = client.query("sp-1' or 1==1 //", WINDOW);

        assertEquals(QueryErrorKind.OTHER, result.getErrorKind());
        assertEquals(0, handler.calls.get(), "Запрос не должен уходить в Log Analytics");
    }

    @Test
    void buildsDistinctSuccessfulCallsQuery() {
        String query = client.buildQuery("sp-1", WINDOW);

        assertTrue(query.startsWith("MicrosoftGraphActivityLogs"));
        assertTrue(query.contains("ResponseStatusCode >= 200 and ResponseStatusCode < 300"));
        assertTrue(query.contains("| distinct RequestMethod, CleanUri"));
    }

    private static class StubHandler implements HttpHandler {
        private final AtomicInteger calls = new AtomicInteger();
        private volatile int status = 200;
        private volatile String body = "{}";
        private volatile String authorization;
        private volatile String requestBody;

        void respond(int status, String body) {
            this.status = status;
            this.body = body;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            calls.incrementAndGet();
            authorization = exchange.getRequestHeaders().getFirst("Authorization");
            requestBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);

            byte[] response = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }
    }
}
