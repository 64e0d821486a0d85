package io.tombwatch.cluster;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.tombwatch.model.DeleteOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

final class HttpClusterQueryTest {
    private HttpServer server;
    private String baseUrl;
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private volatile String statsBody = "{\"active_nodes\":3,\"total_files\":42,\"total_checksums\":40,\"ring_size\":300,\"status\":\"ok\"}";
    private volatile int statsStatus = 200;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/delete", exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            queries.add(query);
            if (!query.contains("secret=admin888")) {
                respond(exchange, 401, "Unauthorized");
            } else if (query.contains("name=missing.mp4")) {
                respond(exchange, 404, "Not Found");
            } else {
                respond(exchange, 200, "OK:2");
            }
        });
        server.createContext("/stats", exchange -> respond(exchange, statsStatus, statsBody));
        server.createContext("/health", exchange -> respond(exchange, 200, "OK"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void deleteReportsStatusAndBody() {
        HttpClusterQuery query = new HttpClusterQuery(baseUrl, 5_000L);

        DeleteOutcome ok = query.deleteFile("test movie.mp4", "admin888");
        Assertions.assertTrue(ok.accepted());
        Assertions.assertEquals("OK:2", ok.response());
        Assertions.assertTrue(queries.get(0).startsWith("name=test+movie.mp4&secret="));

        DeleteOutcome denied = query.deleteFile("a.mp4", "wrong");
        Assertions.assertEquals(401, denied.status());
        Assertions.assertFalse(denied.accepted());

        DeleteOutcome missing = query.deleteFile("missing.mp4", "admin888");
        Assertions.assertEquals(404, missing.status());
    }

    @Test
    void deleteNeverThrowsOnTransportFailure() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        HttpClusterQuery query = new HttpClusterQuery("http://127.0.0.1:" + port, 1_000L);

        DeleteOutcome outcome = query.deleteFile("a.mp4", "admin888");

        Assertions.assertEquals(DeleteOutcome.TRANSPORT_ERROR, outcome.status());
        Assertions.assertFalse(outcome.accepted());
        Assertions.assertNotNull(outcome.error());
        Assertions.assertFalse(query.health());
        Assertions.assertThrows(ClusterUnavailableException.class, query::getStats);
    }

    @Test
    void statsKeepNumericFieldsOnly() throws Exception {
        HttpClusterQuery query = new HttpClusterQuery(baseUrl, 5_000L);

        Map<String, Long> stats = query.getStats();

        Assertions.assertEquals(42L, stats.get(ClusterQueryPort.TOTAL_FILES));
        Assertions.assertEquals(3L, stats.get(ClusterQueryPort.ACTIVE_NODES));
        Assertions.assertFalse(stats.containsKey("status"));
        Assertions.assertTrue(query.health());
    }

    @Test
    void statsFailuresAreUnavailable() {
        HttpClusterQuery query = new HttpClusterQuery(baseUrl, 5_000L);

        statsStatus = 503;
        Assertions.assertThrows(ClusterUnavailableException.class, query::getStats);

        statsStatus = 200;
        statsBody = "<html>busy</html>";
        Assertions.assertThrows(ClusterUnavailableException.class, query::getStats);

        statsBody = "[1,2,3]";
        Assertions.assertThrows(ClusterUnavailableException.class, query::getStats);
    }

    @Test
    void baseUrlIsNormalized() {
        Assertions.assertEquals("http://localhost:8080", new HttpClusterQuery("http://localhost:8080//", 1_000L).baseUrl());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HttpClusterQuery(" ", 1_000L));
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
