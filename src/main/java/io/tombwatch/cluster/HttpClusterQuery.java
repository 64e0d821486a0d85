package io.tombwatch.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import io.tombwatch.model.DeleteOutcome;
import io.tombwatch.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

public final class HttpClusterQuery implements ClusterQueryPort {
    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient http;
    private final Clock clock;

    public HttpClusterQuery(String baseUrl, long requestTimeoutMs) {
        this(baseUrl, requestTimeoutMs, Clock.systemUTC());
    }

    public HttpClusterQuery(String baseUrl, long requestTimeoutMs, Clock clock) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("coordinator base url cannot be empty");
        }
        String value = baseUrl.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        this.baseUrl = value;
        this.requestTimeout = Duration.ofMillis(Math.max(500L, requestTimeoutMs));
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .proxy(HttpClient.Builder.NO_PROXY)
                .build();
        this.clock = clock;
    }

    @Override
    public DeleteOutcome deleteFile(String name, String credential) {
        String url = baseUrl + "/delete?name=" + encode(name) + "&secret=" + encode(credential);
        try {
            HttpResponse<String> resp = send(url, requestTimeout);
            return DeleteOutcome.answered(name, resp.statusCode(), resp.body(), clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeleteOutcome.transportFailure(name, "interrupted", clock.instant());
        } catch (IOException | RuntimeException e) {
            return DeleteOutcome.transportFailure(name, describe(e), clock.instant());
        }
    }

    @Override
    public Map<String, Long> getStats() throws ClusterUnavailableException {
        HttpResponse<String> resp;
        try {
            resp = send(baseUrl + "/stats", requestTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterUnavailableException("stats request interrupted", e);
        } catch (IOException | RuntimeException e) {
            throw new ClusterUnavailableException("stats request failed: " + describe(e), e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new ClusterUnavailableException("stats request failed status=" + resp.statusCode());
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(resp.body());
        } catch (IOException e) {
            throw new ClusterUnavailableException("stats response is not JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ClusterUnavailableException("stats response is not a JSON object");
        }
        Map<String, Long> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isNumber()) {
                out.put(entry.getKey(), entry.getValue().asLong());
            }
        }
        return out;
    }

    @Override
    public boolean health() {
        try {
            return send(baseUrl + "/health", requestTimeout).statusCode() == 200;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }

    public String baseUrl() {
        return baseUrl;
    }

    private HttpResponse<String> send(String url, Duration timeout) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private static String encode(String raw) {
        return URLEncoder.encode(raw == null ? "" : raw, StandardCharsets.UTF_8);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
