package io.stocktake.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.stocktake.error.StockTakeException;
import io.stocktake.model.NewSession;
import io.stocktake.model.SessionUpdate;
import io.stocktake.runtime.SessionCoordinator;
import io.stocktake.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON API over the JDK HTTP server. Reads are GET, writes are POST; parameters come
 * from the query string or a JSON/form body.
 */
public final class StockTakeWebServer {
    private static final Logger log = LoggerFactory.getLogger(StockTakeWebServer.class);

    private final SessionCoordinator coordinator;
    private final int defaultLimit;
    private HttpServer server;
    private ExecutorService executor;

    public StockTakeWebServer(SessionCoordinator coordinator, int defaultLimit) {
        this.coordinator = coordinator;
        this.defaultLimit = Math.max(1, defaultLimit);
    }

    /** Binds and starts serving; returns the bound port, which differs from {@code port} when 0. */
    public synchronized int start(String host, int port) throws IOException {
        if (server != null) {
            throw new IllegalStateException("web server already started");
        }
        HttpServer http = HttpServer.create(new InetSocketAddress(host, port), 0);
        http.createContext("/api/health", exchange -> handle(exchange, "GET", req -> Map.of(
                "status", "ok",
                "open_gates", coordinator.openGates(),
                "settings", coordinator.settings()
        )));
        http.createContext("/api/sessions", exchange -> handle(exchange, null, req -> {
            if ("POST".equals(req.method())) {
                return coordinator.createSession(readBody(req, NewSession.class));
            }
            return coordinator.listSessions(
                    req.param("branchId"),
                    req.param("status"),
                    clamp(parseIntOrDefault(req.param("limit"), defaultLimit), 1, 500)
            );
        }));
        http.createContext("/api/session", exchange -> handle(exchange, "GET", req -> {
            String code = req.param("code");
            if (code != null && !code.isBlank()) {
                return coordinator.getSessionByCode(code);
            }
            return coordinator.getSession(req.param("sessionId"));
        }));
        http.createContext("/api/sessions/start", exchange -> handle(exchange, "POST",
                req -> coordinator.startSession(req.param("sessionId"), req.param("actor"))));
        http.createContext("/api/sessions/pause", exchange -> handle(exchange, "POST",
                req -> coordinator.pauseSession(req.param("sessionId"), req.param("actor"))));
        http.createContext("/api/sessions/resume", exchange -> handle(exchange, "POST",
                req -> coordinator.resumeSession(req.param("sessionId"), req.param("actor"))));
        http.createContext("/api/sessions/complete", exchange -> handle(exchange, "POST",
                req -> coordinator.completeSession(req.param("sessionId"), req.param("actor"),
                        Boolean.parseBoolean(req.param("force")))));
        http.createContext("/api/sessions/cancel", exchange -> handle(exchange, "POST",
                req -> coordinator.cancelSession(req.param("sessionId"), req.param("actor"))));
        http.createContext("/api/sessions/update", exchange -> handle(exchange, "POST",
                req -> coordinator.updateSession(req.param("sessionId"), req.param("actor"),
                        readBody(req, SessionUpdate.class))));
        http.createContext("/api/sessions/join", exchange -> handle(exchange, "POST",
                req -> coordinator.joinSession(req.param("code"), req.param("counter"))));
        http.createContext("/api/locks", exchange -> handle(exchange, "GET",
                req -> coordinator.listLocks(req.param("sessionId"))));
        http.createContext("/api/locks/acquire", exchange -> handle(exchange, "POST",
                req -> coordinator.acquireLock(req.param("sessionId"), req.param("itemId"), req.param("counter"))));
        http.createContext("/api/locks/release", exchange -> handle(exchange, "POST",
                req -> coordinator.releaseLock(req.param("sessionId"), req.param("itemId"), req.param("counter"))));
        http.createContext("/api/counts", exchange -> handle(exchange, null, req -> {
            if ("POST".equals(req.method())) {
                return coordinator.submitCount(
                        req.param("sessionId"),
                        req.param("itemId"),
                        req.param("counter"),
                        parseQuantity(req.param("quantity")),
                        req.param("shelfLocation"),
                        req.param("notes")
                );
            }
            return coordinator.listCounts(
                    req.param("sessionId"),
                    req.param("counter"),
                    clamp(parseIntOrDefault(req.param("limit"), defaultLimit), 1, 1_000)
            );
        }));
        http.createContext("/api/progress", exchange -> handle(exchange, "GET",
                req -> coordinator.getProgress(req.param("sessionId"))));
        http.createContext("/api/variance-report", exchange -> handle(exchange, "GET",
                req -> coordinator.varianceReport(req.param("sessionId"))));
        http.createContext("/api/shelves", exchange -> handle(exchange, "GET",
                req -> coordinator.listShelves(req.param("sessionId"))));
        http.createContext("/api/shelves/counts", exchange -> handle(exchange, "GET",
                req -> coordinator.shelfCounts(req.param("sessionId"), req.param("shelf"))));
        http.createContext("/api/shelves/approve", exchange -> handle(exchange, "POST",
                req -> coordinator.approveShelf(req.param("sessionId"), req.param("shelf"), req.param("actor"))));
        http.createContext("/api/shelves/reject", exchange -> handle(exchange, "POST",
                req -> coordinator.rejectShelf(req.param("sessionId"), req.param("shelf"), req.param("actor"),
                        req.param("reason"))));
        executor = Executors.newFixedThreadPool(8, r -> {
            Thread t = new Thread(r, "stocktake-web");
            t.setDaemon(true);
            return t;
        });
        http.setExecutor(executor);
        http.start();
        server = http;
        int bound = http.getAddress().getPort();
        log.info("Stock take web API listening on {}:{}", host, bound);
        return bound;
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private void handle(HttpExchange exchange, String method, Route route) throws IOException {
        try {
            String actual = exchange.getRequestMethod() == null
                    ? ""
                    : exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            if (method != null && !method.equals(actual)) {
                exchange.getResponseHeaders().set("Allow", method);
                writeJson(exchange, Map.of("error", "method_not_allowed", "method", actual), 405);
                return;
            }
            if (method == null && !"GET".equals(actual) && !"POST".equals(actual)) {
                exchange.getResponseHeaders().set("Allow", "GET,POST");
                writeJson(exchange, Map.of("error", "method_not_allowed", "method", actual), 405);
                return;
            }
            Request req = parseRequest(exchange, actual);
            Object body = route.handle(req);
            writeJson(exchange, body, "POST".equals(actual) && exchange.getRequestURI().getPath().equals("/api/sessions")
                    ? 201
                    : 200);
        } catch (StockTakeException e) {
            writeJson(exchange, errorBody(e), e.kind().httpStatus());
        } catch (RuntimeException e) {
            log.error("Unhandled error on {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            writeJson(exchange, Map.of("error", "internal_error", "message", String.valueOf(e.getMessage())), 500);
        } finally {
            exchange.close();
        }
    }

    static Map<String, Object> errorBody(StockTakeException e) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", e.kind().name());
        out.put("message", e.getMessage());
        out.put("retryable", e.kind().retryable());
        out.put("details", e.details());
        return out;
    }

    /** Routing fields such as sessionId and actor share the body with the payload and are skipped. */
    private static <T> T readBody(Request req, Class<T> type) {
        if (req.json() == null || !req.json().isObject()) {
            throw StockTakeException.validation("expected a JSON object body");
        }
        try {
            return Jsons.mapper()
                    .readerFor(type)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(req.json());
        } catch (IOException | IllegalArgumentException e) {
            throw StockTakeException.validation("malformed request body: " + e.getMessage());
        }
    }

    private static long parseQuantity(String raw) {
        if (raw == null || raw.isBlank()) {
            throw StockTakeException.validation("quantity is required");
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw StockTakeException.validation("quantity must be a whole number: " + raw);
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Request parseRequest(HttpExchange exchange, String method) throws IOException {
        Map<String, String> params = new LinkedHashMap<>(parseQuery(exchange.getRequestURI()));
        if (!"POST".equals(method)) {
            return new Request(method, params, null);
        }
        byte[] raw = exchange.getRequestBody().readAllBytes();
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            return new Request(method, params, null);
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("application/json") || body.startsWith("{")) {
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(body);
            } catch (JsonProcessingException e) {
                throw StockTakeException.validation("request body is not valid JSON");
            }
            if (node != null && node.isObject()) {
                node.fieldNames().forEachRemaining(key -> {
                    JsonNode value = node.path(key);
                    if (value.isValueNode() && !value.isNull()) {
                        params.putIfAbsent(key, value.asText());
                    }
                });
            }
            return new Request(method, params, node);
        }
        parseQueryString(body).forEach(params::putIfAbsent);
        return new Request(method, params, null);
    }

    private static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    private static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    private static int parseIntOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static int clamp(int value, int min, int max) {
        if (value < min) {
            return min;
        }
        return Math.min(value, max);
    }

    @FunctionalInterface
    private interface Route {
        Object handle(Request request);
    }

    private record Request(String method, Map<String, String> params, JsonNode json) {
        String param(String key) {
            String value = params.get(key);
            return value == null || value.isBlank() ? null : value;
        }
    }
}
