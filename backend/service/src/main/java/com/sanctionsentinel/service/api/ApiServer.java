package com.sanctionsentinel.service.api;

import com.sanctionsentinel.core.events.Event;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.core.model.ScraperRun;
import com.sanctionsentinel.core.util.JsonUtils;
import com.sanctionsentinel.service.ledger.ConflictException;
import com.sanctionsentinel.service.runtime.Orchestrator;
import com.sanctionsentinel.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final DiagnosticsTracker EMPTY_DIAGNOSTICS = DiagnosticsTracker.empty();

    private final int port;
    private final Orchestrator orchestrator;
    private final EventStore eventStore;
    private final DiagnosticsTracker diagnosticsTracker;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, Orchestrator orchestrator, EventStore eventStore, DiagnosticsTracker diagnosticsTracker) {
        this.port = port;
        this.orchestrator = orchestrator;
        this.eventStore = eventStore;
        this.diagnosticsTracker = diagnosticsTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/sources/", this::handleSources);
            server.createContext("/api/runs/", this::handleRuns);
            server.createContext("/api/events", this::handleEvents);
            server.createContext("/api/metrics", this::handleMetrics);
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdown();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    // /api/sources/{source}/runs and /api/sources/{source}/status
    private void handleSources(HttpExchange exchange) throws IOException {
        String[] segments = pathSegments(exchange.getRequestURI(), "/api/sources/");
        if (segments.length != 2) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        Optional<SanctionsSource> source = parseSource(segments[0]);
        if (source.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "unknown_source"));
            return;
        }
        switch (segments[1]) {
            case "runs" -> triggerRun(exchange, source.get());
            case "status" -> sourceStatus(exchange, source.get());
            default -> writeJson(exchange, 404, Map.of("error", "not_found"));
        }
    }

    private void triggerRun(HttpExchange exchange, SanctionsSource source) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        boolean force = Boolean.parseBoolean(queryParams(exchange.getRequestURI()).getOrDefault("force", "false"));
        try {
            String runId = orchestrator.runSource(source, force);
            writeJson(exchange, 202, Map.of("runId", runId));
        } catch (ConflictException e) {
            Map<String, Object> body = new HashMap<>();
            body.put("error", "already_running");
            body.put("runId", e.runningRunId());
            writeJson(exchange, 409, body);
        } catch (IllegalArgumentException e) {
            writeJson(exchange, 404, Map.of("error", "unsupported_source"));
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Run trigger rejected for " + source, e);
            writeJson(exchange, 503, Map.of("error", "unavailable"));
        }
    }

    private void sourceStatus(HttpExchange exchange, SanctionsSource source) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        int windowHours;
        try {
            windowHours = Integer.parseInt(queryParams(exchange.getRequestURI()).getOrDefault("windowHours", "24"));
        } catch (NumberFormatException e) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, orchestrator.getSourceStatus(source, windowHours));
    }

    private void handleRuns(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        String[] segments = pathSegments(exchange.getRequestURI(), "/api/runs/");
        if (segments.length != 1) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        Optional<ScraperRun> run = orchestrator.getRunStatus(segments[0]);
        if (run.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "run_not_found"));
            return;
        }
        writeJson(exchange, 200, run.get());
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }

        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : 200;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        List<Event> events = eventStore.query(since, type, Math.max(1, limit));
        writeJson(exchange, 200, events);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, diagnostics().metricsSnapshot());
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method + ",OPTIONS");
            writeJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private static Optional<SanctionsSource> parseSource(String raw) {
        try {
            return Optional.of(SanctionsSource.parse(raw));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String[] pathSegments(URI uri, String prefix) {
        String path = uri.getPath();
        String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        return rest.isEmpty() ? new String[0] : rest.split("/");
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    private DiagnosticsTracker diagnostics() {
        return diagnosticsTracker != null ? diagnosticsTracker : EMPTY_DIAGNOSTICS;
    }
}
