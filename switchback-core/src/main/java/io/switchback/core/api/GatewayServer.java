package io.switchback.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.switchback.core.backend.GenerationRequest;
import io.switchback.core.health.HealthMonitor;
import io.switchback.core.health.HealthReport;
import io.switchback.core.health.HealthStatus;
import io.switchback.core.health.ServiceHealth;
import io.switchback.core.orchestrator.CompletionOrchestrator;
import io.switchback.core.routing.CompletionOutcome;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front door for the orchestrator: chat, health, usage stats and a small index document.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    public static final String NAME = "switchback";
    public static final String VERSION = "0.1.0";
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final CompletionOrchestrator orchestrator;
    private final HealthMonitor healthMonitor;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(String host, int port, CompletionOrchestrator orchestrator, HealthMonitor healthMonitor) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor must not be null");
        this.mapper = new ObjectMapper();
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/", this::handleRoot)
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/chat", this::handleChat)
            .addExactPath("/stats", this::handleStats);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            String scheme = uri.getScheme();
            String hostName = uri.getHost();
            if (scheme == null || hostName == null) {
                return false;
            }
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
        LOG.info("Gateway stopped");
    }

    private void handleRoot(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", NAME);
        payload.put("version", VERSION);
        payload.put("health", "/healthz");
        payload.put("chat", "/chat");
        sendJson(exchange, 200, payload);
    }

    private void handleHealth(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleHealth(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        HealthReport report = healthMonitor.check();
        int status = report.status() == HealthStatus.UNHEALTHY ? 503 : 200;
        sendJson(exchange, status, toHealthResponse(report));
    }

    private void handleChat(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleChat(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        JsonNode body;
        try {
            body = readJsonBody(exchange);
        } catch (JsonProcessingException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        if (!body.isObject()) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        String message = body.path("message").asText("");
        if (message.isBlank()) {
            sendJson(exchange, 400, Map.of("error", "message_required"));
            return;
        }

        GenerationRequest request = GenerationRequest.of(
            message,
            body.path("personality").asText(""),
            body.path("max_tokens").asInt(GenerationRequest.DEFAULT_MAX_TOKENS),
            body.path("temperature").asDouble(GenerationRequest.DEFAULT_TEMPERATURE)
        );
        CompletionOutcome outcome = orchestrator.complete(request);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("response", outcome.text());
        response.put("backend_used", outcome.backendUsed());
        response.put("latency_ms", outcome.latency().toMillis());
        response.put("timestamp", Instant.now().toString());
        sendJson(exchange, 200, response);
    }

    private void handleStats(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Long> latencies = new LinkedHashMap<>();
        for (Map.Entry<String, Duration> entry : orchestrator.latencies().entrySet()) {
            latencies.put(entry.getKey(), entry.getValue().toMillis());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("last_used", orchestrator.lastUsed());
        payload.put("latencies_ms", latencies);
        sendJson(exchange, 200, payload);
    }

    private Map<String, Object> toHealthResponse(HealthReport report) {
        List<Map<String, Object>> services = new ArrayList<>();
        for (ServiceHealth service : report.services()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("service_name", service.serviceName());
            item.put("status", service.status().label());
            item.put("last_check", service.lastCheck() == null ? null : service.lastCheck().toString());
            item.put("response_time_ms", service.responseTime() == null ? null : service.responseTime().toMillis());
            item.put("error_message", service.errorMessage());
            services.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", report.status().label());
        payload.put("timestamp", report.timestamp().toString());
        payload.put("uptime_seconds", report.uptime().toSeconds());
        payload.put("services", services);
        return payload;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Gateway request {} failed", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", "internal_error"));
        } catch (IOException e) {
            LOG.warn("Could not send error response: {}", e.getMessage());
        }
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
