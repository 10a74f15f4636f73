package com.abusesentinel.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health, readiness and engine stats.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – Returns {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} – Same; Kubernetes readiness probe target</li>
 * <li>{@code GET /stats} – JSON document from the stats supplier</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<Map<String, Object>> stats;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    /**
     * @param stats supplier of the {@code /stats} document, called once per
     *              request
     */
    public HealthServer(Supplier<Map<String, Object>> stats) {
        this.stats = Objects.requireNonNull(stats, "Stats supplier must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start health server on port " + port, e);
        }
        server.createContext("/health", HealthServer::handleHealthCheck);
        server.createContext("/readiness", HealthServer::handleHealthCheck);
        server.createContext("/stats", this::handleStats);

        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        }));

        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", port);
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(stats.get());
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize stats: {}", e.getMessage(), e);
            respond(exchange, 500, "{\"error\":\"stats unavailable\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, 200, body);
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
