package com.supplysentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplysentinel.core.ensemble.AnomalyEnsemble;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health, readiness and ensemble roster
 * endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: same; Kubernetes readiness probe target</li>
 * <li>{@code GET /ensemble}: policy, threshold, quorum and per-detector
 * family, weight and activity of the loaded ensemble</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}, so no servlet container is
 * required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AnomalyEnsemble ensemble;
    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param ensemble the ensemble whose roster {@code /ensemble} reports
     */
    public HealthServer(AnomalyEnsemble ensemble) {
        this.ensemble = Objects.requireNonNull(ensemble, "ensemble must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [0, 65535], 0 picks a
     *             free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", HealthServer::handleHealthCheck);
            server.createContext("/readiness", HealthServer::handleHealthCheck);
            server.createContext("/ensemble", this::handleRoster);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
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

    /**
     * @return the bound port, or -1 if the server is not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    /**
     * Snapshot of the ensemble served by {@code /ensemble}.
     */
    Map<String, Object> describeEnsemble() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policy", ensemble.policy());
        body.put("lifecycle", ensemble.lifecycle());
        body.put("threshold", ensemble.threshold());
        body.put("quorum", ensemble.quorum());

        Map<String, Double> weights = ensemble.weights();
        List<String> active = ensemble.activeDetectors();
        List<Map<String, Object>> detectors = new ArrayList<>();
        for (String id : ensemble.detectorIds()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", id);
            entry.put("family", ensemble.family(id));
            entry.put("weight", weights.get(id));
            entry.put("active", active.contains(id));
            detectors.add(entry);
        }
        body.put("detectors", detectors);
        return body;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, HEALTH_RESPONSE);
    }

    private void handleRoster(HttpExchange exchange) throws IOException {
        respond(exchange, MAPPER.writeValueAsBytes(describeEnsemble()));
    }

    private static void respond(HttpExchange exchange, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
