package com.abusesentinel.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private HealthServer server;
    private int port;

    @BeforeEach
    void setUp() throws IOException {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("trackedSubjects", 3);
        stats.put("deniedTotal", 7L);
        server = new HealthServer(() -> stats);
        port = freePort();
        server.start(port);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should answer health and readiness probes")
    void shouldServeHealth() throws IOException {
        assertThat(server.isRunning()).isTrue();
        assertThat(get("/health")).isEqualTo("{\"status\":\"UP\"}");
        assertThat(get("/readiness")).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("Should serve the stats document as JSON")
    void shouldServeStats() throws IOException {
        assertThat(get("/stats")).isEqualTo("{\"trackedSubjects\":3,\"deniedTotal\":7}");
    }

    @Test
    @DisplayName("Should report stopped after stop()")
    void shouldStop() {
        server.stop();
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectInvalidPort() {
        HealthServer other = new HealthServer(Map::of);
        assertThatThrownBy(() -> other.start(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String get(String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL("http://localhost:" + port + path)
                .openConnection();
        try (InputStream body = connection.getInputStream()) {
            assertThat(connection.getResponseCode()).isEqualTo(200);
            return new String(body.readAllBytes(), StandardCharsets.UTF_8);
        } finally {
            connection.disconnect();
        }
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
