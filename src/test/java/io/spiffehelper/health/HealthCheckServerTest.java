package io.spiffehelper.health;

import io.spiffehelper.config.HealthChecksConfig;
import io.spiffehelper.testing.RecordingEventSink;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URL;
import java.time.Duration;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class HealthCheckServerTest {

    @Test
    void servesLivenessAndReadiness() throws Exception {
        RecordingEventSink events = new RecordingEventSink();
        HealthCheckServer server = HealthCheckServer.start(
                new HealthChecksConfig(true, 0, "/live", "/ready"), events);
        try {
            assertTrue(server.enabled());
            assertTrue(server.port() > 0);
            assertEquals(200, status(server.port(), "GET", "/live"));
            assertEquals(200, status(server.port(), "GET", "/ready"));
            assertEquals(404, status(server.port(), "GET", "/health/live"));
            assertEquals(405, status(server.port(), "POST", "/ready"));
            assertTrue(events.has("health.started"));
        } finally {
            server.stop();
        }
    }

    @Test
    void stopReleasesThePort() throws Exception {
        RecordingEventSink events = new RecordingEventSink();
        HealthCheckServer server = HealthCheckServer.start(HealthChecksConfig.enabledOnPort(0), events);
        int port = server.port();

        server.stop();
        server.stop();

        assertTrue(server.terminated().isDone());
        assertFalse(server.terminated().isCompletedExceptionally());
        assertEquals(1, events.count("health.stopped"));
        assertThrows(IOException.class, () -> {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 1000);
            }
        });
    }

    @Test
    void disabledListenerNeverTerminates() throws Exception {
        HealthCheckServer server = HealthCheckServer.start(HealthChecksConfig.disabled(), new RecordingEventSink());

        assertFalse(server.enabled());
        assertEquals(-1, server.port());
        server.stop();
        assertFalse(server.terminated().isDone());
    }

    @Test
    void bindFailureNamesTheAddress() throws Exception {
        try (ServerSocket taken = new ServerSocket(0)) {
            HealthChecksConfig config = HealthChecksConfig.enabledOnPort(taken.getLocalPort());
            IOException e = assertThrows(IOException.class,
                    () -> HealthCheckServer.start(config, new RecordingEventSink()));
            assertTrue(e.getMessage().contains("0.0.0.0:" + taken.getLocalPort()), e.getMessage());
        }
    }

    @Test
    void listenerFailureCompletesTerminatedExceptionally() throws Exception {
        RecordingEventSink events = new RecordingEventSink();
        HealthCheckServer server = HealthCheckServer.start(HealthChecksConfig.enabledOnPort(0),
                Duration.ofMinutes(5), events);
        try {
            server.listenerFailed(new IOException("accept loop died"));

            CompletionException e = assertThrows(CompletionException.class, () -> server.terminated().join());
            assertInstanceOf(HealthServerException.class, e.getCause());
            assertTrue(e.getCause().getMessage().contains("accept loop died"));
            assertTrue(events.has("health.failed"));
        } finally {
            server.stop();
        }
    }

    private static int status(int port, String method, String path) throws IOException {
        URL url = new URL("http://127.0.0.1:" + port + path);
        HttpURLConnection connection = (HttpURLConnection) url.openConnection();
        try {
            connection.setRequestMethod(method);
            connection.setConnectTimeout(2000);
            connection.setReadTimeout(2000);
            return connection.getResponseCode();
        } finally {
            connection.disconnect();
        }
    }
}
