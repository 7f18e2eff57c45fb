package com.mimecast.wren.http;

import com.mimecast.wren.chaos.FailureInjector;
import com.mimecast.wren.config.server.ServerConfig;
import com.mimecast.wren.endpoints.TestResultsStore;
import com.mimecast.wren.logging.LogBuffer;
import com.mimecast.wren.logging.ServerLog;
import com.mimecast.wren.routing.PathGuard;
import com.mimecast.wren.routing.ResolvedTarget;
import com.mimecast.wren.routing.Router;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end tests over loopback sockets.
 */
class HttpListenerTest {

    @TempDir
    Path publicDir;

    private HttpListener listener;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(publicDir.resolve("index.html"), "Hello World!");
        Files.writeString(publicDir.resolve("404.html"), "<h1>404 Not Found</h1>");
        Files.writeString(publicDir.resolve("style.css"), "body {}");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (listener != null) {
            listener.shutdown();
            listener.awaitTermination();
        }
    }

    private void start(Map<String, Object> overrides) throws IOException {
        start(ServerContext.create(config(overrides)));
    }

    private ServerConfig config(Map<String, Object> overrides) {
        Map<String, Object> map = new HashMap<>();
        map.put("bind", "127.0.0.1");
        map.put("port", 0);
        map.put("maxThreads", 4);
        map.put("publicDir", publicDir.toString());
        map.put("readTimeout", 5);
        map.put("acceptTimeout", 100);
        map.put("maxBodySize", 1024);
        map.putAll(overrides);
        return new ServerConfig(map);
    }

    private void start(ServerContext context) throws IOException {
        listener = new HttpListener(context);
        listener.start();
        assertEquals(LifecycleState.RUNNING, listener.getState());
    }

    private String send(String raw) throws IOException {
        try (Socket socket = new Socket("127.0.0.1", listener.getLocalPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(raw.getBytes(StandardCharsets.UTF_8));
            out.flush();
            return new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String body(String response) {
        return response.substring(response.indexOf("\r\n\r\n") + 4);
    }

    @Test
    void servesIndex() throws IOException {
        start(Map.of());

        String response = send("GET / HTTP/1.1\r\nHost: localhost\r\n\r\n");

        assertTrue(response.startsWith("HTTP/1.1 200 OK\r\n"), response);
        assertTrue(response.contains("Content-Type: text/html; charset=utf-8\r\n"));
        assertTrue(response.contains("Content-Length: 12\r\n"));
        assertTrue(response.contains("Connection: close\r\n"));
        assertEquals("Hello World!", body(response));
    }

    @Test
    void servesStaticFileWithType() throws IOException {
        start(Map.of());

        String response = send("GET /style.css HTTP/1.1\r\n\r\n");

        assertTrue(response.startsWith("HTTP/1.1 200 OK\r\n"));
        assertTrue(response.contains("Content-Type: text/css; charset=utf-8\r\n"));
        assertEquals("body {}", body(response));
    }

    @Test
    void headSuppressesBody() throws IOException {
        start(Map.of());

        String response = send("HEAD / HTTP/1.1\r\n\r\n");

        assertTrue(response.startsWith("HTTP/1.1 200 OK\r\n"));
        assertTrue(response.contains("Content-Length: 12\r\n"));
        assertEquals("", body(response));
    }

    @Test
    void traversalForbidden() throws IOException {
        start(Map.of());

        assertTrue(send("GET /../etc/passwd HTTP/1.1\r\n\r\n").startsWith("HTTP/1.1 403 Forbidden\r\n"));
        assertTrue(send("GET /%2e%2e/%2e%2e/etc/passwd HTTP/1.1\r\n\r\n").startsWith("HTTP/1.1 403 Forbidden\r\n"));
    }

    @Test
    void notFoundServesPage() throws IOException {
        start(Map.of());

        String response = send("GET /nope HTTP/1.1\r\n\r\n");

        assertTrue(response.startsWith("HTTP/1.1 404 Not Found\r\n"));
        assertEquals("<h1>404 Not Found</h1>", body(response));

        String head = send("HEAD /nope HTTP/1.1\r\n\r\n");
        assertTrue(head.startsWith("HTTP/1.1 404 Not Found\r\n"));
        assertTrue(head.contains("Content-Length: 22\r\n"));
        assertEquals("", body(head));
    }

    @Test
    void protocolErrors() throws IOException {
        start(Map.of());

        String trace = send("TRACE / HTTP/1.1\r\n\r\n");
        assertTrue(trace.startsWith("HTTP/1.1 405 Method Not Allowed\r\n"));
        assertTrue(body(trace).contains("TRACE"));

        assertTrue(send("GARBAGE\r\n\r\n").startsWith("HTTP/1.1 400 Bad Request\r\n"));
    }

    @Test
    void oversizedBodyRejected() throws IOException {
        start(Map.of());

        String response = send("POST /api/test-results HTTP/1.1\r\nContent-Length: 4096\r\n\r\n");

        assertTrue(response.startsWith("HTTP/1.1 400 Bad Request\r\n"));
        assertEquals("Request body too large\n", body(response));
    }

    @Test
    void postThenGetResults() throws IOException {
        start(Map.of());
        String payload = "{\"total_requests\":1,\"results\":[{\"request_id\":0}]}";

        String posted = send("POST /api/test-results HTTP/1.1\r\nContent-Type: application/json\r\nContent-Length: "
                + payload.length() + "\r\n\r\n" + payload);
        assertTrue(posted.startsWith("HTTP/1.1 200 OK\r\n"));
        assertTrue(posted.contains("Content-Type: application/json; charset=utf-8\r\n"));
        assertTrue(body(posted).contains("\"count\":1"));

        String fetched = send("GET /api/test-results HTTP/1.1\r\n\r\n");
        assertEquals(payload, body(fetched));
    }

    @Test
    void logsEndpointShowsActivity() throws IOException {
        start(Map.of());
        send("GET /index.html HTTP/1.1\r\n\r\n");

        String logs = body(send("GET /api/logs HTTP/1.1\r\n\r\n"));

        assertTrue(logs.contains("\"timestamp\""));
        assertTrue(logs.contains("Logger initialized"));
        assertTrue(logs.contains("GET /index.html HTTP/1.1"));
    }

    @Test
    void unknownApiEndpoint() throws IOException {
        start(Map.of());

        assertTrue(send("GET /api/nothing HTTP/1.1\r\n\r\n").startsWith("HTTP/1.1 404 Not Found\r\n"));
    }

    @Test
    void injectedFailures() throws IOException {
        start(Map.of("failureInjection", Map.of("enabled", true, "rate", 1.0, "statuses", List.of(503))));

        String response = send("GET / HTTP/1.1\r\n\r\n");
        assertTrue(response.startsWith("HTTP/1.1 503 Service Unavailable (Simulated)\r\n"), response);
        assertEquals("Simulated failure: 503 Service Unavailable\n", body(response));

        String head = send("HEAD / HTTP/1.1\r\n\r\n");
        assertTrue(head.startsWith("HTTP/1.1 503 "));
        assertEquals("", body(head));
    }

    @Test
    void processingFailureAnswered500() throws IOException {
        Router router = new Router(new PathGuard(publicDir), "index.html", "404.html") {
            @Override
            public ResolvedTarget route(HttpRequest request) {
                if (request.getPath().equals("/boom")) {
                    throw new IllegalStateException("Router exploded");
                }
                return super.route(request);
            }
        };
        ServerLog serverLog = new ServerLog(new LogBuffer(50));
        start(new ServerContext(config(Map.of()), serverLog, new TestResultsStore(), router, FailureInjector.disabled()));

        String response = send("GET /boom HTTP/1.1\r\n\r\n");
        assertTrue(response.startsWith("HTTP/1.1 500 Internal Server Error\r\n"), response);
        assertTrue(response.contains("Content-Length: 22\r\n"));
        assertEquals("Internal server error\n", body(response));

        String head = send("HEAD /boom HTTP/1.1\r\n\r\n");
        assertTrue(head.startsWith("HTTP/1.1 500 Internal Server Error\r\n"));
        assertTrue(head.contains("Content-Length: 22\r\n"));
        assertEquals("", body(head));

        assertTrue(send("GET / HTTP/1.1\r\n\r\n").startsWith("HTTP/1.1 200 OK\r\n"));
        assertTrue(serverLog.getBuffer().snapshot().stream().anyMatch(line -> line.contains("Router exploded")));
    }

    @Test
    void concurrentClients() throws Exception {
        start(Map.of());

        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                futures.add(pool.submit(() -> send("GET / HTTP/1.1\r\n\r\n")));
            }
            for (Future<String> future : futures) {
                String response = future.get();
                assertTrue(response.startsWith("HTTP/1.1 200 OK\r\n"));
                assertEquals("Hello World!", body(response));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void silentClientDoesNotBreakServer() throws IOException {
        start(Map.of());

        try (Socket socket = new Socket("127.0.0.1", listener.getLocalPort())) {
            socket.shutdownOutput();
            socket.setSoTimeout(5000);
            assertEquals(0, socket.getInputStream().readAllBytes().length);
        }

        assertTrue(send("GET / HTTP/1.1\r\n\r\n").startsWith("HTTP/1.1 200 OK\r\n"));
    }

    @Test
    void shutdownWaitsForInFlightConnection() throws Exception {
        start(Map.of());
        int port = listener.getLocalPort();

        try (Socket socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write("GET / HTTP/1.1\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();

            long deadline = System.currentTimeMillis() + 5000;
            while (listener.getActiveThreads() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, listener.getActiveThreads());

            Thread stopper = new Thread(listener::shutdown);
            stopper.start();
            Thread.sleep(300);
            assertTrue(stopper.isAlive());
            assertEquals(LifecycleState.SHUTTING_DOWN, listener.getState());

            out.write("\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            String response = new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            assertTrue(response.startsWith("HTTP/1.1 200 OK\r\n"));

            stopper.join(5000);
            assertFalse(stopper.isAlive());
        }

        listener.awaitTermination();
        assertEquals(LifecycleState.STOPPED, listener.getState());
        assertThrows(IOException.class, () -> new Socket("127.0.0.1", port).close());
    }

    @Test
    void requestShutdownStopsAcceptLoop() throws Exception {
        start(Map.of());

        listener.requestShutdown();
        listener.awaitTermination();

        assertEquals(LifecycleState.STOPPED, listener.getState());
    }

    @Test
    void shutdownIsIdempotent() throws Exception {
        start(Map.of());

        listener.shutdown();
        listener.shutdown();
        listener.awaitTermination();

        assertEquals(LifecycleState.STOPPED, listener.getState());
    }
}
