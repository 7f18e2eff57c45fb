package com.mimecast.wren.client;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Concurrent load generator and telemetry publisher.
 *
 * <p>Fires requests round-robin over a list of paths from a fixed pool of threads,
 * records one {@link RequestResult} per request and can publish the run to the server.
 *
 * <p>Example usage:
 * <pre>
 * LoadClient client = new LoadClient("127.0.0.1", 5000);
 * List&lt;RequestResult&gt; results = client.run(List.of("/", "/nope"), 20, 5, "GET");
 * client.publish(results);
 * </pre>
 */
public class LoadClient {
    private static final Logger log = LogManager.getLogger(LoadClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int DEFAULT_TIMEOUT = 10;

    /**
     * Results endpoint path.
     */
    public static final String RESULTS_PATH = "/api/test-results";

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final Gson gson;

    /**
     * Constructs a new LoadClient instance.
     *
     * @param host Server host.
     * @param port Server port.
     */
    public LoadClient(String host, int port) {
        this.baseUrl = "http://" + host + ":" + port;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(DEFAULT_TIMEOUT, TimeUnit.SECONDS)
                .readTimeout(DEFAULT_TIMEOUT, TimeUnit.SECONDS)
                .writeTimeout(DEFAULT_TIMEOUT, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
        this.gson = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .serializeNulls()
                .disableHtmlEscaping()
                .create();
    }

    /**
     * Runs a batch of requests.
     *
     * @param paths       Paths to cycle through.
     * @param requests    Total number of requests.
     * @param concurrency Number of worker threads.
     * @param method      GET or HEAD.
     * @return Results ordered by request id.
     * @throws InterruptedException Interrupted while waiting for results.
     */
    public List<RequestResult> run(List<String> paths, int requests, int concurrency, String method)
            throws InterruptedException {
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("At least one path is required");
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, concurrency),
                new BasicThreadFactory.Builder().namingPattern("LoadClient-%d").build());

        List<Future<RequestResult>> futures = new ArrayList<>(requests);
        try {
            for (int i = 0; i < requests; i++) {
                int id = i;
                String path = paths.get(i % paths.size());
                futures.add(pool.submit(() -> send(id, path, method)));
            }

            List<RequestResult> results = new ArrayList<>(requests);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    results.add(new RequestResult(i, paths.get(i % paths.size()), method)
                            .setError(String.valueOf(e.getCause())));
                }
            }

            long ok = results.stream().filter(RequestResult::isSuccess).count();
            log.info("Completed {} requests, {} successful, {} failed", results.size(), ok, results.size() - ok);
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Sends one request.
     *
     * @param id     Request id.
     * @param path   Request path.
     * @param method Request method.
     * @return RequestResult instance.
     */
    RequestResult send(int id, String path, String method) {
        RequestResult result = new RequestResult(id, path, method);

        HttpUrl url = HttpUrl.parse(baseUrl + (path.startsWith("/") ? path : "/" + path));
        if (url == null) {
            return result.setError("Invalid URL for path " + path);
        }

        Request request = new Request.Builder()
                .url(url)
                .method(method, null)
                .build();

        long start = System.nanoTime();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.body() != null) {
                response.body().bytes();
            }
            String length = response.header("Content-Length");
            result.setStatusCode(response.code())
                    .setContentLength(length != null ? parseLength(length) : null)
                    .setSuccess(true);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Request {} to {} failed: {}", id, path, e.getMessage());
            result.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            result.setResponseTime((System.nanoTime() - start) / 1_000_000.0);
        }

        return result;
    }

    /**
     * Publishes results to the server.
     *
     * @param results Results list.
     * @return Boolean, true if the server acknowledged the payload.
     */
    public boolean publish(List<RequestResult> results) {
        String payload = toJson(new TestRun(LocalDateTime.now().toString(), results));
        Request request = new Request.Builder()
                .url(baseUrl + RESULTS_PATH)
                .post(RequestBody.create(payload, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.error("Publishing results failed with status: {}", response.code());
                return false;
            }

            String body = response.body() != null ? response.body().string() : "{}";
            JsonObject ack = gson.fromJson(body, JsonObject.class);
            boolean success = ack != null && ack.has("success") && ack.get("success").getAsBoolean();
            log.info("Published {} results: {}", results.size(), success ? "acknowledged" : "rejected");
            return success;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            log.error("Publishing results failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Serializes a run.
     *
     * @param run TestRun instance.
     * @return JSON string.
     */
    public String toJson(TestRun run) {
        return gson.toJson(run);
    }

    private static Long parseLength(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
