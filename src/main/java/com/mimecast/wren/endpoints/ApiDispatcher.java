package com.mimecast.wren.endpoints;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.mimecast.wren.http.HttpRequest;
import com.mimecast.wren.http.HttpResponse;
import com.mimecast.wren.http.HttpStatus;
import com.mimecast.wren.logging.LogBuffer;
import com.mimecast.wren.routing.ApiRoute;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON API for exchanging test run telemetry.
 *
 * <p>Endpoints:
 * <ul>
 *   <li><b>POST /api/test-results</b>: Stores the posted JSON object verbatim and answers
 *       <code>{"success":true,"message":...,"count":N}</code> where N is the size of its <code>results</code> array.</li>
 *   <li><b>GET /api/test-results</b>: Returns the last stored payload, or <code>{}</code> if nothing was posted.</li>
 *   <li><b>GET /api/logs</b>: Returns <code>{"timestamp":...,"logs":[...]}</code> from the in-memory log buffer.</li>
 * </ul>
 *
 * @see ApiRoute
 */
public class ApiDispatcher {
    private static final Logger log = LogManager.getLogger(ApiDispatcher.class);

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final TestResultsStore store;
    private final LogBuffer logBuffer;

    /**
     * Constructs a new ApiDispatcher instance.
     *
     * @param store     TestResultsStore instance.
     * @param logBuffer LogBuffer instance.
     */
    public ApiDispatcher(TestResultsStore store, LogBuffer logBuffer) {
        this.store = store;
        this.logBuffer = logBuffer;
    }

    /**
     * Dispatches a request to its route.
     *
     * @param route   ApiRoute.
     * @param request HttpRequest instance.
     * @return HttpResponse instance.
     */
    public HttpResponse dispatch(ApiRoute route, HttpRequest request) {
        return switch (route) {
            case POST_TEST_RESULTS -> postTestResults(request);
            case GET_TEST_RESULTS -> HttpResponse.json(HttpStatus.OK, store.snapshot());
            case GET_LOGS -> getLogs();
        };
    }

    /**
     * Handles <b>POST /api/test-results</b>.
     */
    private HttpResponse postTestResults(HttpRequest request) {
        String body = new String(request.getBody(), StandardCharsets.UTF_8);

        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            log.debug("Invalid JSON posted to test results: {}", e.getMessage());
            return failure("Invalid JSON");
        }
        if (!parsed.isJsonObject()) {
            return failure("Expected a JSON object");
        }

        JsonObject payload = parsed.getAsJsonObject();
        int count = 0;
        if (payload.has("results") && payload.get("results").isJsonArray()) {
            count = payload.getAsJsonArray("results").size();
        }

        store.store(body);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Test results stored");
        response.put("count", count);
        return HttpResponse.json(HttpStatus.OK, GSON.toJson(response));
    }

    /**
     * Handles <b>GET /api/logs</b>.
     */
    private HttpResponse getLogs() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", LocalDateTime.now().toString());
        response.put("logs", logBuffer.snapshot());
        return HttpResponse.json(HttpStatus.OK, GSON.toJson(response));
    }

    /**
     * Builds a 400 JSON failure.
     */
    private HttpResponse failure(String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("message", message);
        return HttpResponse.json(HttpStatus.BAD_REQUEST, GSON.toJson(response));
    }
}
