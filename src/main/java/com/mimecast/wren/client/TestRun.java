package com.mimecast.wren.client;

import java.util.List;

/**
 * Telemetry payload published to <code>POST /api/test-results</code>.
 */
public class TestRun {
    private final String timestamp;
    private final int totalRequests;
    private final List<RequestResult> results;

    /**
     * Constructs a new TestRun instance.
     *
     * @param timestamp ISO-8601 local timestamp.
     * @param results   Results list.
     */
    public TestRun(String timestamp, List<RequestResult> results) {
        this.timestamp = timestamp;
        this.totalRequests = results.size();
        this.results = List.copyOf(results);
    }

    public String getTimestamp() {
        return timestamp;
    }

    public int getTotalRequests() {
        return totalRequests;
    }

    public List<RequestResult> getResults() {
        return results;
    }
}
