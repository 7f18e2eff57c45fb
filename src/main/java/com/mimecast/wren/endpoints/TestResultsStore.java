package com.mimecast.wren.endpoints;

/**
 * Holder of the last test results payload published by the load client.
 *
 * <p>The payload is swapped as a whole under a lock so readers get either the previous or the new
 * complete payload, never a mix.
 * <p>Before anything is published the empty JSON object is returned.
 */
public class TestResultsStore {

    /**
     * Payload returned before any publication.
     */
    public static final String EMPTY = "{}";

    private final Object lock = new Object();
    private String payload = EMPTY;

    /**
     * Replaces the stored payload.
     *
     * @param json Validated JSON text, stored verbatim.
     */
    public void store(String json) {
        synchronized (lock) {
            payload = json;
        }
    }

    /**
     * Gets the stored payload.
     *
     * @return JSON text.
     */
    public String snapshot() {
        synchronized (lock) {
            return payload;
        }
    }
}
