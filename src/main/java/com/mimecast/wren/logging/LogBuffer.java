package com.mimecast.wren.logging;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory ring of recent log lines.
 *
 * <p>Appends and snapshots are serialized on a single lock so a snapshot always holds
 * the most recent lines in the order they were appended.
 * <p>Once full, each append evicts the oldest line.
 */
public class LogBuffer {

    /**
     * Default capacity.
     */
    public static final int DEFAULT_CAPACITY = 500;

    private final Object lock = new Object();
    private final Deque<String> lines;
    private final int capacity;

    /**
     * Constructs a new LogBuffer instance with default capacity.
     */
    public LogBuffer() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Constructs a new LogBuffer instance.
     *
     * @param capacity Maximum number of lines retained.
     */
    public LogBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a line, evicting the oldest one if full.
     *
     * @param line Formatted log line.
     */
    public void append(String line) {
        synchronized (lock) {
            if (lines.size() == capacity) {
                lines.pollFirst();
            }
            lines.addLast(String.valueOf(line));
        }
    }

    /**
     * Copies the current content, oldest first.
     *
     * @return Immutable list of lines.
     */
    public List<String> snapshot() {
        synchronized (lock) {
            return List.copyOf(lines);
        }
    }

    /**
     * Gets the number of lines held.
     *
     * @return Line count.
     */
    public int size() {
        synchronized (lock) {
            return lines.size();
        }
    }

    /**
     * Gets capacity.
     *
     * @return Maximum line count.
     */
    public int capacity() {
        return capacity;
    }
}
