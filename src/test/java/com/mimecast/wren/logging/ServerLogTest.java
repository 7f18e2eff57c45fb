package com.mimecast.wren.logging;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServerLogTest {

    @Test
    void initializationLine() {
        ServerLog log = new ServerLog(new LogBuffer(10));

        List<String> lines = log.getBuffer().snapshot();
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).endsWith(" - INFO - Logger initialized"));
    }

    @Test
    void formatsAndBuffers() {
        ServerLog log = new ServerLog(new LogBuffer(10));
        log.info("Served {} to {}", "/index.html", "127.0.0.1:5555");
        log.warn("Access denied: {}", "/../etc/passwd");
        log.error("Boom");

        List<String> lines = log.getBuffer().snapshot();
        assertEquals(4, lines.size());
        String thread = Thread.currentThread().getName();
        assertTrue(lines.get(1).matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} - \\[.*] - INFO - Served /index.html to 127.0.0.1:5555"),
                lines.get(1));
        assertTrue(lines.get(1).contains("[" + thread + "]"));
        assertTrue(lines.get(2).endsWith(" - WARN - Access denied: /../etc/passwd"));
        assertTrue(lines.get(3).endsWith(" - ERROR - Boom"));
    }
}
