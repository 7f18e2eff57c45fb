package com.mimecast.wren.http;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ResponseWriterTest {

    private final ResponseWriter writer = new ResponseWriter("Wren");

    @Test
    void writesHeadersAndBody() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertTrue(writer.write(out, HttpResponse.text(HttpStatus.OK, "hi"), false));

        String raw = out.toString(StandardCharsets.UTF_8);
        assertTrue(raw.startsWith("HTTP/1.1 200 OK\r\n"));
        assertTrue(raw.contains("Content-Type: text/plain; charset=utf-8\r\n"));
        assertTrue(raw.contains("Content-Length: 2\r\n"));
        assertTrue(raw.contains("Connection: close\r\n"));
        assertTrue(raw.contains("Server: Wren\r\n"));
        assertTrue(raw.contains("Date: "));
        assertTrue(raw.endsWith("\r\n\r\nhi"));
    }

    @Test
    void suppressedBodyKeepsLength() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertTrue(writer.write(out, HttpResponse.json(HttpStatus.NOT_FOUND, "{\"a\":1}"), true));

        String raw = out.toString(StandardCharsets.UTF_8);
        assertTrue(raw.startsWith("HTTP/1.1 404 Not Found\r\n"));
        assertTrue(raw.contains("Content-Length: 7\r\n"));
        assertTrue(raw.endsWith("\r\n\r\n"));
    }

    @Test
    void customReason() {
        String header = writer.header(new HttpResponse(503, "Service Unavailable (Simulated)", HttpResponse.TEXT_PLAIN, new byte[0]));

        assertTrue(header.startsWith("HTTP/1.1 503 Service Unavailable (Simulated)\r\n"));
        assertTrue(header.contains("Content-Length: 0\r\n"));
    }

    @Test
    void writeFailureReported() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }
        };

        assertFalse(writer.write(broken, HttpResponse.text(HttpStatus.OK, "hi"), false));
    }
}
