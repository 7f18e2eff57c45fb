package com.mimecast.wren.http;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Frames responses onto a connection.
 *
 * <p>Every response carries <code>Content-Type</code>, <code>Content-Length</code> and <code>Connection: close</code>.
 * <br>Content-Length is always the body length, also when the body is suppressed for HEAD.
 * <p>Write failures are logged and reported through the return value, never thrown,
 * as the connection is being torn down regardless.
 */
public class ResponseWriter {
    private static final Logger log = LogManager.getLogger(ResponseWriter.class);

    private static final String CRLF = "\r\n";

    private final String serverName;

    /**
     * Constructs a new ResponseWriter instance.
     *
     * @param serverName Server header value.
     */
    public ResponseWriter(String serverName) {
        this.serverName = serverName;
    }

    /**
     * Writes a response.
     *
     * @param out          Connection output stream.
     * @param response     HttpResponse instance.
     * @param suppressBody Send headers only.
     * @return Boolean, false if the write failed.
     */
    public boolean write(OutputStream out, HttpResponse response, boolean suppressBody) {
        byte[] head = header(response).getBytes(StandardCharsets.UTF_8);
        try {
            out.write(head);
            if (!suppressBody && response.getBody().length > 0) {
                out.write(response.getBody());
            }
            out.flush();
            log.trace("Sent response: status={}, bytes={}, suppressed={}",
                    response.getCode(), response.getBody().length, suppressBody);
            return true;
        } catch (IOException e) {
            log.error("Error sending response {}: {}", response.getCode(), e.getMessage());
            return false;
        }
    }

    /**
     * Builds the status line and header block, including the blank line.
     *
     * @param response HttpResponse instance.
     * @return Header string.
     */
    String header(HttpResponse response) {
        return "HTTP/1.1 " + response.getCode() + " " + response.getReason() + CRLF +
                "Content-Type: " + response.getContentType() + CRLF +
                "Content-Length: " + response.getBody().length + CRLF +
                "Date: " + DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC)) + CRLF +
                "Server: " + serverName + CRLF +
                "Connection: close" + CRLF +
                CRLF;
    }
}
