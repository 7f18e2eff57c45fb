package com.mimecast.wren.http;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP request parser.
 *
 * <p>Turns the bytes buffered from a connection into an {@link HttpRequest}.
 * <br>No I/O is performed here, the connection handler reads until the header terminator is buffered.
 *
 * <p>Parsing rules:
 * <ul>
 *     <li>The request line and headers must be terminated by an empty line (CRLF CRLF), otherwise 400.</li>
 *     <li>The request line is split on single spaces and needs at least three tokens, otherwise 400.</li>
 *     <li>The method is upper-cased and must be one of GET, HEAD or POST, otherwise 405.</li>
 *     <li>A malformed or negative <code>Content-Length</code> is read as zero.</li>
 *     <li>The path is percent-decoded, <code>+</code> is kept literally. Bad escapes are a 400.</li>
 * </ul>
 *
 * @see ParseResult
 */
public class RequestParser {
    private static final Logger log = LogManager.getLogger(RequestParser.class);

    /**
     * Header block terminator.
     */
    static final byte[] HEADER_TERMINATOR = {'\r', '\n', '\r', '\n'};

    private static final String CRLF = "\r\n";

    /**
     * Parses a buffered request.
     *
     * @param raw    Buffer.
     * @param length Number of valid bytes in buffer.
     * @return ParseResult instance.
     */
    public ParseResult parse(byte[] raw, int length) {
        int headerEnd = headerEnd(raw, length);
        if (headerEnd < 0) {
            return ParseResult.failure(ParseError.badRequest("Incomplete request headers\n"));
        }

        String head = new String(raw, 0, headerEnd, StandardCharsets.UTF_8);
        int lineEnd = head.indexOf(CRLF);
        String requestLine = lineEnd < 0 ? head : head.substring(0, lineEnd);
        String headerBlock = lineEnd < 0 ? "" : head.substring(lineEnd + CRLF.length());

        String[] parts = requestLine.split(" ", -1);
        if (parts.length < 3) {
            log.debug("Malformed request line: {}", requestLine);
            return ParseResult.failure(ParseError.badRequest("Malformed request line\n"));
        }

        String token = parts[0].toUpperCase(Locale.ROOT);
        Optional<HttpMethod> method = HttpMethod.of(token);
        if (method.isEmpty()) {
            return ParseResult.failure(ParseError.methodNotAllowed(token));
        }

        String target = parts[1];
        String version = parts[2];

        // Fragment is never sent by compliant clients but strip it anyway.
        String pathPart = target;
        int hash = pathPart.indexOf('#');
        if (hash >= 0) {
            pathPart = pathPart.substring(0, hash);
        }
        String query = "";
        int question = pathPart.indexOf('?');
        if (question >= 0) {
            query = pathPart.substring(question + 1);
            pathPart = pathPart.substring(0, question);
        }

        String path;
        try {
            path = decodePath(pathPart);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed path encoding: {}", target);
            return ParseResult.failure(ParseError.badRequest("Malformed path encoding\n"));
        }

        String host = headerValue(headerBlock, "host").orElse("");
        int contentLength = contentLength(headerBlock);

        int bodyStart = headerEnd + HEADER_TERMINATOR.length;
        int available = Math.max(0, length - bodyStart);
        byte[] body = Arrays.copyOfRange(raw, bodyStart, bodyStart + Math.min(contentLength, available));

        return ParseResult.success(new HttpRequest(method.get(), target, path, query, version,
                headerBlock, host, contentLength, body));
    }

    /**
     * Finds the header terminator.
     *
     * @param buf    Buffer.
     * @param length Number of valid bytes in buffer.
     * @return Index of the terminator start or -1 if not yet buffered.
     */
    public static int headerEnd(byte[] buf, int length) {
        return headerEnd(buf, 0, length);
    }

    /**
     * Finds the header terminator starting at an offset.
     *
     * @param buf    Buffer.
     * @param from   Offset to start searching at.
     * @param length Number of valid bytes in buffer.
     * @return Index of the terminator start or -1 if not yet buffered.
     */
    public static int headerEnd(byte[] buf, int from, int length) {
        int last = Math.min(length, buf.length) - HEADER_TERMINATOR.length;
        for (int i = Math.max(0, from); i <= last; i++) {
            if (buf[i] == '\r' && buf[i + 1] == '\n' && buf[i + 2] == '\r' && buf[i + 3] == '\n') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Reads the declared body length from a buffered header block.
     *
     * @param buf       Buffer.
     * @param headerEnd Index returned by {@link #headerEnd(byte[], int)}.
     * @return Declared length, zero when missing or malformed.
     */
    public static int declaredContentLength(byte[] buf, int headerEnd) {
        return contentLength(new String(buf, 0, headerEnd, StandardCharsets.UTF_8));
    }

    /**
     * Extracts Content-Length leniently.
     * <p>A malformed value is read as zero rather than rejected.
     *
     * @param headerBlock Header lines.
     * @return Declared length.
     */
    static int contentLength(String headerBlock) {
        Optional<String> value = headerValue(headerBlock, "content-length");
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value.get()));
        } catch (NumberFormatException e) {
            log.debug("Malformed Content-Length treated as zero: {}", value.get());
            return 0;
        }
    }

    /**
     * Finds a header value by case-insensitive name.
     * <p>First occurrence wins.
     *
     * @param headerBlock Header lines.
     * @param name        Lower case header name.
     * @return Optional of trimmed value.
     */
    static Optional<String> headerValue(String headerBlock, String name) {
        for (String line : headerBlock.split(CRLF)) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            if (line.substring(0, colon).trim().toLowerCase(Locale.ROOT).equals(name)) {
                return Optional.of(line.substring(colon + 1).trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Percent-decodes a path.
     * <p>Unlike form decoding, a plus sign stays a plus sign.
     *
     * @param path Encoded path.
     * @return Decoded path.
     * @throws IllegalArgumentException Malformed escape sequence.
     */
    static String decodePath(String path) {
        return URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}
