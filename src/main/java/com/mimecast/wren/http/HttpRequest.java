package com.mimecast.wren.http;

/**
 * Parsed HTTP request.
 *
 * <p>Headers are reduced to the ones the server consumes, <code>Host</code> and <code>Content-Length</code>,
 * while the raw header block is retained for logging.
 * <p>Instances live for the duration of one connection.
 *
 * @see RequestParser
 */
public class HttpRequest {

    private final HttpMethod method;
    private final String rawPath;
    private final String path;
    private final String query;
    private final String version;
    private final String headerBlock;
    private final String host;
    private final int contentLength;
    private final byte[] body;

    /**
     * Constructs a new HttpRequest instance.
     *
     * @param method        Request method.
     * @param rawPath       Request target as received.
     * @param path          Percent-decoded path without query.
     * @param query         Query string without the question mark, empty if none.
     * @param version       Protocol version token.
     * @param headerBlock   Header lines as received, without the request line.
     * @param host          Host header value, empty if missing.
     * @param contentLength Declared body length.
     * @param body          Body bytes buffered with the request.
     */
    public HttpRequest(HttpMethod method, String rawPath, String path, String query, String version,
                       String headerBlock, String host, int contentLength, byte[] body) {
        this.method = method;
        this.rawPath = rawPath;
        this.path = path;
        this.query = query;
        this.version = version;
        this.headerBlock = headerBlock;
        this.host = host;
        this.contentLength = contentLength;
        this.body = body;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getRawPath() {
        return rawPath;
    }

    public String getPath() {
        return path;
    }

    public String getQuery() {
        return query;
    }

    public String getVersion() {
        return version;
    }

    public String getHeaderBlock() {
        return headerBlock;
    }

    public String getHost() {
        return host;
    }

    public int getContentLength() {
        return contentLength;
    }

    public byte[] getBody() {
        return body;
    }

    /**
     * Is this a HEAD request.
     *
     * @return Boolean.
     */
    public boolean isHead() {
        return method == HttpMethod.HEAD;
    }

    @Override
    public String toString() {
        return method + " " + rawPath + " " + version;
    }
}
