package com.mimecast.wren.http;

import java.nio.charset.StandardCharsets;

/**
 * HTTP response ready to be framed by the {@link ResponseWriter}.
 */
public class HttpResponse {

    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String APPLICATION_JSON = "application/json; charset=utf-8";

    private final int code;
    private final String reason;
    private final String contentType;
    private final byte[] body;

    /**
     * Constructs a new HttpResponse instance.
     *
     * @param code        Status code.
     * @param reason      Reason phrase.
     * @param contentType Content-Type header value.
     * @param body        Body bytes.
     */
    public HttpResponse(int code, String reason, String contentType, byte[] body) {
        this.code = code;
        this.reason = reason;
        this.contentType = contentType;
        this.body = body != null ? body : new byte[0];
    }

    /**
     * Constructs a new HttpResponse instance from a status.
     *
     * @param status      HttpStatus.
     * @param contentType Content-Type header value.
     * @param body        Body bytes.
     */
    public HttpResponse(HttpStatus status, String contentType, byte[] body) {
        this(status.getCode(), status.getReason(), contentType, body);
    }

    /**
     * Plain text response.
     *
     * @param status HttpStatus.
     * @param text   Body text.
     * @return HttpResponse instance.
     */
    public static HttpResponse text(HttpStatus status, String text) {
        return new HttpResponse(status, TEXT_PLAIN, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * JSON response.
     *
     * @param status HttpStatus.
     * @param json   JSON payload.
     * @return HttpResponse instance.
     */
    public static HttpResponse json(HttpStatus status, String json) {
        return new HttpResponse(status, APPLICATION_JSON, json.getBytes(StandardCharsets.UTF_8));
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getBody() {
        return body;
    }
}
