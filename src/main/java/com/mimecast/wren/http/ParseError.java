package com.mimecast.wren.http;

/**
 * Request parsing failure.
 *
 * <p>Carries the status the failure maps to and the text sent back to the client.
 */
public class ParseError {

    private final HttpStatus status;
    private final String message;
    private final String method;

    /**
     * Constructs a new ParseError instance.
     *
     * @param status  Mapped status.
     * @param message Response text.
     * @param method  Offending method, or null when not method related.
     */
    public ParseError(HttpStatus status, String message, String method) {
        this.status = status;
        this.message = message;
        this.method = method;
    }

    /**
     * Malformed request, mapped to 400.
     *
     * @param message Response text.
     * @return ParseError instance.
     */
    public static ParseError badRequest(String message) {
        return new ParseError(HttpStatus.BAD_REQUEST, message, null);
    }

    /**
     * Unsupported method, mapped to 405.
     *
     * @param method Offending method.
     * @return ParseError instance.
     */
    public static ParseError methodNotAllowed(String method) {
        return new ParseError(HttpStatus.METHOD_NOT_ALLOWED, "Method " + method + " is not supported\n", method);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Converts to a plain text response.
     *
     * @return HttpResponse instance.
     */
    public HttpResponse toResponse() {
        return HttpResponse.text(status, message);
    }
}
