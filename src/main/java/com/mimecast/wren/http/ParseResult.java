package com.mimecast.wren.http;

/**
 * Outcome of {@link RequestParser#parse(byte[], int)}: either a request or an error.
 */
public class ParseResult {

    private final HttpRequest request;
    private final ParseError error;

    private ParseResult(HttpRequest request, ParseError error) {
        this.request = request;
        this.error = error;
    }

    public static ParseResult success(HttpRequest request) {
        return new ParseResult(request, null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return request != null;
    }

    /**
     * Gets request.
     *
     * @return HttpRequest instance.
     * @throws IllegalStateException Result is a failure.
     */
    public HttpRequest getRequest() {
        if (request == null) {
            throw new IllegalStateException("Parse failed: " + error.getMessage());
        }
        return request;
    }

    /**
     * Gets error.
     *
     * @return ParseError instance.
     * @throws IllegalStateException Result is a success.
     */
    public ParseError getError() {
        if (error == null) {
            throw new IllegalStateException("Parse succeeded");
        }
        return error;
    }
}
