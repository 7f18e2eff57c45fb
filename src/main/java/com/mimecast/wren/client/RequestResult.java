package com.mimecast.wren.client;

/**
 * Outcome of one load client request.
 * <p>Field names serialize in snake case for the telemetry payload.
 */
public class RequestResult {
    private final int requestId;
    private final String path;
    private final String method;
    private Integer statusCode;
    private Double responseTime;
    private Long contentLength;
    private String error;
    private boolean success;

    /**
     * Constructs a new RequestResult instance.
     *
     * @param requestId Request id.
     * @param path      Request path.
     * @param method    Request method.
     */
    public RequestResult(int requestId, String path, String method) {
        this.requestId = requestId;
        this.path = path;
        this.method = method;
    }

    public int getRequestId() {
        return requestId;
    }

    public String getPath() {
        return path;
    }

    public String getMethod() {
        return method;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public RequestResult setStatusCode(Integer statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    /**
     * Gets elapsed time.
     *
     * @return Milliseconds.
     */
    public Double getResponseTime() {
        return responseTime;
    }

    public RequestResult setResponseTime(Double responseTime) {
        this.responseTime = responseTime;
        return this;
    }

    public Long getContentLength() {
        return contentLength;
    }

    public RequestResult setContentLength(Long contentLength) {
        this.contentLength = contentLength;
        return this;
    }

    public String getError() {
        return error;
    }

    public RequestResult setError(String error) {
        this.error = error;
        return this;
    }

    /**
     * A status line was received, whatever the code.
     *
     * @return Boolean.
     */
    public boolean isSuccess() {
        return success;
    }

    public RequestResult setSuccess(boolean success) {
        this.success = success;
        return this;
    }
}
