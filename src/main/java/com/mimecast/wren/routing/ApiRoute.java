package com.mimecast.wren.routing;

import com.mimecast.wren.http.HttpMethod;

import java.util.Optional;

/**
 * API endpoints, one constant per method and path pair.
 *
 * <p>Adding an endpoint means adding a constant here and a branch to the dispatcher switch.
 *
 * @see com.mimecast.wren.endpoints.ApiDispatcher
 */
public enum ApiRoute {
    POST_TEST_RESULTS(HttpMethod.POST, "/api/test-results"),
    GET_TEST_RESULTS(HttpMethod.GET, "/api/test-results"),
    GET_LOGS(HttpMethod.GET, "/api/logs");

    /**
     * Path prefix reserved for the API.
     */
    public static final String PREFIX = "/api/";

    private final HttpMethod method;
    private final String path;

    ApiRoute(HttpMethod method, String path) {
        this.method = method;
        this.path = path;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * Finds the route for an exact method and path pair.
     *
     * @param method HttpMethod.
     * @param path   Decoded request path.
     * @return Optional of ApiRoute.
     */
    public static Optional<ApiRoute> match(HttpMethod method, String path) {
        for (ApiRoute route : values()) {
            if (route.method == method && route.path.equals(path)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
