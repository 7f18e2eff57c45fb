package com.mimecast.wren.http;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported request methods.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST;

    /**
     * Looks up a method by name, case-insensitive.
     *
     * @param name Method token from the request line.
     * @return Optional of HttpMethod, empty when not supported.
     */
    public static Optional<HttpMethod> of(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String upper = name.toUpperCase(Locale.ROOT);
        for (HttpMethod method : values()) {
            if (method.name().equals(upper)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
