package com.mimecast.wren.routing;

import com.mimecast.wren.http.HttpStatus;

import java.nio.file.Path;

/**
 * Routing decision for one request.
 *
 * <p>A closed set of outcomes produced by the {@link Router} and consumed once by the connection handler.
 */
public sealed interface ResolvedTarget permits ResolvedTarget.StaticFile, ResolvedTarget.ApiCall, ResolvedTarget.Rejected {

    /**
     * File inside the sandbox to send with the given status.
     * <p>Status is 404 when the file is the not found page.
     *
     * @param path   Canonical file path.
     * @param status Response status.
     */
    record StaticFile(Path path, HttpStatus status) implements ResolvedTarget {
    }

    /**
     * API route to dispatch.
     *
     * @param route ApiRoute.
     */
    record ApiCall(ApiRoute route) implements ResolvedTarget {
    }

    /**
     * Request refused with a plain text message.
     *
     * @param status  Response status.
     * @param message Response text.
     */
    record Rejected(HttpStatus status, String message) implements ResolvedTarget {
    }
}
