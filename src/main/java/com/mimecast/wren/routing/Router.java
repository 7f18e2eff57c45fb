package com.mimecast.wren.routing;

import com.mimecast.wren.http.HttpRequest;
import com.mimecast.wren.http.HttpStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Request router.
 *
 * <p>Decides between API dispatch, a static file and a rejection:
 * <ul>
 *     <li><code>/api/</code> paths skip the sandbox and match an exact {@link ApiRoute}, otherwise 404.</li>
 *     <li><code>/</code> serves the index page.</li>
 *     <li>A trailing slash is retried without it so <code>/about.html/</code> still finds the file.</li>
 *     <li>Paths escaping the sandbox and anything that is not a regular file are 403.</li>
 *     <li>Missing files are 404 with the not found page as content when it exists.</li>
 * </ul>
 *
 * @see PathGuard
 */
public class Router {
    private static final Logger log = LogManager.getLogger(Router.class);

    private final PathGuard guard;
    private final String indexPage;
    private final String notFoundPage;

    /**
     * Constructs a new Router instance.
     *
     * @param guard        PathGuard instance.
     * @param indexPage    File served for the root path.
     * @param notFoundPage File served as 404 content.
     */
    public Router(PathGuard guard, String indexPage, String notFoundPage) {
        this.guard = guard;
        this.indexPage = indexPage;
        this.notFoundPage = notFoundPage;
    }

    /**
     * Routes a request.
     *
     * @param request HttpRequest instance.
     * @return ResolvedTarget.
     */
    public ResolvedTarget route(HttpRequest request) {
        String path = request.getPath();

        if (path.startsWith(ApiRoute.PREFIX)) {
            return ApiRoute.match(request.getMethod(), path)
                    .<ResolvedTarget>map(ResolvedTarget.ApiCall::new)
                    .orElseGet(() -> new ResolvedTarget.Rejected(HttpStatus.NOT_FOUND, "API endpoint not found\n"));
        }

        if (path.isEmpty() || path.equals("/")) {
            path = "/" + indexPage;
        }

        if (path.length() > 1 && path.endsWith("/")) {
            String stripped = path.replaceAll("/+$", "");
            Optional<Path> file = guard.resolve(stripped);
            if (file.isPresent() && Files.isRegularFile(file.get())) {
                log.debug("Trailing slash stripped: {} -> {}", path, stripped);
                return new ResolvedTarget.StaticFile(file.get(), HttpStatus.OK);
            }
        }

        Optional<Path> resolved = guard.resolve(path);
        if (resolved.isEmpty()) {
            return new ResolvedTarget.Rejected(HttpStatus.FORBIDDEN, "Access denied\n");
        }

        Path target = resolved.get();
        if (!Files.exists(target)) {
            return notFound();
        }
        if (!Files.isRegularFile(target)) {
            return new ResolvedTarget.Rejected(HttpStatus.FORBIDDEN, "Not a file\n");
        }
        return new ResolvedTarget.StaticFile(target, HttpStatus.OK);
    }

    /**
     * Not found outcome.
     *
     * @return StaticFile of the not found page with 404 status, or a plain 404 rejection.
     */
    private ResolvedTarget notFound() {
        Optional<Path> page = guard.resolve(notFoundPage);
        if (page.isPresent() && Files.isRegularFile(page.get())) {
            return new ResolvedTarget.StaticFile(page.get(), HttpStatus.NOT_FOUND);
        }
        return new ResolvedTarget.Rejected(HttpStatus.NOT_FOUND, "File not found\n");
    }

    /**
     * Gets the path guard.
     *
     * @return PathGuard instance.
     */
    public PathGuard getGuard() {
        return guard;
    }
}
