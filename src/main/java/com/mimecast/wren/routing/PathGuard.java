package com.mimecast.wren.routing;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Sandbox path resolver.
 *
 * <p>Resolves request paths against a canonical root directory and rejects anything that would land outside it.
 * <p>Two checks are applied:
 * <ul>
 *     <li>Lexical, before touching the filesystem: parent directory segments and absolute paths are rejected.</li>
 *     <li>Canonical: the joined path is resolved through symlinks and must be the root or a descendant.</li>
 * </ul>
 */
public class PathGuard {
    private static final Logger log = LogManager.getLogger(PathGuard.class);

    private final Path root;

    /**
     * Constructs a new PathGuard instance.
     *
     * @param root Sandbox root directory, must exist.
     * @throws IOException Root does not exist or cannot be resolved.
     */
    public PathGuard(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Public directory not found: " + root.toAbsolutePath());
        }
        this.root = root.toRealPath();
    }

    /**
     * Gets the canonical root.
     *
     * @return Path.
     */
    public Path getRoot() {
        return root;
    }

    /**
     * Resolves a request path inside the sandbox.
     *
     * @param requested Decoded request path.
     * @return Optional of canonical path, empty if rejected.
     */
    public Optional<Path> resolve(String requested) {
        if (requested == null) {
            return Optional.empty();
        }

        String relative = requested;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }

        for (String segment : relative.split("[/\\\\]")) {
            if (segment.equals("..")) {
                log.debug("Rejected parent segment: {}", requested);
                return Optional.empty();
            }
        }

        Path candidate;
        try {
            Path rel = Paths.get(relative);
            if (rel.isAbsolute() || rel.getRoot() != null) {
                log.debug("Rejected absolute path: {}", requested);
                return Optional.empty();
            }
            candidate = canonicalize(root.resolve(rel));
        } catch (InvalidPathException | IOException e) {
            log.debug("Rejected unresolvable path: {} ({})", requested, e.getMessage());
            return Optional.empty();
        }

        if (!candidate.startsWith(root)) {
            log.debug("Rejected path outside root: {} -> {}", requested, candidate);
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Canonicalizes a path that may not exist.
     * <p>The deepest existing ancestor is resolved through symlinks and the missing tail appended.
     *
     * @param path Absolute path.
     * @return Canonical path.
     * @throws IOException Unable to resolve an existing ancestor.
     */
    private static Path canonicalize(Path path) throws IOException {
        Path normalized = path.normalize();
        Deque<Path> missing = new ArrayDeque<>();
        Path existing = normalized;
        while (existing != null && !Files.exists(existing)) {
            missing.push(existing.getFileName());
            existing = existing.getParent();
        }
        if (existing == null) {
            return normalized;
        }

        Path resolved = existing.toRealPath();
        while (!missing.isEmpty()) {
            resolved = resolved.resolve(missing.pop());
        }
        return resolved;
    }
}
