package com.mimecast.wren.routing;

import java.net.URLConnection;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Content type lookup by file extension.
 *
 * <p>Falls back to the JDK file name map and then to <code>application/octet-stream</code>.
 */
public final class MimeTypes {

    /**
     * Generic binary type.
     */
    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> TYPES = new HashMap<>();

    static {
        TYPES.put("html", "text/html; charset=utf-8");
        TYPES.put("htm", "text/html; charset=utf-8");
        TYPES.put("css", "text/css; charset=utf-8");
        TYPES.put("js", "application/javascript; charset=utf-8");
        TYPES.put("json", "application/json; charset=utf-8");
        TYPES.put("txt", "text/plain; charset=utf-8");
        TYPES.put("png", "image/png");
        TYPES.put("jpg", "image/jpeg");
        TYPES.put("jpeg", "image/jpeg");
        TYPES.put("gif", "image/gif");
        TYPES.put("ico", "image/x-icon");
        TYPES.put("svg", "image/svg+xml");
        TYPES.put("pdf", "application/pdf");
    }

    private MimeTypes() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets the content type for a file.
     *
     * @param path File path.
     * @return Content type.
     */
    public static String forPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return OCTET_STREAM;
        }

        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            String type = TYPES.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (type != null) {
                return type;
            }
        }

        String guessed = URLConnection.guessContentTypeFromName(name);
        return guessed != null ? guessed : OCTET_STREAM;
    }
}
