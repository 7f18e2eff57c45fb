package com.mimecast.wren.config.server;

import com.mimecast.wren.config.ConfigFoundation;

import javax.naming.ConfigurationException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to server configuration.
 * <p>Instances are read once at startup and not modified thereafter.
 *
 * @see FailureConfig
 */
public class ServerConfig extends ConfigFoundation {

    /**
     * Constructs a new ServerConfig instance with defaults only.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws ConfigurationException Unable to read or parse file.
     */
    public ServerConfig(String path) throws ConfigurationException {
        super(path);
    }

    /**
     * Gets bind address.
     *
     * @return Bind address string.
     */
    public String getBind() {
        return getStringProperty("bind", "127.0.0.1");
    }

    /**
     * Gets listening port.
     * <p>Zero binds an ephemeral port.
     *
     * @return Port number.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 5000L));
    }

    /**
     * Gets worker pool size.
     *
     * @return Number of worker threads.
     */
    public int getMaxThreads() {
        return Math.toIntExact(getLongProperty("maxThreads", 10L));
    }

    /**
     * Gets listen backlog size.
     *
     * @return Backlog size.
     */
    public int getBacklog() {
        return Math.toIntExact(getLongProperty("backlog", 50L));
    }

    /**
     * Gets public directory that static files are served from.
     *
     * @return Directory path.
     */
    public String getPublicDir() {
        return getStringProperty("publicDir", "public");
    }

    /**
     * Gets client socket read timeout.
     * <p>Configured in seconds, clamped to what a socket timeout can hold.
     *
     * @return Time in milliseconds.
     */
    public int getReadTimeoutMillis() {
        long seconds = Math.max(0L, getLongProperty("readTimeout", 30L));
        return (int) Math.min(Integer.MAX_VALUE, TimeUnit.SECONDS.toMillis(seconds));
    }

    /**
     * Gets listener accept timeout.
     * <p>Bounds how long the accept loop takes to notice a shutdown request.
     *
     * @return Time in milliseconds.
     */
    public int getAcceptTimeout() {
        return Math.toIntExact(getLongProperty("acceptTimeout", 1000L));
    }

    /**
     * Gets socket read chunk size.
     *
     * @return Size in bytes.
     */
    public int getChunkSize() {
        return Math.toIntExact(getLongProperty("chunkSize", 8192L));
    }

    /**
     * Gets maximum accepted request body size.
     *
     * @return Size in bytes.
     */
    public int getMaxBodySize() {
        return Math.toIntExact(getLongProperty("maxBodySize", 10485760L)); // 10 MB.
    }

    /**
     * Gets the number of log lines kept in memory for the logs API.
     *
     * @return Line count.
     */
    public int getLogBufferSize() {
        return Math.toIntExact(getLongProperty("logBufferSize", 500L));
    }

    /**
     * Gets the file served for the root path.
     *
     * @return File name relative to the public directory.
     */
    public String getIndexPage() {
        return getStringProperty("indexPage", "index.html");
    }

    /**
     * Gets the page served as content of 404 responses.
     *
     * @return File name relative to the public directory.
     */
    public String getNotFoundPage() {
        return getStringProperty("notFoundPage", "404.html");
    }

    /**
     * Gets failure injection configuration.
     *
     * @return FailureConfig instance.
     */
    public FailureConfig getFailureInjection() {
        return new FailureConfig(getMapProperty("failureInjection"));
    }
}
