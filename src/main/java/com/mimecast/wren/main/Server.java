package com.mimecast.wren.main;

import com.mimecast.wren.config.server.ServerConfig;
import com.mimecast.wren.http.HttpListener;
import com.mimecast.wren.http.ServerContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;

/**
 * Main server class for the Wren HTTP server.
 *
 * <p>This class is responsible for initializing and managing the server's lifecycle.
 * <p>It loads configuration, builds the shared context, binds the listener and serves until the JVM shuts down.
 *
 * <p>A shutdown hook stops the listener and waits for in-flight connections before the process exits.
 *
 * @see HttpListener
 */
public class Server {
    private static final Logger log = LogManager.getLogger(Server.class);

    private static HttpListener listener;

    /**
     * Initializes and runs the server until shutdown.
     *
     * @param path Configuration file path or null for defaults.
     * @throws ConfigurationException If there is an issue with the configuration file.
     * @throws IOException            If the public directory is missing or the port cannot be bound.
     */
    public static void run(String path) throws ConfigurationException, IOException {
        ServerConfig config = path != null ? new ServerConfig(path) : new ServerConfig();

        listener = new HttpListener(ServerContext.create(config));
        registerShutdownHook();

        listener.bind();
        listener.listen();
    }

    /**
     * Registers a shutdown hook to ensure graceful termination of the server.
     * This hook will be called by the JVM on shutdown.
     */
    private static void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Service is shutting down.");
            if (listener != null) {
                listener.requestShutdown();
                listener.shutdown();
            }
            log.info("Shutdown complete.");
        }, "ShutdownHook"));
    }

    /**
     * Gets the active listener.
     *
     * @return HttpListener instance or null if not started.
     */
    public static HttpListener getListener() {
        return listener;
    }
}
