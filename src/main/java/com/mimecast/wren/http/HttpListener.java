package com.mimecast.wren.http;

import com.mimecast.wren.config.server.ServerConfig;
import com.mimecast.wren.logging.ServerLog;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * HTTP socket listener for handling client connections.
 * <p>This class runs a {@link ServerSocket} bound to the configured interface and port.
 * <p>For each accepted connection, it submits a {@link ConnectionHandler} to a fixed size worker pool.
 * <br>When all workers are busy connections wait in the pool queue, they are never dropped.
 *
 * <p>The accept loop uses a short accept timeout so it notices a shutdown request promptly.
 * <br>{@link #shutdown()} closes the listening socket first and then waits for in-flight connections to finish.
 *
 * @see ConnectionHandler
 * @see LifecycleState
 */
public class HttpListener {
    private static final Logger log = LogManager.getLogger(HttpListener.class);

    /**
     * The underlying server socket that listens for incoming connections.
     */
    private ServerSocket listener;

    /**
     * Worker pool for handling client connections.
     */
    private final ThreadPoolExecutor executor;

    /**
     * Lifecycle state, read by the accept loop.
     */
    private volatile LifecycleState state = LifecycleState.STARTING;

    private final Object lifecycleLock = new Object();
    private final ServerContext context;
    private final ServerConfig config;
    private final ServerLog serverLog;
    private Thread acceptor;

    /**
     * Constructs a new HttpListener instance.
     *
     * @param context ServerContext instance holding configuration and shared state.
     */
    public HttpListener(ServerContext context) {
        this.context = context;
        this.config = context.getConfig();
        this.serverLog = context.getServerLog();

        int threads = Math.max(1, config.getMaxThreads());
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new BasicThreadFactory.Builder()
                        .namingPattern("HTTPWorker-%d")
                        .build()
        );
    }

    /**
     * Binds the listening socket.
     *
     * @throws IOException Unable to bind.
     */
    public void bind() throws IOException {
        ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(InetAddress.getByName(config.getBind()), config.getPort()), config.getBacklog());
            socket.setSoTimeout(config.getAcceptTimeout());
        } catch (IOException e) {
            socket.close();
            throw e;
        }

        synchronized (lifecycleLock) {
            listener = socket;
            if (state == LifecycleState.STARTING) {
                state = LifecycleState.RUNNING;
            }
        }
        serverLog.info("Server listening on http://{}:{}", config.getBind(), getLocalPort());
        serverLog.info("Public dir: {}", context.getRouter().getGuard().getRoot());
        serverLog.info("Max threads: {}", executor.getMaximumPoolSize());
        if (context.getFailureInjector().isEnabled()) {
            serverLog.warn("Failure injection enabled at rate {}", context.getFailureInjector().getRate());
        }
    }

    /**
     * Binds and runs the accept loop on a dedicated thread.
     *
     * @throws IOException Unable to bind.
     */
    public void start() throws IOException {
        bind();
        acceptor = new Thread(this::listen, "HTTPListener-" + getLocalPort());
        acceptor.start();
    }

    /**
     * Runs the accept loop on the calling thread until shutdown.
     * <p>Requires {@link #bind()} to have been called.
     */
    public void listen() {
        if (listener == null) {
            throw new IllegalStateException("Listener not bound");
        }

        try {
            acceptConnections();
        } finally {
            shutdown();
        }
    }

    /**
     * Accepts incoming connections in a loop until a shutdown is requested.
     */
    private void acceptConnections() {
        while (state == LifecycleState.RUNNING) {
            Socket sock;
            try {
                sock = listener.accept();
            } catch (SocketTimeoutException e) {
                continue;
            } catch (SocketException e) {
                if (state == LifecycleState.RUNNING) {
                    serverLog.error("Error in socket exchange: {}", e.getMessage());
                }
                break;
            } catch (IOException e) {
                if (state == LifecycleState.RUNNING) {
                    serverLog.error("Accept error: {}", e.getMessage());
                }
                continue;
            }

            log.debug("Accepted connection from {}:{}", sock.getInetAddress().getHostAddress(), sock.getPort());
            try {
                executor.execute(new ConnectionHandler(sock, context));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool closed, dropping connection from {}", sock.getInetAddress().getHostAddress());
                closeQuietly(sock);
            }
        }
    }

    /**
     * Requests the accept loop to stop without waiting.
     * <p>The loop notices within one accept timeout.
     */
    public void requestShutdown() {
        synchronized (lifecycleLock) {
            if (state == LifecycleState.STARTING || state == LifecycleState.RUNNING) {
                state = LifecycleState.SHUTTING_DOWN;
                serverLog.info("Shutdown requested");
            }
        }
    }

    /**
     * Initiates a graceful shutdown and waits for it to complete.
     * <p>Closes the listening socket so no new connections are accepted,
     * then waits for all dispatched connections to be handled.
     * <p>Safe to call more than once and from several threads.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (state == LifecycleState.STOPPED) {
                return;
            }
            state = LifecycleState.SHUTTING_DOWN;
            serverLog.info("Stopping server");

            if (listener != null && !listener.isClosed()) {
                try {
                    listener.close();
                } catch (IOException e) {
                    log.info("Listener for port {} already closed.", config.getPort());
                }
            }

            executor.shutdown();
            boolean interrupted = false;
            try {
                while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    log.debug("Waiting for {} active connections", executor.getActiveCount());
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }

            state = LifecycleState.STOPPED;
            serverLog.info("Server stopped");
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Waits for the accept thread started by {@link #start()} to exit.
     *
     * @throws InterruptedException Interrupted while waiting.
     */
    public void awaitTermination() throws InterruptedException {
        if (acceptor != null) {
            acceptor.join();
        }
    }

    /**
     * Gets the bound port, useful when configured with port zero.
     *
     * @return Port number or -1 if not bound.
     */
    public int getLocalPort() {
        return listener != null ? listener.getLocalPort() : -1;
    }

    /**
     * Gets lifecycle state.
     *
     * @return LifecycleState.
     */
    public LifecycleState getState() {
        return state;
    }

    /**
     * Gets the number of currently active workers.
     *
     * @return Active thread count.
     */
    public int getActiveThreads() {
        return executor.getActiveCount();
    }

    /**
     * Gets the server context.
     *
     * @return ServerContext instance.
     */
    public ServerContext getContext() {
        return context;
    }

    private static void closeQuietly(Socket sock) {
        try {
            sock.close();
        } catch (IOException e) {
            log.debug("Error closing rejected connection: {}", e.getMessage());
        }
    }
}
