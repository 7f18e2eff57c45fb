package com.mimecast.wren.http;

import com.mimecast.wren.chaos.FailureInjector;
import com.mimecast.wren.config.server.ServerConfig;
import com.mimecast.wren.endpoints.ApiDispatcher;
import com.mimecast.wren.endpoints.TestResultsStore;
import com.mimecast.wren.logging.LogBuffer;
import com.mimecast.wren.logging.ServerLog;
import com.mimecast.wren.routing.PathGuard;
import com.mimecast.wren.routing.Router;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Collaborators shared by all connections of one listener.
 *
 * <p>Holds the mutable shared state (log buffer and test results) as owned instances rather than globals
 * so several servers can coexist in one JVM, as tests do.
 *
 * @see ConnectionHandler
 */
public class ServerContext {

    /**
     * Server header value.
     */
    public static final String SERVER_NAME = "Wren";

    private final ServerConfig config;
    private final ServerLog serverLog;
    private final TestResultsStore resultsStore;
    private final RequestParser parser;
    private final Router router;
    private final ResponseWriter writer;
    private final ApiDispatcher dispatcher;
    private final FailureInjector failureInjector;

    /**
     * Constructs a new ServerContext instance.
     *
     * @param config          ServerConfig instance.
     * @param serverLog       ServerLog instance.
     * @param resultsStore    TestResultsStore instance.
     * @param router          Router instance.
     * @param failureInjector FailureInjector instance.
     */
    public ServerContext(ServerConfig config, ServerLog serverLog, TestResultsStore resultsStore,
                         Router router, FailureInjector failureInjector) {
        this.config = config;
        this.serverLog = serverLog;
        this.resultsStore = resultsStore;
        this.router = router;
        this.failureInjector = failureInjector;
        this.parser = new RequestParser();
        this.writer = new ResponseWriter(SERVER_NAME);
        this.dispatcher = new ApiDispatcher(resultsStore, serverLog.getBuffer());
    }

    /**
     * Builds a context from configuration with fresh shared state.
     *
     * @param config ServerConfig instance.
     * @return ServerContext instance.
     * @throws IOException Public directory does not exist.
     */
    public static ServerContext create(ServerConfig config) throws IOException {
        ServerLog serverLog = new ServerLog(new LogBuffer(config.getLogBufferSize()));
        Router router = new Router(new PathGuard(Paths.get(config.getPublicDir())),
                config.getIndexPage(), config.getNotFoundPage());
        return new ServerContext(config, serverLog, new TestResultsStore(), router,
                new FailureInjector(config.getFailureInjection()));
    }

    public ServerConfig getConfig() {
        return config;
    }

    public ServerLog getServerLog() {
        return serverLog;
    }

    public TestResultsStore getResultsStore() {
        return resultsStore;
    }

    public RequestParser getParser() {
        return parser;
    }

    public Router getRouter() {
        return router;
    }

    public ResponseWriter getWriter() {
        return writer;
    }

    public ApiDispatcher getDispatcher() {
        return dispatcher;
    }

    public FailureInjector getFailureInjector() {
        return failureInjector;
    }
}
