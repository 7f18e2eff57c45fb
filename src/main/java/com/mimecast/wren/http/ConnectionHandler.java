package com.mimecast.wren.http;

import com.mimecast.wren.logging.ServerLog;
import com.mimecast.wren.routing.MimeTypes;
import com.mimecast.wren.routing.ResolvedTarget;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Optional;

/**
 * Handles one accepted connection end to end.
 *
 * <p>Reads until the request is framed, parses, routes or injects a failure, responds and closes.
 * <br>Exactly one request is served per connection.
 *
 * <p>Error policy:
 * <ul>
 *     <li>No bytes received: warning logged, socket closed without a response.</li>
 *     <li>Parse errors: 400 or 405 response.</li>
 *     <li>Unexpected failures once parsed: logged with the client address and answered with a best-effort 500.</li>
 * </ul>
 * <p>Nothing is thrown to the worker pool and the socket is closed on every path.
 *
 * @see HttpListener
 */
public class ConnectionHandler implements Runnable {
    private static final Logger log = LogManager.getLogger(ConnectionHandler.class);

    /**
     * Upper bound for the request line and headers.
     */
    static final int MAX_HEADER_SIZE = 65536;

    private final Socket socket;
    private final ServerContext context;
    private final ServerLog serverLog;
    private final String client;

    /**
     * Constructs a new ConnectionHandler instance.
     *
     * @param socket  Accepted socket.
     * @param context ServerContext instance.
     */
    public ConnectionHandler(Socket socket, ServerContext context) {
        this.socket = socket;
        this.context = context;
        this.serverLog = context.getServerLog();
        this.client = socket.getInetAddress().getHostAddress() + ":" + socket.getPort();
    }

    @Override
    public void run() {
        try (Socket sock = socket) {
            sock.setSoTimeout(context.getConfig().getReadTimeoutMillis());
            OutputStream out = sock.getOutputStream();

            Buffered buffered = read(sock.getInputStream());
            if (buffered.length() == 0) {
                serverLog.warn("{} - No request received", client);
                return;
            }
            if (buffered.oversized()) {
                serverLog.warn("{} - Request body exceeds {} bytes", client, context.getConfig().getMaxBodySize());
                context.getWriter().write(out, HttpResponse.text(HttpStatus.BAD_REQUEST, "Request body too large\n"), false);
                return;
            }

            ParseResult result = context.getParser().parse(buffered.data(), buffered.length());
            if (!result.isSuccess()) {
                ParseError error = result.getError();
                serverLog.warn("{} - {}: {}", client, error.getStatus().getCode(), error.getMessage().trim());
                context.getWriter().write(out, error.toResponse(), false);
                return;
            }

            HttpRequest request = result.getRequest();
            serverLog.info("{} - {}", client, request);

            HttpResponse response;
            try {
                response = process(request);
            } catch (Exception e) {
                serverLog.error("{} - Error processing request: {}", client, e.getMessage());
                log.debug("Processing failure for {}", client, e);
                response = HttpResponse.text(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error\n");
            }

            if (context.getWriter().write(out, response, request.isHead())) {
                serverLog.info("{} - {}: {} ({} bytes)", client, response.getCode(), request.getPath(),
                        response.getBody().length);
            }

        } catch (IOException e) {
            serverLog.error("{} - Connection error: {}", client, e.getMessage());
        } catch (RuntimeException e) {
            serverLog.error("{} - Unexpected connection failure: {}", client, e.getMessage());
            log.debug("Unexpected failure for {}", client, e);
        }
    }

    /**
     * Produces the response for a parsed request.
     *
     * @param request HttpRequest instance.
     * @return HttpResponse instance.
     * @throws IOException Unable to read a static file.
     */
    HttpResponse process(HttpRequest request) throws IOException {
        Optional<HttpResponse> injected = context.getFailureInjector().draw();
        if (injected.isPresent()) {
            serverLog.warn("{} - Injected failure: {} {}", client, injected.get().getCode(), injected.get().getReason());
            return injected.get();
        }

        ResolvedTarget target = context.getRouter().route(request);

        if (target instanceof ResolvedTarget.StaticFile file) {
            byte[] content = Files.readAllBytes(file.path());
            if (file.status() == HttpStatus.NOT_FOUND) {
                serverLog.info("{} - 404: {}", client, request.getPath());
            }
            return new HttpResponse(file.status(), MimeTypes.forPath(file.path()), content);
        }

        if (target instanceof ResolvedTarget.ApiCall call) {
            return context.getDispatcher().dispatch(call.route(), request);
        }

        ResolvedTarget.Rejected rejected = (ResolvedTarget.Rejected) target;
        if (rejected.status() == HttpStatus.FORBIDDEN) {
            serverLog.warn("{} - Access denied: {}", client, request.getPath());
        }
        return HttpResponse.text(rejected.status(), rejected.message());
    }

    /**
     * Reads the request in chunks.
     * <p>Stops at end of stream, on read timeout, or once the headers and the declared body are buffered.
     *
     * @param in Socket input stream.
     * @return Buffered bytes.
     * @throws IOException Unable to read.
     */
    Buffered read(InputStream in) throws IOException {
        int chunkSize = Math.max(1, context.getConfig().getChunkSize());
        int maxBodySize = context.getConfig().getMaxBodySize();

        byte[] chunk = new byte[chunkSize];
        byte[] data = new byte[chunkSize];
        int length = 0;
        int headerEnd = -1;
        int expected = -1;

        while (expected < 0 || length < expected) {
            int read;
            try {
                read = in.read(chunk);
            } catch (SocketTimeoutException e) {
                log.debug("{} - Read timeout after {} bytes", client, length);
                break;
            }
            if (read < 0) {
                break;
            }

            if (length + read > data.length) {
                data = Arrays.copyOf(data, Math.max(data.length * 2, length + read));
            }
            System.arraycopy(chunk, 0, data, length, read);
            int searchFrom = Math.max(0, length - RequestParser.HEADER_TERMINATOR.length + 1);
            length += read;

            if (headerEnd < 0) {
                headerEnd = RequestParser.headerEnd(data, searchFrom, length);
                if (headerEnd < 0 && length > MAX_HEADER_SIZE) {
                    log.debug("{} - Header block exceeds {} bytes", client, MAX_HEADER_SIZE);
                    break;
                }
                if (headerEnd >= 0) {
                    int contentLength = RequestParser.declaredContentLength(data, headerEnd);
                    if (contentLength > maxBodySize) {
                        return new Buffered(data, length, true);
                    }
                    expected = headerEnd + RequestParser.HEADER_TERMINATOR.length + contentLength;
                }
            }
        }

        return new Buffered(data, length, false);
    }

    /**
     * Bytes read from the connection.
     *
     * @param data      Buffer.
     * @param length    Number of valid bytes.
     * @param oversized Declared body exceeds the configured maximum.
     */
    record Buffered(byte[] data, int length, boolean oversized) {
    }
}
