/**
 * HTTP engine.
 *
 * <p>{@link com.mimecast.wren.http.HttpListener} accepts connections and hands each one to a
 * {@link com.mimecast.wren.http.ConnectionHandler} on a fixed worker pool.
 * <br>The handler frames the request, parses it with {@link com.mimecast.wren.http.RequestParser},
 * routes it and writes exactly one response before closing the socket.
 *
 * <p>Supported methods are GET, HEAD and POST. Keep-alive, chunked encoding and ranges are not supported.
 */
package com.mimecast.wren.http;
