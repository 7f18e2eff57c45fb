/**
 * The main package for Wren, a small concurrent static file server with a telemetry API.
 *
 * <p>Wren serves files from a sandboxed public directory over a minimal HTTP/1.1 subset,
 * <br>one request per connection, on a fixed pool of worker threads.
 * <br>It also exposes a JSON API for posting and fetching load test results and for reading recent log lines.
 *
 * <p>A built-in load client fires concurrent requests at a running server and can publish the results back to it.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar wren.jar
 *      Static file server with telemetry API and load client
 *
 *      usage:   [--client] [--server]
 *      --client   Run as load client
 *      --server   Run as server
 * </pre>
 *
 * <h2>CLI usage server:</h2>
 * <pre>
 *      $ java -jar wren.jar --server -c cfg/server.json5
 *
 *      usage:   [-c &lt;arg&gt;] [-h]
 *      -c,--conf &lt;arg&gt;   Path to configuration file
 *      -h,--help         Show usage help
 * </pre>
 *
 * <h2>CLI usage client:</h2>
 * <pre>
 *      $ java -jar wren.jar --client -n 50 -t 10 --path / --path /nope --publish
 *
 *      usage:   [-h] [--head] [-n &lt;arg&gt;] [-p &lt;arg&gt;] [--path &lt;arg&gt;] [--publish] [-t &lt;arg&gt;] [-x &lt;arg&gt;]
 * </pre>
 */
package com.mimecast.wren;
