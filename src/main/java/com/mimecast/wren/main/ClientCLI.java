package com.mimecast.wren.main;

import com.mimecast.wren.Main;
import com.mimecast.wren.client.LoadClient;
import com.mimecast.wren.client.RequestResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * <code>--client</code> mode.
 * <p>Drives one {@link LoadClient} run and optionally publishes it.
 */
public class ClientCLI {

    /**
     * Paths requested when none are given.
     */
    static final List<String> DEFAULT_PATHS = List.of("/", "/index.html", "/nonexistent.html", "/api/logs");

    private ClientCLI() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Runs the client.
     *
     * @param main Main instance.
     * @return Exit code.
     */
    public static int main(Main main) {
        Options options = options();
        Optional<CommandLine> opt = main.parseArgs(options);
        if (opt.isEmpty()) {
            return Main.EXIT_USAGE;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            main.usage("--client", options);
            return Main.EXIT_OK;
        }

        String host = cmd.getOptionValue("host", "127.0.0.1");
        int port = NumberUtils.toInt(cmd.getOptionValue("port"), 5000);
        int requests = NumberUtils.toInt(cmd.getOptionValue("requests"), 20);
        int threads = NumberUtils.toInt(cmd.getOptionValue("threads"), 5);
        String method = cmd.hasOption("head") ? "HEAD" : "GET";
        List<String> paths = cmd.hasOption("path") ? Arrays.asList(cmd.getOptionValues("path")) : DEFAULT_PATHS;

        LoadClient client = new LoadClient(host, port);
        try {
            List<RequestResult> results = client.run(paths, requests, threads, method);
            long ok = results.stream().filter(RequestResult::isSuccess).count();
            main.log("Requests: " + results.size() + ", successful: " + ok + ", failed: " + (results.size() - ok));

            if (cmd.hasOption("publish") && !client.publish(results)) {
                main.log("Results not published");
                return Main.EXIT_ERROR;
            }
            return Main.EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            main.log("Client interrupted");
            return Main.EXIT_ERROR;
        }
    }

    static Options options() {
        Options options = new Options();
        options.addOption("x", "host", true, "Server host (default 127.0.0.1)");
        options.addOption("p", "port", true, "Server port (default 5000)");
        options.addOption("n", "requests", true, "Number of requests (default 20)");
        options.addOption("t", "threads", true, "Concurrent threads (default 5)");
        options.addOption(null, "path", true, "Path to request, repeatable");
        options.addOption(null, "head", false, "Use HEAD instead of GET");
        options.addOption(null, "publish", false, "Publish results to the server");
        options.addOption("h", "help", false, "Show usage help");
        return options;
    }
}
