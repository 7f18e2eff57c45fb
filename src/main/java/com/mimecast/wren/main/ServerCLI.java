package com.mimecast.wren.main;

import com.mimecast.wren.Main;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.util.Optional;

/**
 * <code>--server</code> mode.
 * <p>Blocks serving until the process is stopped.
 */
public class ServerCLI {
    private static final Logger log = LogManager.getLogger(ServerCLI.class);

    private ServerCLI() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Runs the server.
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
            main.usage("--server", options);
            return Main.EXIT_OK;
        }

        try {
            Server.run(cmd.getOptionValue("conf"));
            return Main.EXIT_OK;
        } catch (ConfigurationException e) {
            log.fatal("Configuration error: {}", e.getMessage());
            main.log("Configuration error: " + e.getMessage());
        } catch (IOException e) {
            log.fatal("Server failed to start: {}", e.getMessage());
            main.log("Server failed to start: " + e.getMessage());
        }
        return Main.EXIT_ERROR;
    }

    static Options options() {
        Options options = new Options();
        options.addOption("c", "conf", true, "Path to configuration file");
        options.addOption("h", "help", false, "Show usage help");
        return options;
    }
}
