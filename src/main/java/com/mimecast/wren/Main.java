package com.mimecast.wren;

import com.mimecast.wren.main.ClientCLI;
import com.mimecast.wren.main.ServerCLI;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.commons.cli.help.TextHelpAppendable;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Command line entry point.
 *
 * <p>The first argument picks the mode, everything after it is parsed by that mode.
 *
 * @see ServerCLI
 * @see ClientCLI
 */
public class Main {

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar wren.jar";

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    /**
     * Run modes selected by the first argument.
     */
    enum Mode {
        SERVER("server", "Run as server", ServerCLI::main),
        CLIENT("client", "Run as load client", ClientCLI::main);

        private final String flag;
        private final String description;
        private final ToIntFunction<Main> runner;

        Mode(String flag, String description, ToIntFunction<Main> runner) {
            this.flag = flag;
            this.description = description;
            this.runner = runner;
        }

        static Optional<Mode> of(String arg) {
            return Arrays.stream(values())
                    .filter(mode -> ("--" + mode.flag).equals(arg))
                    .findFirst();
        }
    }

    private final String[] args;
    private final PrintStream out;

    public static void main(String[] args) {
        int code = new Main(args, System.out).run();
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args Command line, mode flag first.
     * @param out  Console output.
     */
    Main(String[] args, PrintStream out) {
        this.args = args;
        this.out = out;
    }

    /**
     * Runs the selected mode.
     *
     * @return Exit code.
     */
    int run() {
        if (args.length == 0) {
            usage("", modeOptions());
            return EXIT_OK;
        }

        Optional<Mode> mode = Mode.of(args[0]);
        if (mode.isEmpty()) {
            log("Unknown mode: " + args[0]);
            usage("", modeOptions());
            return EXIT_USAGE;
        }

        return mode.get().runner.applyAsInt(this);
    }

    private static Options modeOptions() {
        Options options = new Options();
        for (Mode mode : Mode.values()) {
            options.addOption(null, mode.flag, false, mode.description);
        }
        return options;
    }

    /**
     * Parses the arguments following the mode flag.
     * <p>On failure the error and the mode usage are printed.
     *
     * @param options Mode options.
     * @return Optional of CommandLine, empty if the arguments are invalid.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        String[] modeArgs = Arrays.copyOfRange(args, 1, args.length);
        try {
            return Optional.of(new DefaultParser().parse(options, modeArgs));
        } catch (ParseException e) {
            log("Options error: " + e.getMessage());
            usage(args[0], options);
            return Optional.empty();
        }
    }

    /**
     * Prints usage for a set of options.
     *
     * @param mode    Mode flag or empty for the top level.
     * @param options Options instance.
     */
    public void usage(String mode, Options options) {
        StringBuilder help = new StringBuilder();
        HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .setHelpAppendable(new TextHelpAppendable(help))
                .get();
        try {
            formatter.printHelp(mode.isEmpty() ? USAGE : USAGE + " " + mode, "", options, "", true);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log(help.toString());
    }

    /**
     * Console output.
     *
     * @param string Line.
     */
    public void log(String string) {
        out.println(string);
    }
}
