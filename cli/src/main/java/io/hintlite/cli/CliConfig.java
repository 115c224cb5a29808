package io.hintlite.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hintlite.cli.dto.ConfigFile;
import io.hintlite.cli.format.OutputFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Invocation settings parsed from CLI args, optionally layered over a JSON
 * config file.
 *
 * Precedence: command line, then config file, then built-in defaults.
 *
 *  - command:     what to do (generate, reduce, init)
 *  - keys:        alphabet used to build labels
 *  - typed:       keys typed so far, replayed by {@code reduce}
 *  - format:      output format (plain, json, kak)
 *  - maxWidth:    labels are cut to this many characters on display, 0 = no limit
 *  - abortSymbol: key that cancels the session
 *  - verbose:     log at FINE instead of INFO
 *  - help:        print usage and stop
 */
public record CliConfig(
        Command command,
        String keys,
        List<Integer> typed,
        OutputFormat format,
        int maxWidth,
        int abortSymbol,
        boolean verbose,
        boolean help
) {

    public enum Command { GENERATE, REDUCE, INIT }

    static final String DEFAULT_KEYS = "asdfghjkl";

    public CliConfig {
        typed = List.copyOf(typed);
        if (maxWidth < 0) throw new IllegalArgumentException("max-width must be >= 0, got " + maxWidth);
        if (!help && command == null) throw new IllegalArgumentException("missing command");
    }

    /**
     * Parse the command line.
     *
     * Supported flags:
     *   --keys,      -k <keys>
     *   --typed,     -t <keys>     (use <esc> for the escape key)
     *   --format,    -f plain|json|kak
     *   --max-width, -w <n>
     *   --abort,     -a <key>
     *   --config,    -c <path>
     *   --verbose,   -v
     *   --help,      -h
     *
     * @throws IllegalArgumentException on unknown options, missing values or
     *         an unreadable config file
     */
    public static CliConfig fromArgs(String[] args) {
        Command command = null;
        String keys = null;
        String typed = null;
        String format = null;
        Integer maxWidth = null;
        String abort = null;
        String configPath = null;
        boolean verbose = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--verbose", "-v" -> verbose = true;

                case "--keys", "-k" -> {
                    ensureValue(args, i);
                    keys = args[++i];
                }

                case "--typed", "-t" -> {
                    ensureValue(args, i);
                    typed = args[++i];
                }

                case "--format", "-f" -> {
                    ensureValue(args, i);
                    format = args[++i];
                }

                case "--max-width", "-w" -> {
                    ensureValue(args, i);
                    try {
                        maxWidth = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("invalid max-width: " + args[i]);
                    }
                }

                case "--abort", "-a" -> {
                    ensureValue(args, i);
                    abort = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "generate" -> command = setOnce(command, Command.GENERATE);
                case "reduce" -> command = setOnce(command, Command.REDUCE);
                case "init" -> command = setOnce(command, Command.INIT);

                default -> throw new IllegalArgumentException("unknown option: " + args[i]);
            }
        }

        ConfigFile file = configPath == null ? new ConfigFile() : loadConfigFile(Path.of(configPath));

        String resolvedKeys = firstNonNull(keys, file.keys, DEFAULT_KEYS);
        String resolvedFormat = firstNonNull(format, file.format, "plain");
        int resolvedMaxWidth = firstNonNull(maxWidth, file.maxWidth, 0);
        String resolvedAbort = firstNonNull(abort, file.abort, KeyNotation.ESC_NAME);

        return new CliConfig(
                command,
                resolvedKeys,
                typed == null ? List.of() : KeyNotation.parse(typed),
                OutputFormat.parse(resolvedFormat),
                resolvedMaxWidth,
                KeyNotation.single(resolvedAbort),
                verbose,
                help
        );
    }

    /**
     * Read a JSON config file. Unknown fields are rejected.
     */
    public static ConfigFile loadConfigFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return mapper.readValue(path.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("failed to load config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static Command setOnce(Command current, Command next) {
        if (current != null) {
            throw new IllegalArgumentException("more than one command: " + current + ", " + next);
        }
        return next;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T v : values) {
            if (v != null) return v;
        }
        throw new IllegalStateException("no default");
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("missing value for option: " + args[i]);
        }
    }

    static String usage() {
        return """
            Usage: hintlite [options] <generate|reduce|init>

            Targets are read from standard input as whitespace-separated
            line.column or line.column,line.column entries.

            Commands:
              generate            Label every target
              reduce              Replay --typed keys and print what is left
              init                Print the Kakoune init script

            Options:
              --keys,      -k   Keys used to build hints (default: asdfghjkl)
              --typed,     -t   Keys typed so far, <esc> for escape (reduce only)
              --format,    -f   plain, json or kak (default: plain)
              --max-width, -w   Cut displayed hints to n characters (default: 0, no limit)
              --abort,     -a   Key that cancels (default: <esc>)
              --config,    -c   Path to JSON config file (optional)
              --verbose,   -v   Log debug output to stderr
              --help,      -h   Show this help message
            """;
    }
}
