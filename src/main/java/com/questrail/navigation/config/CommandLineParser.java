package com.questrail.navigation.config;

import com.questrail.navigation.api.Position;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * CommandLineParser
 * -----------------------------------------------------------------------------
 * Turns command-line arguments into a {@link NavigationConfig}.
 *
 * <p>Options take their value either as the next argument or inline
 * ({@code --map=map3.csv}). Every option is optional; omitted ones keep the
 * {@link NavigationConfig} defaults. Malformed input raises
 * {@link IllegalArgumentException} with a message naming the option.</p>
 */
public final class CommandLineParser
{
    public static final String USAGE = String.join("\n",
            "Usage: heuristic-navigation [options]",
            "  --dir <path>            map directory (default: " + NavigationConfig.DEFAULT_MAP_DIRECTORY + ")",
            "  --map <file>            map file name (default: " + NavigationConfig.DEFAULT_MAP_NAME + ")",
            "  --init <row,col>        start position (default: 2,2)",
            "  --goal <row,col>        goal position (default: 21,19)",
            "  --controller [bool]     exchange each step with a controller (alias: --yarp; default: false)",
            "  --target <host:port>    controller command address (default: 127.0.0.1:10000)",
            "  --response <host:port>  local acknowledgement address (default: 127.0.0.1:10001)",
            "  --ack-timeout <millis>  acknowledgement bound, 0 waits forever (default: 0)",
            "  --max-steps <n>         stop after n moves, 0 for no extra bound (default: 0)",
            "  --help                  print this text");

    /**
     * Outcome of parsing.
     *
     * @param config        the resulting configuration
     * @param helpRequested whether {@code --help} was given
     */
    public record Invocation(NavigationConfig config, boolean helpRequested) {
        public Invocation {
            Objects.requireNonNull(config, "config");
        }
    }

    public Invocation parse(String... args)
    {
        Objects.requireNonNull(args, "args");

        NavigationConfig.Builder builder = NavigationConfig.builder();
        Duration ackTimeout = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-")) {
                throw new IllegalArgumentException("Unexpected argument '" + arg + "'");
            }

            String name = arg;
            String inline = null;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                name = arg.substring(0, eq);
                inline = arg.substring(eq + 1);
            }

            switch (name) {
                case "--help", "-h" -> help = true;
                case "--controller", "--yarp" -> {
                    String value = inline;
                    if (value == null && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        value = args[++i];
                    }
                    builder.withControllerEnabled(value == null || parseBoolean(name, value));
                }
                default -> {
                    String value = inline;
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Option " + name + " requires a value");
                        }
                        value = args[++i];
                    }
                    switch (name) {
                        case "--dir" -> builder.withMapDirectory(Path.of(value));
                        case "--map" -> builder.withMapName(value);
                        case "--init" -> builder.withStart(parsePosition(name, value));
                        case "--goal" -> builder.withGoal(parsePosition(name, value));
                        case "--target" -> builder.withTargetEndpoint(parseEndpoint(name, value));
                        case "--response" -> builder.withResponseEndpoint(parseEndpoint(name, value));
                        case "--ack-timeout" -> ackTimeout = Duration.ofMillis(parseNonNegative(name, value));
                        case "--max-steps" -> builder.withMaxSteps((int) Math.min(parseNonNegative(name, value), Integer.MAX_VALUE));
                        default -> throw new IllegalArgumentException("Unknown option " + name);
                    }
                }
            }
        }

        if (ackTimeout != null) {
            builder.withTimingPolicy(NavigationConfig.defaults().timingPolicy().withAcknowledgementTimeout(ackTimeout));
        }
        return new Invocation(builder.build(), help);
    }

    /**
     * Parses {@code "row,col"}, optionally parenthesised.
     */
    public static Position parsePosition(String option, String value)
    {
        String text = value.strip();
        if (text.startsWith("(") && text.endsWith(")")) {
            text = text.substring(1, text.length() - 1);
        }
        String[] parts = text.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException(option + ": expected row,col but got '" + value + "'");
        }
        try {
            return new Position(Integer.parseInt(parts[0].strip()), Integer.parseInt(parts[1].strip()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + ": expected row,col but got '" + value + "'", e);
        }
    }

    /**
     * Parses {@code "host:port"}. The host part may be omitted ({@code ":10001"}),
     * meaning the loopback address.
     */
    public static InetSocketAddress parseEndpoint(String option, String value)
    {
        String text = value.strip();
        int colon = text.lastIndexOf(':');
        if (colon < 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException(option + ": expected host:port but got '" + value + "'");
        }
        String host = colon == 0 ? "127.0.0.1" : text.substring(0, colon);
        int port;
        try {
            port = Integer.parseInt(text.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + ": port is not a number in '" + value + "'", e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(option + ": port out of range in '" + value + "'");
        }
        return new InetSocketAddress(host, port);
    }

    private static boolean parseBoolean(String option, String value)
    {
        switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1", "on":
                return true;
            case "false", "no", "0", "off":
                return false;
            default:
                throw new IllegalArgumentException(option + ": expected true or false but got '" + value + "'");
        }
    }

    private static long parseNonNegative(String option, String value)
    {
        long n;
        try {
            n = Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + ": expected a number but got '" + value + "'", e);
        }
        if (n < 0) {
            throw new IllegalArgumentException(option + ": must not be negative");
        }
        return n;
    }
}
