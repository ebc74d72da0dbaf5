package com.questrail.navigation.app;

import com.questrail.navigation.api.ControllerException;
import com.questrail.navigation.api.NavigationException;
import com.questrail.navigation.api.RouteResult;
import com.questrail.navigation.config.CommandLineParser;
import com.questrail.navigation.config.NavigationConfig;
import com.questrail.navigation.grid.Grid;
import com.questrail.navigation.grid.GridRenderer;
import com.questrail.navigation.observability.Slf4jNavigationObservabilitySink;
import com.questrail.navigation.runtime.NavigationRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Command-line entry point: loads a map, plans a route over it and prints the
 * outcome.
 *
 * <p>Exit status: {@code 0} when the goal was reached, {@code 1} for any other
 * run outcome (including a controller channel that would not start),
 * {@code 2} for bad arguments or an unreadable map.</p>
 */
public final class NavigationMain
{
    private static final Logger log = LoggerFactory.getLogger(NavigationMain.class);

    static final int EXIT_COMPLETED = 0;
    static final int EXIT_NOT_COMPLETED = 1;
    static final int EXIT_USAGE = 2;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private NavigationMain()
    {
    }

    public static void main(String[] args)
    {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err)
    {
        CommandLineParser.Invocation invocation;
        try {
            invocation = new CommandLineParser().parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CommandLineParser.USAGE);
            return EXIT_USAGE;
        }
        if (invocation.helpRequested()) {
            out.println(CommandLineParser.USAGE);
            return EXIT_COMPLETED;
        }

        NavigationConfig config = invocation.config();
        NavigationRuntime runtime = NavigationRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jNavigationObservabilitySink())
                .build();

        Grid grid;
        try {
            grid = runtime.loadGrid();
        } catch (NavigationException | UncheckedIOException e) {
            log.error("Cannot load map {}: {}", config.mapPath(), e.getMessage());
            err.println("Cannot load map " + config.mapPath() + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        GridRenderer renderer = new GridRenderer();
        out.println(renderer.render(grid));
        out.println();

        try {
            runtime.start();
        } catch (ControllerException e) {
            err.println("Controller channel unavailable: " + e.getMessage());
            runtime.stop();
            return EXIT_NOT_COMPLETED;
        }

        RouteResult result;
        try {
            result = runtime.run(grid);
        } finally {
            runtime.stop();
        }

        out.println(renderer.renderRoute(grid, result.steps()));
        out.println();
        out.println(describe(result));

        return result.isCompleted() ? EXIT_COMPLETED : EXIT_NOT_COMPLETED;
    }

    static String describe(RouteResult result)
    {
        return describe(result, ZoneId.systemDefault());
    }

    static String describe(RouteResult result, ZoneId zone)
    {
        DateTimeFormatter times = TIMESTAMP.withZone(zone);
        StringBuilder sb = new StringBuilder();
        sb.append(result.status())
                .append(": ")
                .append(result.start())
                .append(" -> ")
                .append(result.finalPosition())
                .append(" in ")
                .append(result.summary().steps())
                .append(" steps (")
                .append(result.summary().elapsed().toMillis())
                .append(" ms)")
                .append("\nstarted ")
                .append(times.format(result.summary().startedAt()))
                .append(", finished ")
                .append(times.format(result.summary().finishedAt()));
        result.failure().ifPresent(f -> sb.append('\n').append(f.getMessage()));
        return sb.toString();
    }
}
