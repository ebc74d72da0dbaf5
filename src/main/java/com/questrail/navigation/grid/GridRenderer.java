package com.questrail.navigation.grid;

import com.questrail.navigation.api.CellStatus;
import com.questrail.navigation.api.Position;
import com.questrail.navigation.api.RouteStep;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * GridRenderer
 * -----------------------------------------------------------------------------
 * Plain-text picture of a grid for console output and log lines.
 *
 * <p>One line per row, one glyph per cell:</p>
 * <pre>
 *   FREE      ' '
 *   OCCUPIED  '#'
 *   VISITED   '.'
 *   START     'S'
 *   GOAL      'E'
 *   current   '@'   (optional overlay)
 * </pre>
 *
 * <p>Lines are separated by {@code '\n'}; there is no trailing newline.</p>
 */
public final class GridRenderer
{
    public static final char FREE = ' ';
    public static final char OCCUPIED = '#';
    public static final char VISITED = '.';
    public static final char START = 'S';
    public static final char GOAL = 'E';
    public static final char CURRENT = '@';

    public String render(Grid grid)
    {
        return render(grid, Set.of(), null);
    }

    /**
     * Renders the grid with the current position overlaid.
     */
    public String render(Grid grid, Position current)
    {
        return render(grid, Set.of(), Objects.requireNonNull(current, "current"));
    }

    /**
     * Renders the grid with the cells of {@code route} drawn as visited. Useful
     * when the grid itself was not the one a run mutated.
     */
    public String renderRoute(Grid grid, List<RouteStep> route)
    {
        Set<Position> trail = new HashSet<>();
        for (RouteStep step : route) {
            trail.add(step.position());
        }
        return render(grid, trail, null);
    }

    private String render(Grid grid, Set<Position> trail, Position current)
    {
        Objects.requireNonNull(grid, "grid");
        StringBuilder sb = new StringBuilder(grid.rows() * (grid.columns() + 1));
        for (int r = 0; r < grid.rows(); r++) {
            if (r > 0) {
                sb.append('\n');
            }
            for (int c = 0; c < grid.columns(); c++) {
                Position p = new Position(r, c);
                if (p.equals(current)) {
                    sb.append(CURRENT);
                    continue;
                }
                CellStatus status = grid.statusAt(p);
                if (status == CellStatus.FREE && trail.contains(p)) {
                    sb.append(VISITED);
                }
                else {
                    sb.append(glyph(status));
                }
            }
        }
        return sb.toString();
    }

    static char glyph(CellStatus status)
    {
        return switch (status) {
            case FREE -> FREE;
            case OCCUPIED -> OCCUPIED;
            case VISITED -> VISITED;
            case START -> START;
            case GOAL -> GOAL;
        };
    }
}
