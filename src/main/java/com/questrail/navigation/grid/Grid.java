package com.questrail.navigation.grid;

import com.questrail.navigation.api.Cell;
import com.questrail.navigation.api.CellStatus;
import com.questrail.navigation.api.InvalidTransitionException;
import com.questrail.navigation.api.OutOfBoundsException;
import com.questrail.navigation.api.Position;

import java.util.Arrays;
import java.util.Objects;

/**
 * Grid
 * -----------------------------------------------------------------------------
 * Rectangular occupancy map with per-cell status, the foundation every other
 * component plans against.
 *
 * <h2>Storage</h2>
 * Cells are held in one row-major array indexed by {@code row * columns + column}.
 * Static occupancy and route history live in the same status tag; there is no
 * separate overlay that could disagree with it.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Dimensions are fixed at construction</li>
 *   <li>Exactly one {@link CellStatus#START} and one {@link CellStatus#GOAL}
 *       cell, except when start and goal coincide, in which case the single
 *       cell is tagged {@link CellStatus#GOAL}</li>
 *   <li>The only mutation is {@link #markVisited(Position)}, which moves a
 *       {@link CellStatus#FREE} cell to {@link CellStatus#VISITED}</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Not thread-safe. A grid is owned by one planning run at a time; callers that
 * want to plan repeatedly over the same map plan over {@link #copy()}.
 *
 * <p>Instances are created through {@link GridBuilder}.</p>
 */
public final class Grid
{
    private final int rows;
    private final int columns;
    private final CellStatus[] cells;
    private final Position start;
    private final Position goal;

    Grid(int rows, int columns, CellStatus[] cells, Position start, Position goal)
    {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("grid dimensions must be positive, got " + rows + "x" + columns);
        }
        if (cells.length != rows * columns) {
            throw new IllegalArgumentException("cell count " + cells.length + " does not match " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
        this.start = Objects.requireNonNull(start, "start");
        this.goal = Objects.requireNonNull(goal, "goal");
    }

    public int rows()
    {
        return rows;
    }

    public int columns()
    {
        return columns;
    }

    public int cellCount()
    {
        return cells.length;
    }

    public Position start()
    {
        return start;
    }

    public Position goal()
    {
        return goal;
    }

    public boolean contains(Position position)
    {
        return position.row() >= 0 && position.row() < rows
                && position.column() >= 0 && position.column() < columns;
    }

    /**
     * Returns the cell at {@code position}.
     *
     * @throws OutOfBoundsException if the position lies outside the grid
     */
    public Cell cellAt(Position position)
    {
        return new Cell(position, statusAt(position));
    }

    /**
     * Returns the status at {@code position}.
     *
     * @throws OutOfBoundsException if the position lies outside the grid
     */
    public CellStatus statusAt(Position position)
    {
        return cells[indexOf(position)];
    }

    /**
     * True iff the position is inside the grid and its cell is
     * {@code FREE}, {@code START} or {@code GOAL}. Never throws.
     */
    public boolean isTraversable(Position position)
    {
        Objects.requireNonNull(position, "position");
        return contains(position) && cells[unsafeIndex(position)].isTraversable();
    }

    /**
     * Records that the route passed through {@code position}.
     *
     * <ul>
     *   <li>{@code FREE} → {@code VISITED}</li>
     *   <li>{@code START}, {@code GOAL}: unchanged; the goal always stays traversable</li>
     *   <li>{@code OCCUPIED}, {@code VISITED}: {@link InvalidTransitionException}</li>
     * </ul>
     *
     * @throws OutOfBoundsException if the position lies outside the grid
     * @throws InvalidTransitionException if the cell cannot become visited
     */
    public void markVisited(Position position)
    {
        int index = indexOf(position);
        CellStatus status = cells[index];
        switch (status) {
            case FREE -> cells[index] = CellStatus.VISITED;
            case START, GOAL -> {
                // Singular points keep their tag.
            }
            case OCCUPIED, VISITED -> throw new InvalidTransitionException(position, status);
        }
    }

    /**
     * Counts cells currently carrying {@code status}.
     */
    public int count(CellStatus status)
    {
        int n = 0;
        for (CellStatus cell : cells) {
            if (cell == status) {
                n++;
            }
        }
        return n;
    }

    /**
     * Independent copy with identical dimensions, statuses and endpoints.
     */
    public Grid copy()
    {
        return new Grid(rows, columns, Arrays.copyOf(cells, cells.length), start, goal);
    }

    private int indexOf(Position position)
    {
        Objects.requireNonNull(position, "position");
        if (!contains(position)) {
            throw new OutOfBoundsException(position, rows, columns);
        }
        return unsafeIndex(position);
    }

    private int unsafeIndex(Position position)
    {
        return position.row() * columns + position.column();
    }

    @Override
    public String toString()
    {
        return "Grid{" + rows + "x" + columns + ", start=" + start + ", goal=" + goal + "}";
    }
}
