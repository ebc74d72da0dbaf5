package com.questrail.navigation.grid;

import com.questrail.navigation.api.CellStatus;
import com.questrail.navigation.api.OutOfBoundsException;
import com.questrail.navigation.api.Position;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * GridBuilder
 * -----------------------------------------------------------------------------
 * Mutable staging area for a {@link Grid}.
 *
 * <p>A builder starts with every cell {@link CellStatus#FREE}. Cells may be
 * set individually (for example by a map reader) and start/goal may be set
 * explicitly. Explicit endpoints override any {@code START}/{@code GOAL}
 * markers already present; the superseded markers revert to {@code FREE}.</p>
 *
 * <h2>Validation at {@link #build()}</h2>
 * <ul>
 *   <li>An explicit endpoint outside the grid → {@link OutOfBoundsException}</li>
 *   <li>An explicit endpoint on a cell that is not {@code FREE} →
 *       {@link InvalidGridException} ("location is not available")</li>
 *   <li>Without explicit endpoints, exactly one {@code START} and one
 *       {@code GOAL} marker must be present</li>
 * </ul>
 */
public final class GridBuilder
{
    private final int rows;
    private final int columns;
    private final CellStatus[] cells;

    private Position start;
    private Position goal;

    public GridBuilder(int rows, int columns)
    {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("grid dimensions must be positive, got " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.cells = new CellStatus[rows * columns];
        Arrays.fill(cells, CellStatus.FREE);
    }

    /**
     * Creates a builder from row-major status rows. All rows must have equal length.
     */
    public static GridBuilder fromRows(List<CellStatus[]> statusRows)
    {
        Objects.requireNonNull(statusRows, "statusRows");
        if (statusRows.isEmpty()) {
            throw new InvalidGridException("grid has no rows");
        }
        int columns = statusRows.get(0).length;
        GridBuilder builder = new GridBuilder(statusRows.size(), columns);
        for (int r = 0; r < statusRows.size(); r++) {
            CellStatus[] row = statusRows.get(r);
            if (row.length != columns) {
                throw new InvalidGridException("row " + r + " has " + row.length
                        + " columns, expected " + columns);
            }
            for (int c = 0; c < columns; c++) {
                builder.set(new Position(r, c), row[c]);
            }
        }
        return builder;
    }

    public int rows()
    {
        return rows;
    }

    public int columns()
    {
        return columns;
    }

    public GridBuilder set(Position position, CellStatus status)
    {
        cells[indexOf(position)] = Objects.requireNonNull(status, "status");
        return this;
    }

    public GridBuilder occupy(Position position)
    {
        return set(position, CellStatus.OCCUPIED);
    }

    /**
     * Occupies every cell on the outer border.
     */
    public GridBuilder walled()
    {
        for (int r = 0; r < rows; r++) {
            occupy(new Position(r, 0));
            occupy(new Position(r, columns - 1));
        }
        for (int c = 0; c < columns; c++) {
            occupy(new Position(0, c));
            occupy(new Position(rows - 1, c));
        }
        return this;
    }

    public GridBuilder start(Position start)
    {
        this.start = Objects.requireNonNull(start, "start");
        return this;
    }

    public GridBuilder goal(Position goal)
    {
        this.goal = Objects.requireNonNull(goal, "goal");
        return this;
    }

    public Grid build()
    {
        CellStatus[] staged = Arrays.copyOf(cells, cells.length);

        if (start != null) {
            replaceMarkers(staged, CellStatus.START);
        }
        if (goal != null) {
            replaceMarkers(staged, CellStatus.GOAL);
        }

        Position resolvedStart = start != null ? requireAvailable(staged, start, "start") : findMarker(staged, CellStatus.START);
        Position resolvedGoal = goal != null ? requireAvailable(staged, goal, "goal") : findMarker(staged, CellStatus.GOAL);

        staged[unsafeIndex(resolvedStart)] = CellStatus.START;
        // Goal is written last so a coinciding start/goal cell stays traversable as GOAL.
        staged[unsafeIndex(resolvedGoal)] = CellStatus.GOAL;

        return new Grid(rows, columns, staged, resolvedStart, resolvedGoal);
    }

    private void replaceMarkers(CellStatus[] staged, CellStatus marker)
    {
        for (int i = 0; i < staged.length; i++) {
            if (staged[i] == marker) {
                staged[i] = CellStatus.FREE;
            }
        }
    }

    private Position requireAvailable(CellStatus[] staged, Position position, String role)
    {
        int index = indexOf(position);
        CellStatus status = staged[index];
        // Own marker is already cleared; the other endpoint's marker is not free.
        if (status != CellStatus.FREE) {
            throw new InvalidGridException(role + " location " + position + " is not available: cell is " + status);
        }
        return position;
    }

    private Position findMarker(CellStatus[] staged, CellStatus marker)
    {
        List<Position> found = new ArrayList<>();
        for (int i = 0; i < staged.length; i++) {
            if (staged[i] == marker) {
                found.add(new Position(i / columns, i % columns));
            }
        }
        if (found.size() != 1) {
            throw new InvalidGridException("expected exactly one " + marker + " cell, found " + found.size());
        }
        return found.get(0);
    }

    private int indexOf(Position position)
    {
        Objects.requireNonNull(position, "position");
        if (position.row() < 0 || position.row() >= rows || position.column() < 0 || position.column() >= columns) {
            throw new OutOfBoundsException(position, rows, columns);
        }
        return unsafeIndex(position);
    }

    private int unsafeIndex(Position position)
    {
        return position.row() * columns + position.column();
    }
}
