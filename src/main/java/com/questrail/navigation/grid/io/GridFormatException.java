package com.questrail.navigation.grid.io;

import com.questrail.navigation.grid.InvalidGridException;

/**
 * A tabular map source could not be parsed.
 *
 * <p>{@link #line()} and {@link #column()} are 1-based and point at the
 * offending value; either may be {@code 0} when the defect is not tied to a
 * single value (for example, an empty source).</p>
 */
public final class GridFormatException extends InvalidGridException
{
    private final int line;
    private final int column;

    public GridFormatException(String message, int line, int column)
    {
        super(format(message, line, column));
        this.line = line;
        this.column = column;
    }

    public GridFormatException(String message, int line, int column, Throwable cause)
    {
        super(format(message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    public int line()
    {
        return line;
    }

    public int column()
    {
        return column;
    }

    private static String format(String message, int line, int column)
    {
        if (line <= 0) {
            return message;
        }
        return "line " + line + (column > 0 ? ", column " + column : "") + ": " + message;
    }
}
