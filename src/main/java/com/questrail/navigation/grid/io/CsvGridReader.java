package com.questrail.navigation.grid.io;

import com.questrail.navigation.api.CellStatus;
import com.questrail.navigation.api.Position;
import com.questrail.navigation.grid.Grid;
import com.questrail.navigation.grid.GridBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CsvGridReader
 * -----------------------------------------------------------------------------
 * Reads a comma-delimited occupancy map into a {@link GridBuilder}.
 *
 * <h2>Format</h2>
 * One grid row per line, one integer code per cell:
 * <pre>
 *   0 free   1 occupied   2 visited   3 start   4 goal
 * </pre>
 * Blank lines are skipped and whitespace around values is ignored. Every row
 * must have the same number of values.
 *
 * <p>The reader only parses. Start/goal resolution and validation happen in
 * {@link GridBuilder#build()}, so callers can override the markers with
 * explicit coordinates first.</p>
 */
public final class CsvGridReader
{
    private static final Logger log = LoggerFactory.getLogger(CsvGridReader.class);

    private static final String DELIMITER = ",";

    /**
     * Parses the map file at {@code path}.
     *
     * @throws GridFormatException on any malformed content
     * @throws UncheckedIOException if the file cannot be read
     */
    public GridBuilder read(Path path)
    {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            GridBuilder builder = read(reader);
            log.debug("Read {}x{} map from {}", builder.rows(), builder.columns(), path);
            return builder;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read map " + path, e);
        }
    }

    /**
     * Parses the map file and applies explicit endpoints.
     */
    public Grid load(Path path, Position start, Position goal)
    {
        return read(path).start(start).goal(goal).build();
    }

    /**
     * Parses map content from an open reader. The reader is not closed.
     */
    public GridBuilder read(Reader source) throws IOException
    {
        Objects.requireNonNull(source, "source");
        BufferedReader reader = source instanceof BufferedReader b ? b : new BufferedReader(source);

        List<CellStatus[]> rows = new ArrayList<>();
        int expectedColumns = -1;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            CellStatus[] row = parseRow(line, lineNumber);
            if (expectedColumns < 0) {
                expectedColumns = row.length;
            }
            else if (row.length != expectedColumns) {
                throw new GridFormatException("row has " + row.length + " values, expected " + expectedColumns,
                        lineNumber, 0);
            }
            rows.add(row);
        }

        if (rows.isEmpty()) {
            throw new GridFormatException("map contains no rows", 0, 0);
        }
        return GridBuilder.fromRows(rows);
    }

    private CellStatus[] parseRow(String line, int lineNumber)
    {
        String[] values = line.split(DELIMITER, -1);
        CellStatus[] row = new CellStatus[values.length];
        for (int i = 0; i < values.length; i++) {
            String value = values[i].strip();
            int column = i + 1;
            int code;
            try {
                code = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new GridFormatException("'" + value + "' is not an integer cell code", lineNumber, column, e);
            }
            row[i] = CellStatus.fromCode(code).orElseThrow(() ->
                    new GridFormatException("unknown cell code " + code, lineNumber, column));
        }
        return row;
    }
}
