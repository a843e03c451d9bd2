package com.polereduction.runner;

import com.polereduction.core.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory delimited table: ordered headers and string cells.
 *
 * <p>
 * Cells keep their original text so a table can be written back unchanged
 * with a result column added. Numeric access goes through
 * {@link #column(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProfileTable {

    private final List<String> headers;
    private final List<List<String>> rows;

    /**
     * @param headers column names, unique; must not be {@code null}
     * @param rows    rows of cells, each as wide as {@code headers}
     * @throws NullPointerException if an argument is {@code null}
     * @throws ValidationException  if headers repeat or a row has the wrong
     *                              width
     */
    public ProfileTable(List<String> headers, List<List<String>> rows) {
        Objects.requireNonNull(headers, "Headers must not be null");
        Objects.requireNonNull(rows, "Rows must not be null");
        if (headers.stream().distinct().count() != headers.size()) {
            throw new ValidationException("column names must be unique, got " + headers);
        }
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() != headers.size()) {
                throw new ValidationException("row " + (i + 1) + " has " + row.size()
                        + " fields, expected " + headers.size());
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.headers = List.copyOf(headers);
        this.rows = Collections.unmodifiableList(copy);
    }

    /** @return unmodifiable column names in file order */
    public List<String> getHeaders() {
        return headers;
    }

    /** @return unmodifiable rows in file order */
    public List<List<String>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Parse a column as numbers.
     *
     * @param name column name
     * @return one value per row
     * @throws ValidationException if the column does not exist or a cell is
     *                             not a number
     */
    public double[] column(String name) {
        int index = headers.indexOf(name);
        if (index < 0) {
            throw new ValidationException("unknown column '" + name + "', available: " + headers);
        }
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            String cell = rows.get(i).get(index).trim();
            try {
                values[i] = Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                throw new ValidationException("column '" + name + "' row " + (i + 1)
                        + " is not a number: '" + cell + "'", e);
            }
        }
        return values;
    }

    /**
     * Return a copy of this table with a numeric column set.
     *
     * <p>
     * An existing column of that name is overwritten in place; otherwise the
     * column is appended.
     * </p>
     *
     * @param name   column name
     * @param values one value per row
     * @return a new table
     * @throws ValidationException if the length differs from
     *                             {@link #rowCount()}
     */
    public ProfileTable withColumn(String name, double[] values) {
        Objects.requireNonNull(name, "Column name must not be null");
        Objects.requireNonNull(values, "Column values must not be null");
        if (values.length != rows.size()) {
            throw new ValidationException("column '" + name + "' has " + values.length
                    + " values for " + rows.size() + " rows");
        }
        int index = headers.indexOf(name);
        List<String> newHeaders = new ArrayList<>(headers);
        if (index < 0) {
            newHeaders.add(name);
        }
        List<List<String>> newRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = new ArrayList<>(rows.get(i));
            String cell = Double.toString(values[i]);
            if (index < 0) {
                row.add(cell);
            } else {
                row.set(index, cell);
            }
            newRows.add(row);
        }
        return new ProfileTable(newHeaders, newRows);
    }

    // ---------------------------------------------------------------
    // Column detection
    // ---------------------------------------------------------------

    /**
     * Guess the distance column: the last header containing {@code distance}
     * or {@code x}, ignoring case.
     *
     * @return the detected column name, if any
     */
    public Optional<String> detectDistanceColumn() {
        String match = null;
        for (String header : headers) {
            if (isDistanceLike(header)) {
                match = header;
            }
        }
        return Optional.ofNullable(match);
    }

    /**
     * Guess the anomaly column: the last header containing {@code anomaly} or
     * {@code y}, ignoring case, that does not already look like a distance.
     *
     * @return the detected column name, if any
     */
    public Optional<String> detectAnomalyColumn() {
        String match = null;
        for (String header : headers) {
            if (!isDistanceLike(header) && isAnomalyLike(header)) {
                match = header;
            }
        }
        return Optional.ofNullable(match);
    }

    private static boolean isDistanceLike(String header) {
        String lower = header.toLowerCase(Locale.ROOT);
        return lower.contains("distance") || lower.contains("x");
    }

    private static boolean isAnomalyLike(String header) {
        String lower = header.toLowerCase(Locale.ROOT);
        return lower.contains("anomaly") || lower.contains("y");
    }

    @Override
    public String toString() {
        return "ProfileTable{columns=" + headers + ", rows=" + rows.size() + '}';
    }
}
