package com.questrail.tao.api;

import java.util.Arrays;

/**
 * NumericMatrix
 * -----------------------------------------------------------------------------
 * Immutable rows-by-columns matrix of doubles, stored row-major.
 *
 * <p>"No data" is represented by a matrix with zero rows and the requested
 * column count, never by {@code null}.</p>
 */
public final class NumericMatrix
{
    private final int rows;
    private final int columns;
    private final double[] data;

    private NumericMatrix(int rows, int columns, double[] data) {
        this.rows = rows;
        this.columns = columns;
        this.data = data;
    }

    /**
     * Returns a zero-row matrix with the given column count.
     */
    public static NumericMatrix empty(int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be >= 1 (was " + columns + ")");
        }
        return new NumericMatrix(0, columns, new double[0]);
    }

    /**
     * Builds a matrix from rows of equal length.
     *
     * @throws IllegalArgumentException if the rows are ragged or empty
     */
    public static NumericMatrix ofRows(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Use empty(columns) for a zero-row matrix");
        }
        final int columns = rows[0].length;
        if (columns < 1) {
            throw new IllegalArgumentException("Rows must have at least one column");
        }
        double[] data = new double[rows.length * columns];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != columns) {
                throw new IllegalArgumentException(
                        "Row " + r + " has " + rows[r].length + " columns, expected " + columns);
            }
            System.arraycopy(rows[r], 0, data, r * columns, columns);
        }
        return new NumericMatrix(rows.length, columns, data);
    }

    public int rowCount() {
        return rows;
    }

    public int columnCount() {
        return columns;
    }

    public boolean isEmpty() {
        return rows == 0;
    }

    public double get(int row, int column) {
        checkRow(row);
        checkColumn(column);
        return data[row * columns + column];
    }

    /**
     * Returns a copy of one row.
     */
    public double[] row(int row) {
        checkRow(row);
        return Arrays.copyOfRange(data, row * columns, (row + 1) * columns);
    }

    /**
     * Returns a copy of one column, e.g. all x values of an (x, y) curve.
     */
    public double[] column(int column) {
        checkColumn(column);
        double[] out = new double[rows];
        for (int r = 0; r < rows; r++) {
            out[r] = data[r * columns + column];
        }
        return out;
    }

    public double[][] toArray() {
        double[][] out = new double[rows][];
        for (int r = 0; r < rows; r++) {
            out[r] = row(r);
        }
        return out;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException("row=" + row + ", rows=" + rows);
        }
    }

    private void checkColumn(int column) {
        if (column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("column=" + column + ", columns=" + columns);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericMatrix that)) return false;
        return rows == that.rows && columns == that.columns && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "NumericMatrix[" + rows + "x" + columns + "]";
    }
}
