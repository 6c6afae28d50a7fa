package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.NumericMatrix;
import com.questrail.tao.protocol.query.ResponseLine;

import java.util.List;
import java.util.Objects;

/**
 * NumericArrayExtractor
 * -----------------------------------------------------------------------------
 * Converts row-oriented records into a {@link NumericMatrix}.
 *
 * <p>Each row is {@code firstField} leading fields (the row index, by default)
 * followed by exactly {@code columns} numeric fields:</p>
 *
 * <pre>
 *   1;0.0;12.5        →  [ 0.0, 12.5 ]
 *   2;0.5;11.9        →  [ 0.5, 11.9 ]
 * </pre>
 *
 * <p>No data ({@code INVALID} or no rows) is the normal "nothing to plot" answer
 * and yields a zero-row matrix with the requested column count.</p>
 */
public final class NumericArrayExtractor
{
    /** Leading fields skipped on every row: the 1-based row index. */
    public static final int DEFAULT_FIRST_FIELD = 1;

    private final int firstField;

    public NumericArrayExtractor() {
        this(DEFAULT_FIRST_FIELD);
    }

    public NumericArrayExtractor(int firstField) {
        if (firstField < 0) {
            throw new IllegalArgumentException("firstField must be >= 0 (was " + firstField + ")");
        }
        this.firstField = firstField;
    }

    /**
     * @param rows    response lines, one per matrix row
     * @param columns number of numeric fields per row; also the column count of
     *                the empty result
     * @throws MalformedRowException if a row has the wrong field count
     * @throws DecodeException       if a field is not numeric
     */
    public NumericMatrix extract(List<ResponseLine> rows, int columns) {
        Objects.requireNonNull(rows, "rows");
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be >= 1 (was " + columns + ")");
        }
        if (ResponseLine.isNoData(rows)) {
            return NumericMatrix.empty(columns);
        }

        final int expectedFields = firstField + columns;
        double[][] values = new double[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            ResponseLine row = rows.get(r);
            if (row.size() != expectedFields) {
                throw new MalformedRowException(r, expectedFields, row.size());
            }
            double[] out = new double[columns];
            for (int c = 0; c < columns; c++) {
                out[c] = parse(r, c, row.field(firstField + c));
            }
            values[r] = out;
        }
        return NumericMatrix.ofRows(values);
    }

    private static double parse(int row, int column, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new DecodeException("row " + row + " column " + column, "REAL", raw, e);
        }
    }
}
