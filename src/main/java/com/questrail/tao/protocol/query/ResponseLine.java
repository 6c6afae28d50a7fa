package com.questrail.tao.protocol.query;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One scratch line returned by a structured query, split on {@code ;}.
 *
 * <p>Every field is kept as sent, empty ones included.</p>
 *
 * @param fields the fields in wire order; immutable, never empty
 */
public record ResponseLine(List<String> fields)
{
    /** Field separator on the wire. */
    public static final String SEPARATOR = ";";

    /** First field of the record that marks an absent result. */
    public static final String INVALID = "INVALID";

    public ResponseLine {
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("A response line has at least one field");
        }
    }

    public static ResponseLine of(String... fields) {
        return new ResponseLine(Arrays.asList(fields));
    }

    /**
     * Splits a raw scratch line into fields. Empty fields are kept, including a
     * trailing one: {@code descrip;STR;F;} carries an empty value.
     */
    public static ResponseLine parse(String line) {
        Objects.requireNonNull(line, "line");
        return new ResponseLine(Arrays.asList(line.split(SEPARATOR, -1)));
    }

    /**
     * Returns {@code true} if a response carries no data: either no lines at all,
     * or a first line whose first field is {@value #INVALID}.
     */
    public static boolean isNoData(List<ResponseLine> lines) {
        return lines.isEmpty() || INVALID.equals(lines.get(0).field(0));
    }

    public String field(int index) {
        return fields.get(index);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, fields);
    }
}
