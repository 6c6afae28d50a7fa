package com.questrail.tao.protocol.decode;

import com.questrail.tao.protocol.ProtocolException;
import com.questrail.tao.protocol.query.ResponseLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts the values of an {@code index;value} list response, in wire order.
 *
 * <p>An absent result ({@code INVALID} or no lines) yields an empty list.</p>
 */
public final class ListExtractor
{
    private static final int LIST_RECORD_FIELDS = 2;

    /**
     * @throws ProtocolException if a line is not an {@code index;value} pair
     */
    public List<String> extract(List<ResponseLine> lines) {
        Objects.requireNonNull(lines, "lines");
        if (ResponseLine.isNoData(lines)) {
            return List.of();
        }

        List<String> values = new ArrayList<>(lines.size());
        for (ResponseLine line : lines) {
            if (line.size() != LIST_RECORD_FIELDS) {
                throw new ProtocolException("List record is not an index;value pair: '" + line + "'");
            }
            values.add(line.field(1));
        }
        return List.copyOf(values);
    }
}
