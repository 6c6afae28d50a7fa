package com.questrail.tao.protocol.decode;

import com.questrail.tao.protocol.ProtocolException;
import com.questrail.tao.protocol.query.ResponseLine;

import java.util.List;
import java.util.Objects;

/**
 * FieldRecord
 * -----------------------------------------------------------------------------
 * Positional view of one structured response line:
 *
 * <pre>
 *   field 0 : name
 *   field 1 : kind tag   (STR | INT | REAL | LOGIC | ENUM | other)
 *   field 2 : vary flag  (T | F)
 *   field 3 : raw value
 *   field 4.. : kind-specific extras, kept but not interpreted
 * </pre>
 *
 * Only name and kind tag are mandatory at construction. Vary flag and raw value
 * are checked when a decoder needs them, so that records of unrecognized kinds
 * can still be decoded.
 */
public final class FieldRecord
{
    private static final int NAME = 0;
    private static final int KIND = 1;
    private static final int VARY = 2;
    private static final int VALUE = 3;

    private final ResponseLine line;

    private FieldRecord(ResponseLine line) {
        this.line = line;
    }

    /**
     * Wraps a response line as a field record.
     *
     * @throws ProtocolException if the line lacks a name or kind tag
     */
    public static FieldRecord from(ResponseLine line) {
        Objects.requireNonNull(line, "line");
        if (line.size() <= KIND) {
            throw new ProtocolException("Record has no kind tag: '" + line + "'");
        }
        return new FieldRecord(line);
    }

    public static FieldRecord of(String... fields) {
        return from(ResponseLine.of(fields));
    }

    public String name() {
        return line.field(NAME);
    }

    public String kindTag() {
        return line.field(KIND);
    }

    public FieldKind kind() {
        return FieldKind.fromTag(kindTag());
    }

    /**
     * Returns the vary flag text.
     *
     * @throws ProtocolException if the record has no vary flag field
     */
    public String varyFlag() {
        return require(VARY, "vary flag");
    }

    /**
     * Returns the raw value text.
     *
     * @throws ProtocolException if the record has no value field
     */
    public String rawValue() {
        return require(VALUE, "value");
    }

    public List<String> fields() {
        return line.fields();
    }

    private String require(int index, String what) {
        if (line.size() <= index) {
            throw new ProtocolException("Record '" + name() + "' has no " + what + " field: '" + line + "'");
        }
        return line.field(index);
    }

    @Override
    public String toString() {
        return "FieldRecord[" + line + "]";
    }
}
