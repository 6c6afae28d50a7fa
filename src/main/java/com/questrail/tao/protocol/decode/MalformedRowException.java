package com.questrail.tao.protocol.decode;

import com.questrail.tao.protocol.ProtocolException;

/**
 * A matrix row does not have the field count its layout requires.
 * Rows are never truncated or padded.
 */
public final class MalformedRowException extends ProtocolException
{
    private final int row;
    private final int expectedFields;
    private final int actualFields;

    public MalformedRowException(int row, int expectedFields, int actualFields) {
        super("Row " + row + " has " + actualFields + " fields, expected " + expectedFields);
        this.row = row;
        this.expectedFields = expectedFields;
        this.actualFields = actualFields;
    }

    /** 0-based index of the offending row. */
    public int row() {
        return row;
    }

    public int expectedFields() {
        return expectedFields;
    }

    public int actualFields() {
        return actualFields;
    }
}
