package com.questrail.tao.protocol.decode;

/**
 * How a record set reacts to a field that cannot be decoded or an array that
 * contradicts its advertised count.
 *
 * <p>There is no default. Every session states its strictness explicitly.</p>
 */
public enum DecodeStrictness
{
    /**
     * The record set is decoded atomically. The first {@link DecodeException}
     * or {@link ConsistencyException} aborts the whole decode.
     */
    STRICT,

    /**
     * Decoding continues past failures. A field that cannot be coerced is left
     * out. An inconsistent array is kept as received. Every such event is
     * recorded as a {@code ProtocolIssue} on the result.
     */
    LENIENT
}
