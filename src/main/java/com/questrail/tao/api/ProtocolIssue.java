package com.questrail.tao.api;

import java.util.Objects;

/**
 * A protocol inconsistency that was reported instead of raised.
 *
 * <p>Issues are only produced in lenient decoding. In strict decoding the
 * same conditions abort the decode with an exception.</p>
 *
 * @param kind    what went wrong
 * @param key     the affected field or array name
 * @param message human-readable description
 */
public record ProtocolIssue(Kind kind, String key, String message) {

    public enum Kind {
        /** A single field could not be coerced to its advertised kind. */
        DECODE_FAILURE,
        /** An array index was skipped or out of order. */
        INDEX_GAP,
        /** An array's length differs from its {@code num_<name>s} sibling. */
        COUNT_MISMATCH,
        /** An array has no {@code num_<name>s} sibling. */
        MISSING_COUNT
    }

    public ProtocolIssue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(message, "message");
    }
}
