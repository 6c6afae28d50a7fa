package com.questrail.tao.protocol.decode;

/**
 * Kind tags carried in field 1 of a structured record.
 */
public enum FieldKind
{
    STR,
    INT,
    REAL,
    LOGIC,
    ENUM,

    /** Any tag this client does not know. The decoder never rejects it. */
    UNRECOGNIZED;

    /**
     * Maps a wire tag to its kind. Matching is exact; unknown tags map to
     * {@link #UNRECOGNIZED}.
     */
    public static FieldKind fromTag(String tag) {
        if (tag == null) {
            return UNRECOGNIZED;
        }
        return switch (tag) {
            case "STR" -> STR;
            case "INT" -> INT;
            case "REAL" -> REAL;
            case "LOGIC" -> LOGIC;
            case "ENUM" -> ENUM;
            default -> UNRECOGNIZED;
        };
    }
}
