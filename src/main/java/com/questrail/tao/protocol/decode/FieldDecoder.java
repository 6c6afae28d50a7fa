package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.DecodedValue;

import java.util.Locale;
import java.util.Objects;

/**
 * FieldDecoder
 * ============================================================================
 * Converts one {@link FieldRecord} into a typed {@link DecodedValue}.
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>{@code STR}   : raw value as-is</li>
 *   <li>{@code INT}   : parsed as a signed integer</li>
 *   <li>{@code REAL}  : parsed as a double</li>
 *   <li>{@code LOGIC} : {@code true} iff the raw value is exactly {@code "T"}</li>
 *   <li>{@code ENUM}  : raw value, undecoded</li>
 *   <li>any other tag : the tag itself, as a string value</li>
 * </ul>
 *
 * The unrecognized-tag arm never raises, so new engine kinds degrade to text
 * instead of breaking existing callers.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Fold indexed keys into arrays</li>
 *   <li>Interpret the vary flag</li>
 *   <li>Resolve engine-specific enumerations</li>
 * </ul>
 */
public final class FieldDecoder
{
    static final String TRUE_FLAG = "T";

    /**
     * Decodes a record into its lower-cased name and typed value.
     *
     * @throws DecodeException   if an INT or REAL value is not numeric
     * @throws com.questrail.tao.protocol.ProtocolException if a known kind has no value field
     */
    public NamedValue<DecodedValue> decode(FieldRecord record) {
        Objects.requireNonNull(record, "record");

        final String name = record.name().toLowerCase(Locale.ROOT);

        DecodedValue value = switch (record.kind()) {
            case STR -> new DecodedValue.StringValue(record.rawValue());
            case INT -> decodeInteger(record);
            case REAL -> decodeReal(record);
            case LOGIC -> new DecodedValue.LogicalValue(TRUE_FLAG.equals(record.rawValue()));
            case ENUM -> new DecodedValue.EnumValue(record.rawValue());
            case UNRECOGNIZED -> new DecodedValue.StringValue(record.kindTag());
        };

        return new NamedValue<>(name, value);
    }

    private DecodedValue decodeInteger(FieldRecord record) {
        final String raw = record.rawValue();
        try {
            return new DecodedValue.IntegerValue(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new DecodeException(record.name(), record.kindTag(), raw, e);
        }
    }

    private DecodedValue decodeReal(FieldRecord record) {
        final String raw = record.rawValue();
        try {
            return new DecodedValue.RealValue(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            throw new DecodeException(record.name(), record.kindTag(), raw, e);
        }
    }
}
