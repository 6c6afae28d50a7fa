package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.DecodedValue;
import com.questrail.tao.protocol.ProtocolException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FieldDecoder}.
 *
 * These tests validate kind-tag dispatch:
 *   FieldRecord -> (lower-cased name, DecodedValue)
 */
final class FieldDecoderTest
{
    private final FieldDecoder decoder = new FieldDecoder();

    @Test
    void realIsParsedAsDouble()
    {
        NamedValue<DecodedValue> field = decoder.decode(FieldRecord.of("e_tot", "REAL", "F", "3.5"));

        assertEquals(new DecodedValue.RealValue(3.5), field.value());
        assertEquals(3.5, field.value().asDouble());
    }

    @Test
    void realAcceptsExponentsAndSurroundingBlanks()
    {
        assertEquals(new DecodedValue.RealValue(1.25e-3),
                decoder.decode(FieldRecord.of("x", "REAL", "F", " 1.25E-03 ")).value());
    }

    @Test
    void intIsParsedAsInteger()
    {
        NamedValue<DecodedValue> field = decoder.decode(FieldRecord.of("ix_branch", "INT", "F", "7"));

        assertEquals(new DecodedValue.IntegerValue(7), field.value());
        assertEquals(7L, field.value().asLong());
    }

    @Test
    void logicIsTrueOnlyForT()
    {
        assertEquals(new DecodedValue.LogicalValue(true),
                decoder.decode(FieldRecord.of("on", "LOGIC", "F", "T")).value());
        assertEquals(new DecodedValue.LogicalValue(false),
                decoder.decode(FieldRecord.of("on", "LOGIC", "F", "F")).value());
        assertEquals(new DecodedValue.LogicalValue(false),
                decoder.decode(FieldRecord.of("on", "LOGIC", "F", "t")).value());
    }

    @Test
    void strAndEnumPassThroughRawText()
    {
        assertEquals(new DecodedValue.StringValue("  ring "),
                decoder.decode(FieldRecord.of("name", "STR", "F", "  ring ")).value());
        assertEquals(new DecodedValue.EnumValue("Electron"),
                decoder.decode(FieldRecord.of("particle", "ENUM", "F", "Electron")).value());
    }

    @Test
    void unknownKindFallsBackToTheTagItself()
    {
        NamedValue<DecodedValue> field = decoder.decode(FieldRecord.of("shape", "REAL_ARR", "F", "1,2,3"));

        assertEquals(new DecodedValue.StringValue("REAL_ARR"), field.value());
    }

    @Test
    void unknownKindNeedsNoValueField()
    {
        assertEquals(new DecodedValue.StringValue("SPECIAL"),
                decoder.decode(FieldRecord.of("thing", "SPECIAL")).value());
    }

    @Test
    void nameIsLowerCased()
    {
        assertEquals("num_curves", decoder.decode(FieldRecord.of("NUM_Curves", "INT", "F", "2")).name());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void nonNumericIntRaisesDecodeException()
    {
        DecodeException e = assertThrows(DecodeException.class,
                () -> decoder.decode(FieldRecord.of("n", "INT", "F", "seven")));

        assertEquals("n", e.fieldName());
        assertEquals("INT", e.kindTag());
        assertEquals("seven", e.rawValue());
    }

    @Test
    void nonNumericRealRaisesDecodeException()
    {
        assertThrows(DecodeException.class,
                () -> decoder.decode(FieldRecord.of("x", "REAL", "F", "")));
    }

    @Test
    void knownKindWithoutValueIsAProtocolError()
    {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> decoder.decode(FieldRecord.of("x", "REAL", "F")));

        assertFalse(e instanceof DecodeException);
    }

    @Test
    void recordWithoutKindTagIsRejected()
    {
        assertThrows(ProtocolException.class, () -> FieldRecord.of("lonely"));
    }

    @Test
    void kindTagsMapToAClosedEnumeration()
    {
        assertEquals(FieldKind.STR, FieldKind.fromTag("STR"));
        assertEquals(FieldKind.ENUM, FieldKind.fromTag("ENUM"));
        assertEquals(FieldKind.UNRECOGNIZED, FieldKind.fromTag("str"));
        assertEquals(FieldKind.UNRECOGNIZED, FieldKind.fromTag(null));
    }
}
