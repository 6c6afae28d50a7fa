package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.DecodedValue;
import com.questrail.tao.api.Parameter;

import java.util.Objects;

/**
 * Decodes a record into a {@link Parameter}: the typed value from
 * {@link FieldDecoder} plus the vary flag from field 2.
 */
public final class ParameterDecoder
{
    private final FieldDecoder fieldDecoder;

    public ParameterDecoder(FieldDecoder fieldDecoder) {
        this.fieldDecoder = Objects.requireNonNull(fieldDecoder, "fieldDecoder");
    }

    /**
     * @throws DecodeException if the value cannot be coerced
     * @throws com.questrail.tao.protocol.ProtocolException if the record has no vary flag
     */
    public NamedValue<Parameter> decodeParam(FieldRecord record) {
        Objects.requireNonNull(record, "record");

        NamedValue<DecodedValue> field = fieldDecoder.decode(record);
        boolean vary = FieldDecoder.TRUE_FLAG.equals(record.varyFlag());

        return new NamedValue<>(field.name(), new Parameter(field.name(), field.value(), vary));
    }
}
