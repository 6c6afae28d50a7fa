package com.questrail.tao.protocol.decode;

import com.questrail.tao.protocol.ProtocolException;

/**
 * A single field's raw text could not be coerced to the kind its tag advertised.
 */
public final class DecodeException extends ProtocolException
{
    private final String fieldName;
    private final String kindTag;
    private final String rawValue;

    public DecodeException(String fieldName, String kindTag, String rawValue, Throwable cause) {
        super("Cannot decode field '" + fieldName + "' of kind " + kindTag
                + " from '" + rawValue + "'", cause);
        this.fieldName = fieldName;
        this.kindTag = kindTag;
        this.rawValue = rawValue;
    }

    public String fieldName() {
        return fieldName;
    }

    public String kindTag() {
        return kindTag;
    }

    public String rawValue() {
        return rawValue;
    }
}
