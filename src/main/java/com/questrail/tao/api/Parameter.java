package com.questrail.tao.api;

import java.util.Objects;

/**
 * A decoded engine parameter together with its vary flag.
 *
 * @param name  lower-cased field name
 * @param value decoded value
 * @param vary  whether the engine reports this parameter as free/adjustable
 */
public record Parameter(String name, DecodedValue value, boolean vary) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
