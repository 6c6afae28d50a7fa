package com.questrail.tao.protocol.decode;

import java.util.Objects;

/**
 * A decoded value paired with its lower-cased wire name, before array folding.
 */
public record NamedValue<T>(String name, T value) {
    public NamedValue {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
