package com.questrail.tao.api;

import java.util.List;
import java.util.Objects;

/**
 * An array reconstructed from the engine's {@code name[1]..name[N]} keys.
 *
 * <p>Element {@code i} of {@link #values()} is the value that carried wire index
 * {@code i + 1}.</p>
 *
 * @param name   lower-cased array name (without brackets)
 * @param values elements in index order; immutable
 * @param <T>    element type ({@link DecodedValue} or {@link Parameter})
 */
public record ArrayField<T>(String name, List<T> values) {
    public ArrayField {
        Objects.requireNonNull(name, "name");
        values = List.copyOf(values);
    }

    public int size() {
        return values.size();
    }

    public T get(int index) {
        return values.get(index);
    }
}
