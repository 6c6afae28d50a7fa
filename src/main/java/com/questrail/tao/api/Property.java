package com.questrail.tao.api;

import java.util.Objects;

/**
 * One entry of a {@link PropertyMap}: either a scalar or a folded array.
 *
 * @param <T> element type ({@link DecodedValue} or {@link Parameter})
 */
public sealed interface Property<T> permits Property.Scalar, Property.Array {

    record Scalar<T>(T value) implements Property<T> {
        public Scalar {
            Objects.requireNonNull(value, "value");
        }
    }

    record Array<T>(ArrayField<T> field) implements Property<T> {
        public Array {
            Objects.requireNonNull(field, "field");
        }
    }
}
