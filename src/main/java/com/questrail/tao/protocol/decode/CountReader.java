package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.DecodedValue;
import com.questrail.tao.api.Parameter;

import java.util.OptionalLong;

/**
 * Reads an array cardinality out of a {@code num_<name>s} value.
 *
 * @param <T> value type being folded
 */
@FunctionalInterface
public interface CountReader<T>
{
    /**
     * @return the count, or empty if the value is not an integer
     */
    OptionalLong count(T value);

    CountReader<DecodedValue> DECODED = CountReader::integerOf;

    CountReader<Parameter> PARAMETER = parameter -> integerOf(parameter.value());

    private static OptionalLong integerOf(DecodedValue value) {
        if (value instanceof DecodedValue.IntegerValue integer) {
            return OptionalLong.of(integer.value());
        }
        return OptionalLong.empty();
    }
}
