package com.questrail.tao.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PropertyMap
 * -----------------------------------------------------------------------------
 * Ordered, immutable result of decoding a structured engine response.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>Keys are lower-cased and unique.</li>
 *   <li>Iteration follows the order in which keys first appeared on the wire.
 *       A folded array takes the position of its first element.</li>
 *   <li>Lookups are case-insensitive.</li>
 * </ul>
 *
 * <h2>Issues</h2>
 * In lenient decoding the map may be a best-effort result; {@link #issues()}
 * lists everything that was reported instead of raised. A map produced by
 * strict decoding never carries issues.
 *
 * @param <T> value type ({@link DecodedValue} or {@link Parameter})
 */
public final class PropertyMap<T>
{
    private final Map<String, Property<T>> entries;
    private final List<ProtocolIssue> issues;

    public PropertyMap(Map<String, Property<T>> entries, List<ProtocolIssue> issues) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.issues = List.copyOf(issues);
    }

    public static <T> PropertyMap<T> empty() {
        return new PropertyMap<>(Map.of(), List.of());
    }

    public Optional<Property<T>> get(String name) {
        return Optional.ofNullable(entries.get(normalize(name)));
    }

    public boolean containsKey(String name) {
        return entries.containsKey(normalize(name));
    }

    /**
     * Returns the scalar stored under {@code name}.
     *
     * @throws IllegalArgumentException if the key is absent or holds an array
     */
    public T scalar(String name) {
        Property<T> property = entries.get(normalize(name));
        if (property instanceof Property.Scalar<T> scalar) {
            return scalar.value();
        }
        throw new IllegalArgumentException(describeMismatch(name, property, "scalar"));
    }

    /**
     * Returns the elements of the array stored under {@code name}.
     *
     * @throws IllegalArgumentException if the key is absent or holds a scalar
     */
    public List<T> array(String name) {
        Property<T> property = entries.get(normalize(name));
        if (property instanceof Property.Array<T> array) {
            return array.field().values();
        }
        throw new IllegalArgumentException(describeMismatch(name, property, "array"));
    }

    public Set<String> keySet() {
        return entries.keySet();
    }

    public Map<String, Property<T>> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<ProtocolIssue> issues() {
        return issues;
    }

    /**
     * Indicates whether decoding completed without any reported issue.
     */
    public boolean isComplete() {
        return issues.isEmpty();
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String describeMismatch(String name, Property<?> property, String expected) {
        if (property == null) {
            return "No property named '" + name + "'";
        }
        return "Property '" + name + "' is not a " + expected + ": " + property;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyMap<?> that)) return false;
        return entries.equals(that.entries) && issues.equals(that.issues);
    }

    @Override
    public int hashCode() {
        return 31 * entries.hashCode() + issues.hashCode();
    }

    @Override
    public String toString() {
        return "PropertyMap" + entries + (issues.isEmpty() ? "" : " issues=" + issues);
    }
}
