package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.ArrayField;
import com.questrail.tao.api.Property;
import com.questrail.tao.api.PropertyMap;
import com.questrail.tao.api.ProtocolIssue;
import com.questrail.tao.protocol.ProtocolException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ArrayReassembler
 * ============================================================================
 * Folds the engine's indexed keys into arrays and checks them against their
 * advertised counts.
 *
 * <h2>Wire convention</h2>
 * <pre>
 *   num_curves ; INT ; F ; 2
 *   curve[1]   ; STR ; F ; a
 *   curve[2]   ; STR ; F ; b
 * </pre>
 * folds into {@code {curve: [a, b]}}. The {@code num_curves} sibling is
 * consumed by the check and does not appear in the result.
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>Values are scanned in wire order.</li>
 *   <li>A key {@code name[i]} appends to the array {@code name}. The n-th
 *       value appended must carry index n. Anything else (a gap, a repeat,
 *       a reordering) is an {@link ProtocolIssue.Kind#INDEX_GAP}. Values are
 *       never reindexed.</li>
 *   <li>Any other key is a scalar. A later duplicate overwrites an earlier one
 *       but keeps its position.</li>
 *   <li>After the scan, every array {@code name} needs a scalar
 *       {@code num_<name>s} equal to its length
 *       ({@link ProtocolIssue.Kind#MISSING_COUNT} /
 *       {@link ProtocolIssue.Kind#COUNT_MISMATCH}). The count key is removed
 *       either way.</li>
 * </ol>
 *
 * <h2>Strictness</h2>
 * Under {@link DecodeStrictness#STRICT} the first violation throws
 * {@link ConsistencyException}. Under {@link DecodeStrictness#LENIENT} the
 * violation is recorded on the returned map, the offending value is appended
 * as received, and folding continues.
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>Folding assumes the engine emits indices in ascending order. Out-of-order
 *       emission is reported, not repaired.</li>
 *   <li>If a scalar and an array share a name, the array wins.</li>
 *   <li>A {@code num_<name>s} key with no matching indexed keys (e.g. a count of
 *       zero) stays a plain scalar.</li>
 * </ul>
 */
public final class ArrayReassembler
{
    private static final Pattern INDEXED_KEY = Pattern.compile("^(.+)\\[(\\d+)]$");

    private final DecodeStrictness strictness;

    public ArrayReassembler(DecodeStrictness strictness) {
        this.strictness = Objects.requireNonNull(strictness, "strictness");
    }

    /**
     * Folds {@code values} into a property map.
     */
    public <T> PropertyMap<T> fold(List<NamedValue<T>> values, CountReader<? super T> countReader) {
        return fold(values, countReader, List.of());
    }

    /**
     * Folds {@code values} into a property map, carrying issues already found by
     * an earlier decode stage into the result.
     *
     * @throws ConsistencyException under strict decoding, on the first violation
     * @throws ProtocolException    if an array index is not a valid number
     */
    public <T> PropertyMap<T> fold(List<NamedValue<T>> values,
                                   CountReader<? super T> countReader,
                                   List<ProtocolIssue> carriedIssues) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(countReader, "countReader");

        final List<ProtocolIssue> issues = new ArrayList<>(carriedIssues);

        // Placeholder (null) marks where a folded array will be placed.
        final Map<String, Property<T>> layout = new LinkedHashMap<>();
        final Map<String, List<T>> arrays = new LinkedHashMap<>();

        for (NamedValue<T> entry : values) {
            Matcher indexed = INDEXED_KEY.matcher(entry.name());
            if (!indexed.matches()) {
                layout.put(entry.name(), new Property.Scalar<>(entry.value()));
                continue;
            }

            final String arrayName = indexed.group(1);
            final long index = parseIndex(entry.name(), indexed.group(2));

            List<T> elements = arrays.computeIfAbsent(arrayName, k -> new ArrayList<>());
            layout.putIfAbsent(arrayName, null);

            final int expected = elements.size() + 1;
            if (index != expected) {
                violation(issues, new ProtocolIssue(ProtocolIssue.Kind.INDEX_GAP, arrayName,
                        "Array '" + arrayName + "' expected index " + expected + " but got " + index));
            }
            elements.add(entry.value());
        }

        for (Map.Entry<String, List<T>> array : arrays.entrySet()) {
            checkCount(array.getKey(), array.getValue().size(), layout, countReader, issues);
            layout.put(array.getKey(), new Property.Array<>(new ArrayField<>(array.getKey(), array.getValue())));
        }

        return new PropertyMap<>(layout, issues);
    }

    private <T> void checkCount(String arrayName,
                                int length,
                                Map<String, Property<T>> layout,
                                CountReader<? super T> countReader,
                                List<ProtocolIssue> issues) {
        final String countKey = countKeyFor(arrayName);
        final Property<T> count = layout.get(countKey);

        if (!(count instanceof Property.Scalar<T> scalar)) {
            violation(issues, new ProtocolIssue(ProtocolIssue.Kind.MISSING_COUNT, arrayName,
                    "Array '" + arrayName + "' has no scalar '" + countKey + "'"));
            return;
        }

        layout.remove(countKey);

        OptionalLong advertised = countReader.count(scalar.value());
        if (advertised.isEmpty() || advertised.getAsLong() != length) {
            violation(issues, new ProtocolIssue(ProtocolIssue.Kind.COUNT_MISMATCH, arrayName,
                    "Array '" + arrayName + "' has " + length + " elements but '" + countKey
                            + "' is " + scalar.value()));
        }
    }

    /**
     * Returns the name of the count field for an array, e.g. {@code curve -> num_curves}.
     */
    public static String countKeyFor(String arrayName) {
        return "num_" + arrayName + "s";
    }

    private static long parseIndex(String key, String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Array index out of range in key '" + key + "'", e);
        }
    }

    private void violation(List<ProtocolIssue> issues, ProtocolIssue issue) {
        if (strictness == DecodeStrictness.STRICT) {
            throw new ConsistencyException(issue);
        }
        issues.add(issue);
    }
}
