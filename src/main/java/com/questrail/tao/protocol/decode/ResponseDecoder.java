package com.questrail.tao.protocol.decode;

import com.questrail.tao.api.DecodedValue;
import com.questrail.tao.api.NumericMatrix;
import com.questrail.tao.api.Parameter;
import com.questrail.tao.api.PropertyMap;
import com.questrail.tao.api.ProtocolIssue;
import com.questrail.tao.protocol.query.ResponseLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * ResponseDecoder
 * ============================================================================
 * Turns the lines of one structured query into the caller-facing shapes.
 *
 * <pre>
 *   List&lt;ResponseLine&gt;
 *        → FieldRecord            (positional view)
 *            → FieldDecoder / ParameterDecoder
 *                → ArrayReassembler   → PropertyMap
 *   List&lt;ResponseLine&gt; → ListExtractor          → List&lt;String&gt;
 *   List&lt;ResponseLine&gt; → NumericArrayExtractor  → NumericMatrix
 * </pre>
 *
 * <h2>No-data sentinel</h2>
 * A response whose first field is {@code INVALID} (or that has no lines) decodes
 * to an empty map, an empty list, and a zero-row matrix.
 *
 * <h2>Field failures</h2>
 * Under {@link DecodeStrictness#STRICT} a {@link DecodeException} aborts the
 * record set. Under {@link DecodeStrictness#LENIENT} only the failing field is
 * dropped, and a {@link ProtocolIssue.Kind#DECODE_FAILURE} is recorded. Its
 * siblings are still decoded. Structurally malformed records
 * ({@link com.questrail.tao.protocol.ProtocolException}) abort in both modes.
 */
public final class ResponseDecoder
{
    private final DecodeStrictness strictness;
    private final FieldDecoder fieldDecoder;
    private final ParameterDecoder parameterDecoder;
    private final ArrayReassembler reassembler;
    private final ListExtractor listExtractor;
    private final NumericArrayExtractor matrixExtractor;

    public ResponseDecoder(DecodeStrictness strictness) {
        this.strictness = Objects.requireNonNull(strictness, "strictness");
        this.fieldDecoder = new FieldDecoder();
        this.parameterDecoder = new ParameterDecoder(fieldDecoder);
        this.reassembler = new ArrayReassembler(strictness);
        this.listExtractor = new ListExtractor();
        this.matrixExtractor = new NumericArrayExtractor();
    }

    public PropertyMap<DecodedValue> properties(List<ResponseLine> lines) {
        return decodeAll(lines, fieldDecoder::decode, CountReader.DECODED);
    }

    public PropertyMap<Parameter> parameters(List<ResponseLine> lines) {
        return decodeAll(lines, parameterDecoder::decodeParam, CountReader.PARAMETER);
    }

    public List<String> list(List<ResponseLine> lines) {
        return listExtractor.extract(lines);
    }

    public NumericMatrix matrix(List<ResponseLine> lines, int columns) {
        return matrixExtractor.extract(lines, columns);
    }

    public DecodeStrictness strictness() {
        return strictness;
    }

    private <T> PropertyMap<T> decodeAll(List<ResponseLine> lines,
                                         Function<FieldRecord, NamedValue<T>> decoder,
                                         CountReader<? super T> countReader) {
        Objects.requireNonNull(lines, "lines");
        if (ResponseLine.isNoData(lines)) {
            return PropertyMap.empty();
        }

        List<NamedValue<T>> decoded = new ArrayList<>(lines.size());
        List<ProtocolIssue> issues = new ArrayList<>();

        for (ResponseLine line : lines) {
            FieldRecord record = FieldRecord.from(line);
            try {
                decoded.add(decoder.apply(record));
            } catch (DecodeException e) {
                if (strictness == DecodeStrictness.STRICT) {
                    throw e;
                }
                issues.add(new ProtocolIssue(ProtocolIssue.Kind.DECODE_FAILURE,
                        record.name().toLowerCase(Locale.ROOT), e.getMessage()));
            }
        }

        return reassembler.fold(decoded, countReader, issues);
    }
}
