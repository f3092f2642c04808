package com.streamfirst.tabular.verified.application.operations;

import com.streamfirst.tabular.verified.application.verification.Canonicalizer;
import com.streamfirst.tabular.verified.domain.Absent;
import com.streamfirst.tabular.verified.domain.SemanticType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts caller-facing cell values into the backend's wire encoding before a write, and wire
 * values back into caller-facing ones after a read.
 *
 * <p>Instants travel as epoch seconds and keep microsecond precision at most.
 */
public final class CellCodec {

    private CellCodec() {}

    /**
     * Encodes one value for the wire: plain lists gain the list marker, ISO date strings and
     * instants become epoch seconds. Values of other types, and values already encoded, are
     * returned unchanged.
     */
    public static Object encode(Object value, SemanticType type) {
        if (value == null || Absent.is(value) || type == null) {
            return value;
        }
        switch (type) {
            case TAGGED_LIST:
            case REFERENCE_LIST:
                if (value instanceof List<?> list && !Canonicalizer.isTaggedList(list)) {
                    List<Object> tagged = new ArrayList<>(list.size() + 1);
                    tagged.add(Canonicalizer.LIST_MARKER);
                    tagged.addAll(list);
                    return tagged;
                }
                return value;
            case DATE:
            case DATE_TIME:
                if (value instanceof String || value instanceof Instant) {
                    return Canonicalizer.parseInstant(value).<Object>map(CellCodec::epochSeconds).orElse(value);
                }
                return value;
            default:
                return value;
        }
    }

    /** Decodes one wire value into its canonical caller-facing form. */
    public static Object decode(Object value, SemanticType type) {
        return Canonicalizer.canonicalize(value, type);
    }

    public static Map<String, Object> encodeRow(Map<String, ?> row, Map<String, SemanticType> types) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        row.forEach((field, value) -> encoded.put(field, encode(value, types.get(field))));
        return encoded;
    }

    public static Map<String, Object> decodeRow(Map<String, ?> row, Map<String, SemanticType> types) {
        Map<String, Object> decoded = new LinkedHashMap<>();
        row.forEach((field, value) -> decoded.put(field, decode(value, types.get(field))));
        return decoded;
    }

    /** Whole seconds as a long, otherwise seconds with microsecond precision. */
    private static Number epochSeconds(Instant instant) {
        Instant micros = instant.truncatedTo(ChronoUnit.MICROS);
        if (micros.getNano() == 0) {
            return micros.getEpochSecond();
        }
        return BigDecimal.valueOf(micros.getEpochSecond())
            .add(BigDecimal.valueOf(micros.getNano() / 1_000L, 6))
            .doubleValue();
    }
}
