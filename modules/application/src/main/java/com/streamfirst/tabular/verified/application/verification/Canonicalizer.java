package com.streamfirst.tabular.verified.application.verification;

import com.streamfirst.tabular.verified.domain.Absent;
import com.streamfirst.tabular.verified.domain.SemanticType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reduces field values to a canonical form so that a written value and its read-back counterpart
 * can be compared across the backend's wire encodings.
 *
 * <p>Only encodings known for a type are folded together. Unknown types and values that do not
 * parse are passed through unchanged, and comparison never coerces between strings, numbers and
 * booleans.
 */
public final class Canonicalizer {

    /** Leading token of a tagged list: ["L", a, b] */
    public static final String LIST_MARKER = "L";

    /** Leading token of a tagged reference: ["R", table, id] */
    public static final String REFERENCE_MARKER = "R";

    /** Leading token of a tagged reference list: ["r", table, [ids]] */
    public static final String REFERENCE_LIST_MARKER = "r";

    static final String DATE_MARKER = "d";
    static final String DATE_TIME_MARKER = "D";

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}.*$");
    private static final int MICROS_SCALE = 6;
    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    private Canonicalizer() {}

    /**
     * Returns the canonical form of a value.
     *
     * @param value the raw value; may be null or {@link Absent#VALUE}
     * @param type the field's semantic type, or null when unknown
     */
    public static Object canonicalize(Object value, SemanticType type) {
        if (Absent.is(value) || type == null) {
            return value;
        }
        switch (type) {
            case DATE:
            case DATE_TIME:
                return parseInstant(value).<Object>map(i -> i).orElse(value);
            case TAGGED_LIST:
                return value == null ? List.of() : stripListMarker(value);
            case REFERENCE:
                return referenceId(value);
            case REFERENCE_LIST:
                return value == null ? List.of() : stripListMarker(unwrapReferenceList(value));
            default:
                return value;
        }
    }

    /** Structural equivalence of two values without a type hint. */
    public static boolean equivalent(Object a, Object b) {
        return equivalent(a, b, null);
    }

    /**
     * Canonicalizes both values with the same type hint, then compares them structurally: lists
     * element-wise in order, maps by exact key set and recursive equivalence, everything else by
     * equality with numbers compared by value.
     */
    public static boolean equivalent(Object a, Object b, SemanticType type) {
        return structurallyEqual(canonicalize(a, type), canonicalize(b, type));
    }

    /**
     * Interprets a value as an instant: epoch seconds (fractions allowed), an ISO-8601 date or
     * date-time string, an {@link Instant}, or a tagged ["d", seconds] / ["D", seconds, tz] tuple.
     * Strings without an offset are read as UTC.
     *
     * <p>Results carry microsecond precision at most, the precision epoch seconds survive on the
     * wire with.
     */
    public static Optional<Instant> parseInstant(Object value) {
        return parse(value).map(instant -> instant.truncatedTo(ChronoUnit.MICROS));
    }

    private static Optional<Instant> parse(Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof Number number) {
            return fromEpochSeconds(number);
        }
        if (value instanceof String text) {
            return parseIsoString(text.trim());
        }
        if (value instanceof List<?> tuple && tuple.size() >= 2
            && (DATE_MARKER.equals(tuple.get(0)) || DATE_TIME_MARKER.equals(tuple.get(0)))
            && tuple.get(1) instanceof Number seconds) {
            return fromEpochSeconds(seconds);
        }
        return Optional.empty();
    }

    /** Returns true if the value is a list that starts with the list marker. */
    public static boolean isTaggedList(Object value) {
        return value instanceof List<?> list && !list.isEmpty() && LIST_MARKER.equals(list.get(0));
    }

    private static Object stripListMarker(Object value) {
        if (isTaggedList(value)) {
            List<?> list = (List<?>) value;
            return Collections.unmodifiableList(new ArrayList<>(list.subList(1, list.size())));
        }
        return value;
    }

    private static Object referenceId(Object value) {
        if (value instanceof List<?> tuple && tuple.size() == 3 && REFERENCE_MARKER.equals(tuple.get(0))) {
            return tuple.get(2);
        }
        return value;
    }

    private static Object unwrapReferenceList(Object value) {
        if (value instanceof List<?> tuple && tuple.size() == 3
            && REFERENCE_LIST_MARKER.equals(tuple.get(0)) && tuple.get(2) instanceof List<?> ids) {
            return Collections.unmodifiableList(new ArrayList<>(ids));
        }
        return value;
    }

    private static Optional<Instant> fromEpochSeconds(Number number) {
        BigDecimal seconds = toBigDecimal(number);
        if (seconds == null) {
            return Optional.empty();
        }
        // Round off binary noise below a microsecond before splitting
        seconds = seconds.setScale(MICROS_SCALE, RoundingMode.HALF_UP);
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).multiply(NANOS_PER_SECOND).longValue();
        try {
            return Optional.of(Instant.ofEpochSecond(whole.longValueExact(), nanos));
        } catch (ArithmeticException | DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseIsoString(String text) {
        try {
            if (ISO_DATE.matcher(text).matches()) {
                return Optional.of(LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
            }
            if (ISO_DATE_TIME.matcher(text).matches()) {
                String iso = text.replace(' ', 'T');
                return Optional.of(hasOffset(iso)
                    ? OffsetDateTime.parse(iso).toInstant()
                    : LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC));
            }
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static boolean hasOffset(String iso) {
        if (iso.endsWith("Z") || iso.endsWith("z")) {
            return true;
        }
        int timeStart = iso.indexOf('T');
        return iso.indexOf('+', timeStart) > 0 || iso.indexOf('-', timeStart) > 0;
    }

    private static boolean structurallyEqual(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || Absent.is(a) || Absent.is(b)) {
            return false;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return numericallyEqual(x, y);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            Iterator<?> left = x.iterator();
            Iterator<?> right = y.iterator();
            while (left.hasNext()) {
                if (!structurallyEqual(left.next(), right.next())) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            if (!x.keySet().equals(y.keySet())) {
                return false;
            }
            return x.entrySet().stream().allMatch(e -> structurallyEqual(e.getValue(), y.get(e.getKey())));
        }
        return Objects.equals(a, b);
    }

    private static boolean numericallyEqual(Number x, Number y) {
        BigDecimal left = toBigDecimal(x);
        BigDecimal right = toBigDecimal(y);
        if (left == null || right == null) {
            // NaN and infinities
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return left.compareTo(right) == 0;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
