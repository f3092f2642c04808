package com.streamfirst.tabular.verified.application.verification;

import com.streamfirst.tabular.verified.domain.Absent;
import com.streamfirst.tabular.verified.domain.SemanticType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanonicalizerTest {

    @Test
    void testCanonicalizationIsIdempotent() {
        List<Object[]> samples = List.of(
            new Object[] {List.of("L", "red", "blue"), SemanticType.TAGGED_LIST},
            new Object[] {null, SemanticType.TAGGED_LIST},
            new Object[] {List.of("R", "People", 5), SemanticType.REFERENCE},
            new Object[] {List.of("r", "People", List.of(1, 2)), SemanticType.REFERENCE_LIST},
            new Object[] {"2024-03-01", SemanticType.DATE},
            new Object[] {1709251200L, SemanticType.DATE_TIME},
            new Object[] {"plain", SemanticType.TEXT},
            new Object[] {Map.of("a", 1), null});

        for (Object[] sample : samples) {
            SemanticType type = (SemanticType) sample[1];
            Object once = Canonicalizer.canonicalize(sample[0], type);
            assertEquals(once, Canonicalizer.canonicalize(once, type), "for " + Arrays.toString(sample));
        }
    }

    @Test
    void testTaggedListMatchesPlainList() {
        assertTrue(Canonicalizer.equivalent(List.of("red", "blue"), List.of("L", "red", "blue"), SemanticType.TAGGED_LIST));
        assertFalse(Canonicalizer.equivalent(List.of("blue", "red"), List.of("L", "red", "blue"), SemanticType.TAGGED_LIST));
    }

    @Test
    void testEmptyTaggedListMatchesNull() {
        assertTrue(Canonicalizer.equivalent(List.of(), null, SemanticType.TAGGED_LIST));
        assertTrue(Canonicalizer.equivalent(List.of("L"), null, SemanticType.TAGGED_LIST));
        assertFalse(Canonicalizer.equivalent(List.of(), null, SemanticType.TEXT));
    }

    @Test
    void testReferenceMatchesTaggedReference() {
        assertTrue(Canonicalizer.equivalent(5, List.of("R", "People", 5), SemanticType.REFERENCE));
        assertTrue(Canonicalizer.equivalent(5L, List.of("R", "People", 5), SemanticType.REFERENCE));
        assertFalse(Canonicalizer.equivalent(6, List.of("R", "People", 5), SemanticType.REFERENCE));
    }

    @Test
    void testReferenceListMatchesAllEncodings() {
        Object tagged = List.of("r", "People", List.of(1, 2));
        assertTrue(Canonicalizer.equivalent(List.of(1, 2), tagged, SemanticType.REFERENCE_LIST));
        assertTrue(Canonicalizer.equivalent(List.of("L", 1, 2), tagged, SemanticType.REFERENCE_LIST));
        assertTrue(Canonicalizer.equivalent(List.of(), null, SemanticType.REFERENCE_LIST));
    }

    @Test
    void testDatesCompareAsInstants() {
        assertTrue(Canonicalizer.equivalent("2024-03-01", 1709251200L, SemanticType.DATE));
        assertTrue(Canonicalizer.equivalent("2024-03-01T12:30:00Z", 1709296200, SemanticType.DATE_TIME));
        assertTrue(Canonicalizer.equivalent("2024-03-01 07:30:00-05:00", 1709296200, SemanticType.DATE_TIME));
        assertTrue(Canonicalizer.equivalent(List.of("d", 1709251200), "2024-03-01", SemanticType.DATE));
        assertTrue(Canonicalizer.equivalent(
            List.of("D", 1709296200, "America/New_York"), Instant.parse("2024-03-01T12:30:00Z"), SemanticType.DATE_TIME));
        assertFalse(Canonicalizer.equivalent("2024-03-02", 1709251200L, SemanticType.DATE));
    }

    @Test
    void testFractionalEpochSeconds() {
        assertThat(Canonicalizer.parseInstant(1.5)).contains(Instant.ofEpochSecond(1, 500_000_000));
        assertThat(Canonicalizer.parseInstant("not a date")).isEmpty();
    }

    @Test
    void testInstantsCompareAtMicrosecondPrecision() {
        Instant nanos = Instant.parse("2024-03-01T10:00:00.123456789Z");
        assertThat(Canonicalizer.parseInstant(nanos)).contains(Instant.parse("2024-03-01T10:00:00.123456Z"));
        assertThat(Canonicalizer.parseInstant("2024-03-01T10:00:00.123456789Z"))
            .contains(Instant.parse("2024-03-01T10:00:00.123456Z"));
        assertTrue(Canonicalizer.equivalent(nanos, 1709287200.123456, SemanticType.DATE_TIME));
        assertFalse(Canonicalizer.equivalent(nanos, 1709287200.123457, SemanticType.DATE_TIME));
    }

    @Test
    void testListStartingWithMarkerTextLosesOneMarkerPerPass() {
        // A list whose first real element is the marker text cannot be told apart from a tagged list
        Object once = Canonicalizer.canonicalize(List.of("L", "L", "a"), SemanticType.TAGGED_LIST);
        assertEquals(List.of("L", "a"), once);
        assertEquals(List.of("a"), Canonicalizer.canonicalize(once, SemanticType.TAGGED_LIST));
    }

    @Test
    void testUnparseableDateIsComparedAsIs() {
        assertEquals("soon", Canonicalizer.canonicalize("soon", SemanticType.DATE));
        assertTrue(Canonicalizer.equivalent("soon", "soon", SemanticType.DATE));
    }

    @Test
    void testNoCoercionBetweenStringsAndNumbers() {
        assertFalse(Canonicalizer.equivalent("5", 5));
        assertFalse(Canonicalizer.equivalent("5", 5, SemanticType.INTEGER));
        assertFalse(Canonicalizer.equivalent("true", true, SemanticType.BOOLEAN));
        assertFalse(Canonicalizer.equivalent(1, true));
    }

    @Test
    void testNullIsNotAbsent() {
        assertFalse(Canonicalizer.equivalent(null, Absent.VALUE));
        assertTrue(Canonicalizer.equivalent(null, null));
        assertTrue(Canonicalizer.equivalent(Absent.VALUE, Absent.VALUE));
    }

    @Test
    void testNumbersCompareByValue() {
        assertTrue(Canonicalizer.equivalent(5, 5L));
        assertTrue(Canonicalizer.equivalent(2.5, new BigDecimal("2.50"), SemanticType.DECIMAL));
        assertFalse(Canonicalizer.equivalent(2.5, 2.4));
    }

    @Test
    void testMapsCompareByKeysAndValues() {
        assertTrue(Canonicalizer.equivalent(Map.of("a", 1, "b", List.of(2)), Map.of("b", List.of(2L), "a", 1L)));
        assertFalse(Canonicalizer.equivalent(Map.of("a", 1), Map.of("a", 1, "b", 2)));
    }

    @Test
    void testUnknownTypePassesThrough() {
        Object value = List.of("L", "x");
        assertEquals(value, Canonicalizer.canonicalize(value, SemanticType.OTHER));
        assertEquals(value, Canonicalizer.canonicalize(value, null));
    }
}
