package com.streamfirst.tabular.verified.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * One atomic assertion made while verifying a write. Expected and actual values are
 * {@link Absent#VALUE} when the check does not record them; {@code null} is a recorded value.
 *
 * @param description human-readable statement of what was checked
 * @param passed whether the assertion held
 * @param field the written field this check covers, or null for entity-level checks
 * @param expected the value the caller wrote or the state it expected
 * @param actual the value or state read back from the backend
 */
public record VerificationCheck(
    String description, boolean passed, String field, Object expected, Object actual) {

    public VerificationCheck {
        Objects.requireNonNull(description, "Check description cannot be null");
    }

    /** An entity-level check that records no values. */
    public static VerificationCheck of(String description, boolean passed) {
        return new VerificationCheck(description, passed, null, Absent.VALUE, Absent.VALUE);
    }

    /** An entity-level check with expected and actual states. */
    public static VerificationCheck of(
        String description, boolean passed, Object expected, Object actual) {
        return new VerificationCheck(description, passed, null, expected, actual);
    }

    /** A check comparing one written field against its read-back value. */
    public static VerificationCheck ofField(
        String description, String field, boolean passed, Object expected, Object actual) {
        Objects.requireNonNull(field, "Field name cannot be null");
        return new VerificationCheck(description, passed, field, expected, actual);
    }

    public Optional<String> fieldName() {
        return Optional.ofNullable(field);
    }

    /** True when both expected and actual values were recorded. */
    public boolean hasValues() {
        return !Absent.is(expected) && !Absent.is(actual);
    }

    public boolean isFieldFailure(String name) {
        return !passed && name.equals(field);
    }
}
