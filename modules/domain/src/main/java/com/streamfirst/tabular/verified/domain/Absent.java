package com.streamfirst.tabular.verified.domain;

/**
 * Marker for a field value that is not present at all, as opposed to a field that is present and
 * holds {@code null}. A written field holding this marker was not part of the write payload.
 */
public enum Absent {
    VALUE;

    /** Returns true if the given value is the absent marker. */
    public static boolean is(Object value) {
        return value == VALUE;
    }

    @Override
    public String toString() {
        return "<absent>";
    }
}
