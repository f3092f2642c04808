package com.streamfirst.tabular.verified.domain;

/**
 * How a field's value is interpreted when two encodings of the same logical value are compared.
 * Derived from the backend's column type label.
 */
public enum SemanticType {
    /** Free text and single choice values */
    TEXT,
    /** Whole numbers */
    INTEGER,
    /** Floating point numbers */
    DECIMAL,
    /** True/false values */
    BOOLEAN,
    /** Calendar dates, encoded as epoch seconds at midnight UTC */
    DATE,
    /** Instants, encoded as epoch seconds; the column's timezone label is ignored */
    DATE_TIME,
    /** Ordered lists that may arrive prefixed with the "L" list marker */
    TAGGED_LIST,
    /** A single row reference, bare id or ["R", table, id] */
    REFERENCE,
    /** A list of row references, with or without the list marker */
    REFERENCE_LIST,
    /** Any other type; compared structurally without coercion */
    OTHER;

    /**
     * Maps a backend column type label to its semantic type. Parameterized labels such as
     * "DateTime:America/New_York" or "Ref:People" are matched on their prefix.
     */
    public static SemanticType fromColumnType(String columnType) {
        if (columnType == null || columnType.isBlank()) {
            return OTHER;
        }
        String base = columnType.contains(":")
            ? columnType.substring(0, columnType.indexOf(':'))
            : columnType;
        switch (base) {
            case "Text":
            case "Choice":
                return TEXT;
            case "Int":
            case "Id":
            case "ManualSortPos":
                return INTEGER;
            case "Numeric":
                return DECIMAL;
            case "Bool":
                return BOOLEAN;
            case "Date":
                return DATE;
            case "DateTime":
                return DATE_TIME;
            case "ChoiceList":
            case "Attachments":
                return TAGGED_LIST;
            case "Ref":
                return REFERENCE;
            case "RefList":
                return REFERENCE_LIST;
            default:
                return OTHER;
        }
    }

    /** True for types whose values are instants. */
    public boolean isInstant() {
        return this == DATE || this == DATE_TIME;
    }
}
