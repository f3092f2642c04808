package com.streamfirst.tabular.verified.domain;

import java.util.Objects;

/**
 * Column metadata as reported by the backend.
 *
 * @param colId the column identifier within its table
 * @param type the backend type label (e.g. "Text", "DateTime:UTC", "Ref:People")
 * @param formula true if the column value is computed by the backend
 * @param label display label, or null when the column has none
 * @param formulaText the formula source, or null when the column has none
 */
public record ColumnInfo(String colId, String type, boolean formula, String label, String formulaText) {
    public ColumnInfo {
        Objects.requireNonNull(colId, "Column ID cannot be null");
        Objects.requireNonNull(type, "Column type cannot be null");
    }

    public ColumnInfo(String colId, String type, boolean formula) {
        this(colId, type, formula, null, null);
    }

    public static ColumnInfo data(String colId, String type) {
        return new ColumnInfo(colId, type, false);
    }

    public static ColumnInfo formula(String colId, String type) {
        return new ColumnInfo(colId, type, true);
    }

    public SemanticType semanticType() {
        return SemanticType.fromColumnType(type);
    }

    public ColumnInfo withColId(String newColId) {
        return new ColumnInfo(newColId, type, formula, label, formulaText);
    }

    public ColumnInfo withLabel(String newLabel) {
        return new ColumnInfo(colId, type, formula, newLabel, formulaText);
    }

    /** Returns a copy computed by the given formula source. */
    public ColumnInfo withFormula(String source) {
        return new ColumnInfo(colId, type, true, label, source);
    }
}
