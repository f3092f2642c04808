package com.streamfirst.tabular.verified.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/** Field names of a column's metadata when it is compared as an {@link Entity}. */
public final class ColumnFields {

    public static final String TYPE = "type";
    public static final String LABEL = "label";
    public static final String FORMULA = "formula";
    public static final String FORMULA_TEXT = "formulaText";

    private ColumnFields() {}

    /** Every property of the column, nulls included. */
    public static Map<String, Object> of(ColumnInfo column) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TYPE, column.type());
        fields.put(LABEL, column.label());
        fields.put(FORMULA, column.formula());
        fields.put(FORMULA_TEXT, column.formulaText());
        return fields;
    }

    /** The properties a new column is created with; unset optional ones are left out. */
    public static Map<String, Object> definedBy(ColumnInfo column) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TYPE, column.type());
        fields.put(FORMULA, column.formula());
        if (column.label() != null) {
            fields.put(LABEL, column.label());
        }
        if (column.formulaText() != null) {
            fields.put(FORMULA_TEXT, column.formulaText());
        }
        return fields;
    }
}
