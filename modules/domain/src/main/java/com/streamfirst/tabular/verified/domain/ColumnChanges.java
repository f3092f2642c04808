package com.streamfirst.tabular.verified.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Properties to change on an existing column. Properties left null are not touched.
 */
@Value
@Builder
public class ColumnChanges {

    String type;
    String label;
    Boolean formula;
    String formulaText;

    /** Applies the set properties on top of the given column. */
    public ColumnInfo applyTo(ColumnInfo column) {
        return new ColumnInfo(
            column.colId(),
            type != null ? type : column.type(),
            formula != null ? formula : column.formula(),
            label != null ? label : column.label(),
            formulaText != null ? formulaText : column.formulaText());
    }

    /**
     * Returns the set properties keyed by the field names column metadata is read back with.
     */
    public Map<String, Object> changedFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (type != null) {
            fields.put(ColumnFields.TYPE, type);
        }
        if (label != null) {
            fields.put(ColumnFields.LABEL, label);
        }
        if (formula != null) {
            fields.put(ColumnFields.FORMULA, formula);
        }
        if (formulaText != null) {
            fields.put(ColumnFields.FORMULA_TEXT, formulaText);
        }
        return fields;
    }
}
