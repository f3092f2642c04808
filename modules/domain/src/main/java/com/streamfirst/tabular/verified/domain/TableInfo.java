package com.streamfirst.tabular.verified.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Table metadata as reported by the backend.
 *
 * @param tableId the table identifier within its document
 * @param columns the table's columns in display order
 */
public record TableInfo(String tableId, List<ColumnInfo> columns) {
    public TableInfo {
        Objects.requireNonNull(tableId, "Table ID cannot be null");
        columns = List.copyOf(columns);
    }

    public Optional<ColumnInfo> column(String colId) {
        return columns.stream().filter(c -> c.colId().equals(colId)).findFirst();
    }

    /** Maps every column ID to its semantic type, in column order. */
    public Map<String, SemanticType> columnTypes() {
        Map<String, SemanticType> types = new LinkedHashMap<>();
        for (ColumnInfo column : columns) {
            types.put(column.colId(), column.semanticType());
        }
        return types;
    }
}
