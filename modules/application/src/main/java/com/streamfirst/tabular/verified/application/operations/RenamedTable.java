package com.streamfirst.tabular.verified.application.operations;

import java.util.List;

/**
 * A table confirmed under its new ID.
 *
 * @param columns the column IDs the renamed table reports
 */
public record RenamedTable(String oldTableId, String newTableId, List<String> columns) {
    public RenamedTable {
        columns = List.copyOf(columns);
    }
}
