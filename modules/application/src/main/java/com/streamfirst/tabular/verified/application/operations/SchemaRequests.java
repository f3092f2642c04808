package com.streamfirst.tabular.verified.application.operations;

import com.streamfirst.tabular.verified.domain.ColumnChanges;
import com.streamfirst.tabular.verified.domain.ColumnInfo;

import java.util.List;
import java.util.Objects;

/** Inputs of the schema write operations. */
public final class SchemaRequests {

    private SchemaRequests() {}

    /**
     * @param tableId the requested table ID
     * @param columns the table's initial columns, possibly none
     */
    public record CreateTable(String tableId, List<ColumnInfo> columns) {
        public CreateTable {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            columns = List.copyOf(columns);
        }
    }

    public record DeleteTable(String tableId) {
        public DeleteTable {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
        }
    }

    public record AddColumn(String tableId, ColumnInfo column) {
        public AddColumn {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            Objects.requireNonNull(column, "Column cannot be null");
        }
    }

    public record ModifyColumn(String tableId, String colId, ColumnChanges changes) {
        public ModifyColumn {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            Objects.requireNonNull(colId, "Column ID cannot be null");
            Objects.requireNonNull(changes, "Column changes cannot be null");
        }
    }

    public record RemoveColumn(String tableId, String colId) {
        public RemoveColumn {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            Objects.requireNonNull(colId, "Column ID cannot be null");
        }
    }

    public record RenameTable(String oldTableId, String newTableId) {
        public RenameTable {
            Objects.requireNonNull(oldTableId, "Old table ID cannot be null");
            Objects.requireNonNull(newTableId, "New table ID cannot be null");
        }
    }

    public record RenameColumn(String tableId, String oldColId, String newColId) {
        public RenameColumn {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            Objects.requireNonNull(oldColId, "Old column ID cannot be null");
            Objects.requireNonNull(newColId, "New column ID cannot be null");
        }
    }
}
