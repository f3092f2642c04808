package com.streamfirst.tabular.verified.application.operations;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Inputs of the record write operations. */
public final class RecordRequests {

    private RecordRequests() {}

    /**
     * @param tableId the target table
     * @param rows caller-facing field values, one map per new row
     */
    public record AddRecords(String tableId, List<Map<String, Object>> rows) {
        public AddRecords {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            rows = List.copyOf(rows);
        }
    }

    /**
     * @param id the row to update
     * @param fields the fields to set; fields not listed are left untouched
     */
    public record RecordUpdate(long id, Map<String, Object> fields) {
        public RecordUpdate {
            Objects.requireNonNull(fields, "Update fields cannot be null");
        }
    }

    public record UpdateRecords(String tableId, List<RecordUpdate> updates) {
        public UpdateRecords {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            updates = List.copyOf(updates);
        }
    }

    public record DeleteRecords(String tableId, List<Long> rowIds) {
        public DeleteRecords {
            Objects.requireNonNull(tableId, "Table ID cannot be null");
            rowIds = List.copyOf(rowIds);
        }
    }
}
