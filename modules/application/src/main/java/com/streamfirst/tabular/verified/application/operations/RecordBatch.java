package com.streamfirst.tabular.verified.application.operations;

import com.streamfirst.tabular.verified.domain.Entity;

import java.util.List;

/**
 * Rows confirmed by an add or update, in the form the caller wrote them.
 *
 * @param tableId the table written to
 * @param records the written rows with their identities
 */
public record RecordBatch(String tableId, List<Entity> records) {
    public RecordBatch {
        records = List.copyOf(records);
    }

    public int count() {
        return records.size();
    }
}
