package com.streamfirst.tabular.verified.application.operations;

import java.util.List;

/**
 * Rows confirmed removed by a delete.
 */
public record DeletedRecords(String tableId, List<Long> deletedIds) {
    public DeletedRecords {
        deletedIds = List.copyOf(deletedIds);
    }

    public int count() {
        return deletedIds.size();
    }
}
