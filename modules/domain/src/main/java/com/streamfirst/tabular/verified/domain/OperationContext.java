package com.streamfirst.tabular.verified.domain;

import java.util.Objects;

/**
 * Identifies the operation that produced a verification result. Used only for diagnostics.
 *
 * @param operation operation name (e.g. "addRecords")
 * @param entityType entity type label (e.g. "Record")
 * @param entityId formatted identity of the affected entities (e.g. "Orders:[1,2]")
 */
public record OperationContext(String operation, String entityType, String entityId) {
    public OperationContext {
        Objects.requireNonNull(operation, "Operation name cannot be null");
        Objects.requireNonNull(entityType, "Entity type cannot be null");
        Objects.requireNonNull(entityId, "Entity ID cannot be null");
    }

    @Override
    public String toString() {
        return operation + " " + entityType + " " + entityId;
    }
}
