package com.streamfirst.tabular.verified.domain;

import lombok.Getter;

/** Thrown when an entity a write operation depends on cannot be read after the write. */
@Getter
public class EntityNotFoundException extends RuntimeException {

    private final String entityType;
    private final String entityId;

    public EntityNotFoundException(String entityType, String entityId, String operation) {
        super(entityType + " " + entityId + " not found after " + operation + " operation");
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
