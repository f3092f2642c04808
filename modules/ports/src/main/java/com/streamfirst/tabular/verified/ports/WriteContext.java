package com.streamfirst.tabular.verified.ports;

import java.util.Objects;

/**
 * Collaborators handed to every write operation: the backend it writes to and the metadata cache
 * it reads type hints from and invalidates.
 *
 * @param backend the remote backend
 * @param schemaCache the column metadata cache
 */
public record WriteContext(TabularBackendPort backend, SchemaCachePort schemaCache) {
    public WriteContext {
        Objects.requireNonNull(backend, "Backend cannot be null");
        Objects.requireNonNull(schemaCache, "Schema cache cannot be null");
    }
}
