package com.streamfirst.tabular.verified.ports;

import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.SemanticType;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the column metadata cache. The write engine only reads type hints through it and
 * invalidates entries after writes; it never touches the cache's internals.
 */
public interface SchemaCachePort {

    /**
     * Returns the semantic type of each column in a table.
     *
     * @return column ID to semantic type; empty if the table is unknown
     */
    CompletableFuture<Map<String, SemanticType>> getColumnTypes(DocId docId, String tableId);

    /** Drops cached metadata for one table. */
    void invalidateTable(DocId docId, String tableId);

    /** Drops cached metadata for every table of a document. */
    void invalidateDocument(DocId docId);
}
