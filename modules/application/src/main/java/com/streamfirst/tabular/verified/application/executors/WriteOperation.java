package com.streamfirst.tabular.verified.application.executors;

import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.ports.WriteContext;

import java.util.concurrent.CompletableFuture;

/**
 * Behavior shared by every write strategy handed to {@link WriteExecutor}.
 *
 * @param <I> the operation input
 */
public interface WriteOperation<I> {

    /** Operation name for diagnostics, e.g. "addRecords". */
    String name();

    /** Entity type label for diagnostics, e.g. "Record". */
    String entityType();

    /**
     * Runs once after every successful write, whether or not it is verified. Used to invalidate
     * cached metadata the write made stale.
     */
    default CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, I input) {
        return CompletableFuture.completedFuture(null);
    }
}
