package com.streamfirst.tabular.verified.application.executors;

import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.SemanticType;
import com.streamfirst.tabular.verified.ports.WriteContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A write whose entities are verified field by field against their read-back state.
 *
 * @param <I> the operation input
 * @param <R> the caller-facing result
 */
public interface FieldVerifyingOperation<I, R> extends WriteOperation<I> {

    /**
     * Performs the write.
     *
     * @return the written entities carrying their backend-assigned identities
     */
    CompletableFuture<List<Entity>> execute(WriteContext ctx, DocId docId, I input);

    /**
     * Reads the current state of the written entities.
     *
     * @return one element per written entity, in the same order; empty where it did not resolve
     */
    CompletableFuture<List<Optional<Entity>>> readBack(WriteContext ctx, DocId docId, List<Entity> written);

    /** Formats the affected identities for error context, e.g. "Orders:[1,2]". */
    String buildEntityId(I input, List<Entity> written);

    /** Converts the written entities into the caller-facing result. */
    R buildResult(List<Entity> written, I input);

    /**
     * Supplies semantic type hints for canonicalization. Without hints, values are compared
     * structurally.
     */
    default CompletableFuture<Map<String, SemanticType>> getColumnTypes(WriteContext ctx, DocId docId, I input) {
        return CompletableFuture.completedFuture(Map.of());
    }
}
