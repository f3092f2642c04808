package com.streamfirst.tabular.verified.application.executors;

import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.ports.WriteContext;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Strategy for removing entities. Verification passes only if none of the deleted identities
 * still resolve.
 *
 * @param <I> the operation input
 * @param <K> the identity type
 * @param <R> the caller-facing result
 */
public interface DeleteOperation<I, K, R> extends WriteOperation<I> {

    /** Performs the delete and returns the removed identities. */
    CompletableFuture<List<K>> execute(WriteContext ctx, DocId docId, I input);

    /** Returns the entities among {@code deletedIds} that still exist; ideally none. */
    CompletableFuture<List<Entity>> readBack(WriteContext ctx, DocId docId, List<K> deletedIds);

    String buildEntityId(I input, List<K> deletedIds);

    R buildResult(List<K> deletedIds, I input);
}
