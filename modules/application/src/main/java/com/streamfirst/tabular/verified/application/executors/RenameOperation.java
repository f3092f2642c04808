package com.streamfirst.tabular.verified.application.executors;

import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.ports.WriteContext;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Strategy for relabeling an entity's identity. Verification requires the old identity to be gone
 * and the new one to resolve.
 */
public interface RenameOperation<I, R> extends WriteOperation<I> {

    CompletableFuture<Void> execute(WriteContext ctx, DocId docId, I input);

    /** Resolves the old identity; empty after a successful rename. */
    CompletableFuture<Optional<Entity>> readOld(WriteContext ctx, DocId docId, I input);

    /** Resolves the new identity; present after a successful rename. */
    CompletableFuture<Optional<Entity>> readNew(WriteContext ctx, DocId docId, I input);

    /** Formats both identities for error context, e.g. "Orders -> Purchases". */
    String buildEntityId(I input);

    R buildResult(Entity renamed, I input);
}
