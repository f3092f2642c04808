package com.streamfirst.tabular.verified.application.executors;

import com.streamfirst.tabular.verified.application.verification.EntityVerifier;
import com.streamfirst.tabular.verified.application.verification.VerificationConfig;
import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.EntityNotFoundException;
import com.streamfirst.tabular.verified.domain.ExecutorSettings;
import com.streamfirst.tabular.verified.domain.OperationContext;
import com.streamfirst.tabular.verified.domain.SemanticType;
import com.streamfirst.tabular.verified.domain.VerificationCheck;
import com.streamfirst.tabular.verified.domain.VerificationException;
import com.streamfirst.tabular.verified.domain.VerificationResult;
import com.streamfirst.tabular.verified.domain.WriteOptions;
import com.streamfirst.tabular.verified.domain.WriteOutcome;
import com.streamfirst.tabular.verified.ports.WriteContext;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Runs write operations through the write-read-verify cycle.
 *
 * <p>Each executor performs the write, runs the operation's post-write hook, and, when
 * verification is requested, reads the affected entities back and compares them with what was
 * written. A caller only receives a result once the backend state reflects the write.
 *
 * <p>A write the backend refuses fails the returned future with the backend's exception as cause;
 * nothing is verified in that case. A write that was accepted but cannot be confirmed fails it with
 * a {@link VerificationException}. Nothing is retried here.
 */
@Slf4j
@RequiredArgsConstructor
public class WriteExecutor {

    @NonNull private final ExecutorSettings settings;

    public WriteExecutor() {
        this(ExecutorSettings.defaults());
    }

    /**
     * Creates entities and verifies every written field.
     *
     * @return future completing with the operation's result built from the written entities
     */
    public <I, R> CompletableFuture<R> executeAdd(
        AddOperation<I, R> operation, WriteContext ctx, DocId docId, I input, WriteOptions options) {
        boolean verify = options.verifyOr(settings.verifyByDefault());
        log.info("Executing {} on {} (verify={})", operation.name(), docId, verify);

        return start(() -> operation.execute(ctx, docId, input))
            .thenCompose(written -> operation.afterExecute(ctx, docId, input).thenApply(v -> written))
            .thenCompose(written -> {
                if (!verify) {
                    return CompletableFuture.completedFuture(written);
                }
                VerificationConfig.VerificationConfigBuilder config = VerificationConfig.builder()
                    .entityName(operation.entityType())
                    .fields(operation.verifyFields());
                return verifyWritten(operation, ctx, docId, input, written, written, config)
                    .thenApply(result -> written);
            })
            .thenApply(written -> operation.buildResult(written, input))
            .whenComplete(logCompletion(operation, docId));
    }

    /**
     * Modifies entities and verifies only the fields each update set.
     */
    public <I, R> CompletableFuture<R> executeUpdate(
        UpdateOperation<I, R> operation, WriteContext ctx, DocId docId, I input, WriteOptions options) {
        boolean verify = options.verifyOr(settings.verifyByDefault());
        log.info("Executing {} on {} (verify={})", operation.name(), docId, verify);

        return start(() -> operation.execute(ctx, docId, input))
            .thenCompose(written -> operation.afterExecute(ctx, docId, input).thenApply(v -> written))
            .thenCompose(written -> {
                if (!verify) {
                    return CompletableFuture.completedFuture(written);
                }
                List<Entity> expected = written.stream()
                    .map(entity -> entity.withFields(operation.getUpdatedFields(input, entity)))
                    .toList();
                VerificationConfig.VerificationConfigBuilder config = VerificationConfig.builder()
                    .entityName(operation.entityType());
                return verifyWritten(operation, ctx, docId, input, written, expected, config)
                    .thenApply(result -> written);
            })
            .thenApply(written -> operation.buildResult(written, input))
            .whenComplete(logCompletion(operation, docId));
    }

    /**
     * Removes entities and verifies none of them still resolve.
     */
    public <I, K, R> CompletableFuture<R> executeDelete(
        DeleteOperation<I, K, R> operation, WriteContext ctx, DocId docId, I input, WriteOptions options) {
        boolean verify = options.verifyOr(settings.verifyByDefault());
        log.info("Executing {} on {} (verify={})", operation.name(), docId, verify);

        return start(() -> operation.execute(ctx, docId, input))
            .thenCompose(deletedIds -> operation.afterExecute(ctx, docId, input).thenApply(v -> deletedIds))
            .thenCompose(deletedIds -> {
                if (!verify) {
                    return CompletableFuture.completedFuture(deletedIds);
                }
                long started = System.nanoTime();
                return operation.readBack(ctx, docId, deletedIds).thenApply(remaining -> {
                    VerificationResult result = EntityVerifier
                        .verifyDeleted(deletedIds, remaining, operation.entityType())
                        .withDuration(elapsedSince(started));
                    conclude(result, context(operation, operation.buildEntityId(input, deletedIds)));
                    return deletedIds;
                });
            })
            .thenApply(deletedIds -> operation.buildResult(deletedIds, input))
            .whenComplete(logCompletion(operation, docId));
    }

    /**
     * Renames an entity. With verification, the old and new identities are read concurrently and
     * must be absent and present respectively. Without it, the new identity is still read because
     * the result is built from it.
     *
     * @throws EntityNotFoundException (as the future's cause) if the renamed entity cannot be read
     *     and verification was skipped
     */
    public <I, R> CompletableFuture<R> executeRename(
        RenameOperation<I, R> operation, WriteContext ctx, DocId docId, I input, WriteOptions options) {
        boolean verify = options.verifyOr(settings.verifyByDefault());
        log.info("Executing {} on {} (verify={})", operation.name(), docId, verify);

        return start(() -> operation.execute(ctx, docId, input))
            .thenCompose(v -> operation.afterExecute(ctx, docId, input))
            .thenCompose(v -> verify
                ? verifyRenamed(operation, ctx, docId, input)
                : operation.readNew(ctx, docId, input).thenApply(renamed -> renamed.orElseThrow(
                    () -> new EntityNotFoundException(
                        operation.entityType(), operation.buildEntityId(input), operation.name()))))
            .thenApply(renamed -> operation.buildResult(renamed, input))
            .whenComplete(logCompletion(operation, docId));
    }

    /**
     * Folds the outcome of an execution into a value: success, the backend's write error, or the
     * verification failure with its evidence.
     */
    public <R> CompletableFuture<WriteOutcome<R>> attempt(CompletableFuture<R> execution) {
        return execution.handle((result, error) -> {
            if (error == null) {
                return WriteOutcome.success(result);
            }
            Throwable cause = Futures.unwrap(error);
            if (cause instanceof VerificationException verification) {
                return WriteOutcome.from(verification);
            }
            return WriteOutcome.writeError(cause);
        });
    }

    private <I> CompletableFuture<VerificationResult> verifyWritten(
        FieldVerifyingOperation<I, ?> operation,
        WriteContext ctx,
        DocId docId,
        I input,
        List<Entity> written,
        List<Entity> expected,
        VerificationConfig.VerificationConfigBuilder config) {
        long started = System.nanoTime();
        CompletableFuture<Map<String, SemanticType>> columnTypes = operation.getColumnTypes(ctx, docId, input);

        return columnTypes.thenCompose(types -> operation.readBack(ctx, docId, written).thenApply(readBack -> {
            List<Entity> present = readBack.stream().flatMap(Optional::stream).toList();
            VerificationResult result = EntityVerifier
                .verifyEntities(expected, present, config.columnTypes(types).build())
                .withDuration(elapsedSince(started));
            conclude(result, context(operation, operation.buildEntityId(input, written)));
            return result;
        }));
    }

    private <I, R> CompletableFuture<Entity> verifyRenamed(
        RenameOperation<I, R> operation, WriteContext ctx, DocId docId, I input) {
        long started = System.nanoTime();
        CompletableFuture<Optional<Entity>> oldEntity = operation.readOld(ctx, docId, input);
        CompletableFuture<Optional<Entity>> newEntity = operation.readNew(ctx, docId, input);

        return oldEntity.thenCombine(newEntity, (previous, renamed) -> {
            String type = operation.entityType();
            List<VerificationCheck> checks = List.of(
                VerificationCheck.of(
                    previous.isEmpty() ? "Old " + type + " removed" : "Old " + type + " should not exist",
                    previous.isEmpty(),
                    "deleted",
                    previous.<Object>map(e -> e).orElse("deleted")),
                VerificationCheck.of(
                    renamed.isPresent() ? "New " + type + " exists" : "New " + type + " should exist",
                    renamed.isPresent(),
                    "exists",
                    renamed.isPresent() ? "exists" : null));

            OperationContext context = context(operation, operation.buildEntityId(input));
            conclude(VerificationResult.of(checks, elapsedSince(started)), context);
            return renamed.orElseThrow(
                () -> new EntityNotFoundException(type, context.entityId(), operation.name()));
        });
    }

    private void conclude(VerificationResult result, OperationContext context) {
        Duration elapsed = result.getDuration().orElse(Duration.ZERO);
        if (elapsed.compareTo(settings.slowVerificationThreshold()) > 0) {
            log.warn("Verification of {} took {} ms", context, elapsed.toMillis());
        }
        EntityVerifier.throwIfFailed(result, context);
        log.debug("Verification of {} passed with {} checks", context, result.getChecks().size());
    }

    private static OperationContext context(WriteOperation<?> operation, String entityId) {
        return new OperationContext(operation.name(), operation.entityType(), entityId);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> write) {
        try {
            return write.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> BiConsumer<T, Throwable> logCompletion(WriteOperation<?> operation, DocId docId) {
        return (result, error) -> {
            if (error == null) {
                log.info("{} on {} completed", operation.name(), docId);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            if (cause instanceof VerificationException verification) {
                log.warn("{} on {} was not confirmed: {}", operation.name(), docId, verification.getMessage());
            } else {
                log.debug("{} on {} failed: {}", operation.name(), docId, cause.toString());
            }
        };
    }
}
