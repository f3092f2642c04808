package com.streamfirst.tabular.verified.application.operations;

import com.streamfirst.tabular.verified.application.executors.AddOperation;
import com.streamfirst.tabular.verified.application.executors.DeleteOperation;
import com.streamfirst.tabular.verified.application.executors.UpdateOperation;
import com.streamfirst.tabular.verified.application.executors.WriteExecutor;
import com.streamfirst.tabular.verified.application.operations.RecordRequests.AddRecords;
import com.streamfirst.tabular.verified.application.operations.RecordRequests.DeleteRecords;
import com.streamfirst.tabular.verified.application.operations.RecordRequests.RecordUpdate;
import com.streamfirst.tabular.verified.application.operations.RecordRequests.UpdateRecords;
import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.SemanticType;
import com.streamfirst.tabular.verified.domain.WriteOptions;
import com.streamfirst.tabular.verified.ports.WriteContext;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Verified record writes. Every write encodes its values with the table's current column types,
 * invalidates the table's cached metadata afterwards, and is confirmed by reading the rows back.
 */
@Slf4j
@RequiredArgsConstructor
public class RecordOperations {

    static final String ENTITY_TYPE = "Record";

    @NonNull private final WriteExecutor executor;
    @NonNull private final WriteContext ctx;

    /**
     * Adds rows and confirms every written field.
     *
     * @return the written rows, as the caller wrote them, with their assigned IDs
     */
    public CompletableFuture<RecordBatch> addRecords(
        DocId docId, String tableId, List<Map<String, Object>> rows, WriteOptions options) {
        return executor.executeAdd(new AddRecordsOperation(tableId), ctx, docId, new AddRecords(tableId, rows), options);
    }

    /**
     * Updates rows and confirms only the fields each update set.
     */
    public CompletableFuture<RecordBatch> updateRecords(
        DocId docId, String tableId, List<RecordUpdate> updates, WriteOptions options) {
        return executor.executeUpdate(
            new UpdateRecordsOperation(tableId), ctx, docId, new UpdateRecords(tableId, updates), options);
    }

    /**
     * Removes rows and confirms none of them remain.
     */
    public CompletableFuture<DeletedRecords> deleteRecords(
        DocId docId, String tableId, List<Long> rowIds, WriteOptions options) {
        return executor.executeDelete(
            new DeleteRecordsOperation(tableId), ctx, docId, new DeleteRecords(tableId, rowIds), options);
    }

    /**
     * Reads rows with their values decoded from the wire encoding.
     *
     * @param rowIds the rows to read, or empty for the whole table
     */
    public CompletableFuture<List<Entity>> getRecords(DocId docId, String tableId, Collection<Long> rowIds) {
        return ctx.schemaCache().getColumnTypes(docId, tableId)
            .thenCompose(types -> ctx.backend().fetchRecords(docId, tableId, rowIds)
                .thenApply(rows -> rows.stream()
                    .map(row -> row.withFields(CellCodec.decodeRow(row.getFields(), types)))
                    .toList()));
    }

    /**
     * Reads one row, decoded. Empty when the row does not exist.
     */
    public CompletableFuture<Optional<Entity>> getRecord(DocId docId, String tableId, long rowId) {
        return getRecords(docId, tableId, List.of(rowId))
            .thenApply(rows -> rows.stream().filter(row -> rowId(row) == rowId).findFirst());
    }

    static String formatEntityId(String tableId, Collection<?> ids) {
        return tableId + ":[" + ids.stream().map(String::valueOf).collect(Collectors.joining(",")) + "]";
    }

    static long rowId(Entity entity) {
        return ((Number) entity.getId()).longValue();
    }

    /**
     * Base for the field-verified record writes: encodes with the table's column types, invalidates
     * the table afterwards, and reads the written rows back aligned with the written order.
     */
    @RequiredArgsConstructor
    private abstract static class RecordWrite<I> {

        protected final String tableId;

        public String entityType() {
            return ENTITY_TYPE;
        }

        public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, I input) {
            ctx.schemaCache().invalidateTable(docId, tableId);
            return CompletableFuture.completedFuture(null);
        }

        public CompletableFuture<Map<String, SemanticType>> getColumnTypes(WriteContext ctx, DocId docId, I input) {
            return ctx.schemaCache().getColumnTypes(docId, tableId);
        }

        public CompletableFuture<List<Optional<Entity>>> readBack(
            WriteContext ctx, DocId docId, List<Entity> written) {
            List<Long> ids = written.stream().map(RecordOperations::rowId).toList();
            return ctx.backend().fetchRecords(docId, tableId, ids).thenApply(rows -> {
                Map<Long, Entity> byId = rows.stream().collect(Collectors.toMap(
                    RecordOperations::rowId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
                return ids.stream().map(id -> Optional.ofNullable(byId.get(id))).toList();
            });
        }

        public String buildEntityId(I input, List<Entity> written) {
            return formatEntityId(tableId, written.stream().map(Entity::getId).toList());
        }

        public RecordBatch buildResult(List<Entity> written, I input) {
            return new RecordBatch(tableId, written);
        }
    }

    private static final class AddRecordsOperation extends RecordWrite<AddRecords>
        implements AddOperation<AddRecords, RecordBatch> {

        AddRecordsOperation(String tableId) {
            super(tableId);
        }

        @Override
        public String name() {
            return "addRecords";
        }

        @Override
        public CompletableFuture<List<Entity>> execute(WriteContext ctx, DocId docId, AddRecords input) {
            return ctx.schemaCache().getColumnTypes(docId, tableId).thenCompose(types -> {
                List<Map<String, Object>> encoded = input.rows().stream()
                    .map(row -> CellCodec.encodeRow(row, types))
                    .toList();
                log.debug("Adding {} record(s) to {}", encoded.size(), tableId);
                return ctx.backend().addRecords(docId, tableId, encoded);
            }).thenApply(ids -> {
                if (ids.size() != input.rows().size()) {
                    throw new IllegalStateException("Expected " + input.rows().size()
                        + " row ID(s) from " + tableId + " but got " + ids.size());
                }
                List<Entity> written = new ArrayList<>(ids.size());
                for (int i = 0; i < ids.size(); i++) {
                    written.add(Entity.of(ids.get(i), input.rows().get(i)));
                }
                return written;
            });
        }
    }

    private static final class UpdateRecordsOperation extends RecordWrite<UpdateRecords>
        implements UpdateOperation<UpdateRecords, RecordBatch> {

        UpdateRecordsOperation(String tableId) {
            super(tableId);
        }

        @Override
        public String name() {
            return "updateRecords";
        }

        @Override
        public CompletableFuture<List<Entity>> execute(WriteContext ctx, DocId docId, UpdateRecords input) {
            Map<Long, Map<String, Object>> merged = merged(input);
            return ctx.schemaCache().getColumnTypes(docId, tableId).thenCompose(types -> {
                Map<Long, Map<String, Object>> encoded = new LinkedHashMap<>();
                merged.forEach((id, fields) -> encoded.put(id, CellCodec.encodeRow(fields, types)));
                log.debug("Updating {} record(s) in {}", encoded.size(), tableId);
                return ctx.backend().updateRecords(docId, tableId, encoded);
            }).thenApply(ignored -> merged.entrySet().stream()
                .map(e -> Entity.of(e.getKey(), e.getValue()))
                .toList());
        }

        @Override
        public Map<String, Object> getUpdatedFields(UpdateRecords input, Entity entity) {
            return merged(input).getOrDefault(rowId(entity), Map.of());
        }

        /**
         * Folds the updates per row in request order, so a later update to the same field wins.
         */
        static Map<Long, Map<String, Object>> merged(UpdateRecords input) {
            Map<Long, Map<String, Object>> merged = new LinkedHashMap<>();
            for (RecordUpdate update : input.updates()) {
                merged.computeIfAbsent(update.id(), id -> new LinkedHashMap<>()).putAll(update.fields());
            }
            return merged;
        }
    }

    private static final class DeleteRecordsOperation implements DeleteOperation<DeleteRecords, Long, DeletedRecords> {

        private final String tableId;

        DeleteRecordsOperation(String tableId) {
            this.tableId = tableId;
        }

        @Override
        public String name() {
            return "deleteRecords";
        }

        @Override
        public String entityType() {
            return ENTITY_TYPE;
        }

        @Override
        public CompletableFuture<List<Long>> execute(WriteContext ctx, DocId docId, DeleteRecords input) {
            log.debug("Removing {} record(s) from {}", input.rowIds().size(), tableId);
            return ctx.backend().removeRecords(docId, tableId, input.rowIds())
                .thenApply(ignored -> input.rowIds());
        }

        @Override
        public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, DeleteRecords input) {
            ctx.schemaCache().invalidateTable(docId, tableId);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<List<Entity>> readBack(WriteContext ctx, DocId docId, List<Long> deletedIds) {
            if (deletedIds.isEmpty()) {
                return CompletableFuture.completedFuture(List.of());
            }
            return ctx.backend().fetchRecords(docId, tableId, deletedIds)
                .thenApply(rows -> rows.stream().filter(row -> deletedIds.contains(rowId(row))).toList());
        }

        @Override
        public String buildEntityId(DeleteRecords input, List<Long> deletedIds) {
            return formatEntityId(tableId, deletedIds);
        }

        @Override
        public DeletedRecords buildResult(List<Long> deletedIds, DeleteRecords input) {
            return new DeletedRecords(tableId, deletedIds);
        }
    }
}
