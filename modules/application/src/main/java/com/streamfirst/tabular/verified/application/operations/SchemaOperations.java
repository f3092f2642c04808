package com.streamfirst.tabular.verified.application.operations;

import com.streamfirst.tabular.verified.application.executors.AddOperation;
import com.streamfirst.tabular.verified.application.executors.DeleteOperation;
import com.streamfirst.tabular.verified.application.executors.RenameOperation;
import com.streamfirst.tabular.verified.application.executors.UpdateOperation;
import com.streamfirst.tabular.verified.application.executors.WriteExecutor;
import com.streamfirst.tabular.verified.application.operations.SchemaRequests.AddColumn;
import com.streamfirst.tabular.verified.application.operations.SchemaRequests.CreateTable;
import com.streamfirst.tabular.verified.application.operations.SchemaRequests.DeleteTable;
import com.streamfirst.tabular.verified.application.operations.SchemaRequests.ModifyColumn;
import com.streamfirst.tabular.verified.application.operations.SchemaRequests.RemoveColumn;
import com.streamfirst.tabular.verified.application.operations.SchemaRequests.RenameColumn;
import com.streamfirst.tabular.verified.application.operations.SchemaRequests.RenameTable;
import com.streamfirst.tabular.verified.domain.ColumnChanges;
import com.streamfirst.tabular.verified.domain.ColumnFields;
import com.streamfirst.tabular.verified.domain.ColumnInfo;
import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.TableInfo;
import com.streamfirst.tabular.verified.domain.WriteOptions;
import com.streamfirst.tabular.verified.ports.WriteContext;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Verified table and column writes.
 *
 * <p>Tables compare as entities keyed by table ID whose fields map each column ID to its type;
 * columns compare by their {@link ColumnFields}. A rename is confirmed once the old ID no longer
 * resolves and the new one does. Table-level writes invalidate the whole document's cached
 * metadata, column-level writes only the table's.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaOperations {

    static final String TABLE = "Table";
    static final String COLUMN = "Column";

    @NonNull private final WriteExecutor executor;
    @NonNull private final WriteContext ctx;

    /**
     * Creates a table and confirms every requested column exists with its type.
     *
     * @return the table under the ID the backend created it with
     */
    public CompletableFuture<TableInfo> createTable(
        DocId docId, String tableId, List<ColumnInfo> columns, WriteOptions options) {
        return executor.executeAdd(CREATE_TABLE, ctx, docId, new CreateTable(tableId, columns), options);
    }

    /**
     * Removes a table and confirms it no longer resolves.
     */
    public CompletableFuture<DeletedTable> deleteTable(DocId docId, String tableId, WriteOptions options) {
        return executor.executeDelete(DELETE_TABLE, ctx, docId, new DeleteTable(tableId), options);
    }

    /**
     * Adds a column and confirms its type, formula flag, and whichever of label and formula source
     * were given.
     */
    public CompletableFuture<ColumnInfo> addColumn(
        DocId docId, String tableId, ColumnInfo column, WriteOptions options) {
        return executor.executeAdd(
            new AddColumnOperation(tableId), ctx, docId, new AddColumn(tableId, column), options);
    }

    /**
     * Changes column properties and confirms only the ones that were set.
     */
    public CompletableFuture<ModifiedColumn> modifyColumn(
        DocId docId, String tableId, String colId, ColumnChanges changes, WriteOptions options) {
        return executor.executeUpdate(
            new ModifyColumnOperation(tableId), ctx, docId, new ModifyColumn(tableId, colId, changes), options);
    }

    public CompletableFuture<RemovedColumn> removeColumn(
        DocId docId, String tableId, String colId, WriteOptions options) {
        return executor.executeDelete(
            new RemoveColumnOperation(tableId), ctx, docId, new RemoveColumn(tableId, colId), options);
    }

    public CompletableFuture<RenamedTable> renameTable(
        DocId docId, String oldTableId, String newTableId, WriteOptions options) {
        return executor.executeRename(
            RENAME_TABLE, ctx, docId, new RenameTable(oldTableId, newTableId), options);
    }

    public CompletableFuture<RenamedColumn> renameColumn(
        DocId docId, String tableId, String oldColId, String newColId, WriteOptions options) {
        return executor.executeRename(
            RENAME_COLUMN, ctx, docId, new RenameColumn(tableId, oldColId, newColId), options);
    }

    static Entity tableEntity(String tableId, List<ColumnInfo> columns) {
        Map<String, Object> types = new LinkedHashMap<>();
        columns.forEach(column -> types.put(column.colId(), column.type()));
        return Entity.of(tableId, types);
    }

    static Entity tableEntity(TableInfo table) {
        return tableEntity(table.tableId(), table.columns());
    }

    static Entity columnEntity(ColumnInfo column) {
        return Entity.of(column.colId(), ColumnFields.of(column));
    }

    private static CompletableFuture<Optional<Entity>> readTable(WriteContext ctx, DocId docId, String tableId) {
        return ctx.backend().fetchTable(docId, tableId).thenApply(table -> table.map(SchemaOperations::tableEntity));
    }

    private static CompletableFuture<Optional<Entity>> readColumn(
        WriteContext ctx, DocId docId, String tableId, String colId) {
        return ctx.backend().fetchTable(docId, tableId)
            .thenApply(table -> table.flatMap(t -> t.column(colId)).map(SchemaOperations::columnEntity));
    }

    private static CompletableFuture<Void> invalidateDocument(WriteContext ctx, DocId docId) {
        // The set of tables changed, so any cached table of the document may be stale
        ctx.schemaCache().invalidateDocument(docId);
        return CompletableFuture.completedFuture(null);
    }

    private static CompletableFuture<Void> invalidateTable(WriteContext ctx, DocId docId, String tableId) {
        ctx.schemaCache().invalidateTable(docId, tableId);
        return CompletableFuture.completedFuture(null);
    }

    private static String columnId(String tableId, String colId) {
        return tableId + "." + colId;
    }

    private static final AddOperation<CreateTable, TableInfo> CREATE_TABLE =
        new AddOperation<>() {
            @Override
            public String name() {
                return "createTable";
            }

            @Override
            public String entityType() {
                return TABLE;
            }

            @Override
            public CompletableFuture<List<Entity>> execute(WriteContext ctx, DocId docId, CreateTable input) {
                log.debug("Creating table {} with {} column(s) in {}", input.tableId(), input.columns().size(), docId);
                return ctx.backend().addTable(docId, input.tableId(), input.columns())
                    .thenApply(tableId -> List.of(tableEntity(tableId, input.columns())));
            }

            @Override
            public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, CreateTable input) {
                return invalidateDocument(ctx, docId);
            }

            @Override
            public CompletableFuture<List<Optional<Entity>>> readBack(
                WriteContext ctx, DocId docId, List<Entity> written) {
                return readTable(ctx, docId, (String) written.get(0).getId()).thenApply(read -> List.of(read));
            }

            @Override
            public String buildEntityId(CreateTable input, List<Entity> written) {
                return (String) written.get(0).getId();
            }

            @Override
            public TableInfo buildResult(List<Entity> written, CreateTable input) {
                return new TableInfo((String) written.get(0).getId(), input.columns());
            }
        };

    private static final DeleteOperation<DeleteTable, String, DeletedTable> DELETE_TABLE =
        new DeleteOperation<>() {
            @Override
            public String name() {
                return "deleteTable";
            }

            @Override
            public String entityType() {
                return TABLE;
            }

            @Override
            public CompletableFuture<List<String>> execute(WriteContext ctx, DocId docId, DeleteTable input) {
                log.debug("Deleting table {} from {}", input.tableId(), docId);
                return ctx.backend().removeTable(docId, input.tableId()).thenApply(v -> List.of(input.tableId()));
            }

            @Override
            public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, DeleteTable input) {
                return invalidateDocument(ctx, docId);
            }

            @Override
            public CompletableFuture<List<Entity>> readBack(WriteContext ctx, DocId docId, List<String> deletedIds) {
                return readTable(ctx, docId, deletedIds.get(0)).thenApply(table -> table.stream().toList());
            }

            @Override
            public String buildEntityId(DeleteTable input, List<String> deletedIds) {
                return input.tableId();
            }

            @Override
            public DeletedTable buildResult(List<String> deletedIds, DeleteTable input) {
                return new DeletedTable(input.tableId());
            }
        };

    /**
     * Base for the field-verified column writes: bound to one table, invalidates it afterwards, and
     * reads the written column back from the table's fresh metadata.
     */
    @RequiredArgsConstructor
    private abstract static class ColumnWrite<I> {

        protected final String tableId;

        public String entityType() {
            return COLUMN;
        }

        public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, I input) {
            return invalidateTable(ctx, docId, tableId);
        }

        public CompletableFuture<List<Optional<Entity>>> readBack(
            WriteContext ctx, DocId docId, List<Entity> written) {
            return readColumn(ctx, docId, tableId, (String) written.get(0).getId()).thenApply(read -> List.of(read));
        }

        public String buildEntityId(I input, List<Entity> written) {
            return columnId(tableId, (String) written.get(0).getId());
        }
    }

    private static final class AddColumnOperation extends ColumnWrite<AddColumn>
        implements AddOperation<AddColumn, ColumnInfo> {

        AddColumnOperation(String tableId) {
            super(tableId);
        }

        @Override
        public String name() {
            return "addColumn";
        }

        @Override
        public CompletableFuture<List<Entity>> execute(WriteContext ctx, DocId docId, AddColumn input) {
            ColumnInfo column = input.column();
            log.debug("Adding column {} ({}) to {} in {}", column.colId(), column.type(), tableId, docId);
            return ctx.backend().addColumn(docId, tableId, column)
                .thenApply(v -> List.of(Entity.of(column.colId(), ColumnFields.definedBy(column))));
        }

        @Override
        public ColumnInfo buildResult(List<Entity> written, AddColumn input) {
            return input.column();
        }
    }

    private static final class ModifyColumnOperation extends ColumnWrite<ModifyColumn>
        implements UpdateOperation<ModifyColumn, ModifiedColumn> {

        ModifyColumnOperation(String tableId) {
            super(tableId);
        }

        @Override
        public String name() {
            return "modifyColumn";
        }

        @Override
        public CompletableFuture<List<Entity>> execute(WriteContext ctx, DocId docId, ModifyColumn input) {
            log.debug("Modifying column {}.{} in {}: {}",
                tableId, input.colId(), docId, input.changes().changedFields().keySet());
            return ctx.backend().modifyColumn(docId, tableId, input.colId(), input.changes())
                .thenApply(v -> List.of(Entity.of(input.colId(), input.changes().changedFields())));
        }

        @Override
        public Map<String, Object> getUpdatedFields(ModifyColumn input, Entity entity) {
            return input.changes().changedFields();
        }

        @Override
        public ModifiedColumn buildResult(List<Entity> written, ModifyColumn input) {
            return new ModifiedColumn(tableId, input.colId(), input.changes());
        }
    }

    private static final class RemoveColumnOperation implements DeleteOperation<RemoveColumn, String, RemovedColumn> {

        private final String tableId;

        RemoveColumnOperation(String tableId) {
            this.tableId = tableId;
        }

        @Override
        public String name() {
            return "removeColumn";
        }

        @Override
        public String entityType() {
            return COLUMN;
        }

        @Override
        public CompletableFuture<List<String>> execute(WriteContext ctx, DocId docId, RemoveColumn input) {
            log.debug("Removing column {}.{} from {}", tableId, input.colId(), docId);
            return ctx.backend().removeColumn(docId, tableId, input.colId()).thenApply(v -> List.of(input.colId()));
        }

        @Override
        public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, RemoveColumn input) {
            return invalidateTable(ctx, docId, tableId);
        }

        @Override
        public CompletableFuture<List<Entity>> readBack(WriteContext ctx, DocId docId, List<String> deletedIds) {
            return readColumn(ctx, docId, tableId, deletedIds.get(0)).thenApply(column -> column.stream().toList());
        }

        @Override
        public String buildEntityId(RemoveColumn input, List<String> deletedIds) {
            return columnId(tableId, input.colId());
        }

        @Override
        public RemovedColumn buildResult(List<String> deletedIds, RemoveColumn input) {
            return new RemovedColumn(tableId, input.colId());
        }
    }

    private static final RenameOperation<RenameTable, RenamedTable> RENAME_TABLE =
        new RenameOperation<>() {
            @Override
            public String name() {
                return "renameTable";
            }

            @Override
            public String entityType() {
                return TABLE;
            }

            @Override
            public CompletableFuture<Void> execute(WriteContext ctx, DocId docId, RenameTable input) {
                log.debug("Renaming table {} to {} in {}", input.oldTableId(), input.newTableId(), docId);
                return ctx.backend().renameTable(docId, input.oldTableId(), input.newTableId());
            }

            @Override
            public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, RenameTable input) {
                return invalidateDocument(ctx, docId);
            }

            @Override
            public CompletableFuture<Optional<Entity>> readOld(WriteContext ctx, DocId docId, RenameTable input) {
                return readTable(ctx, docId, input.oldTableId());
            }

            @Override
            public CompletableFuture<Optional<Entity>> readNew(WriteContext ctx, DocId docId, RenameTable input) {
                return readTable(ctx, docId, input.newTableId());
            }

            @Override
            public String buildEntityId(RenameTable input) {
                return input.oldTableId() + " -> " + input.newTableId();
            }

            @Override
            public RenamedTable buildResult(Entity renamed, RenameTable input) {
                return new RenamedTable(input.oldTableId(), input.newTableId(), List.copyOf(renamed.fieldNames()));
            }
        };

    private static final RenameOperation<RenameColumn, RenamedColumn> RENAME_COLUMN =
        new RenameOperation<>() {
            @Override
            public String name() {
                return "renameColumn";
            }

            @Override
            public String entityType() {
                return COLUMN;
            }

            @Override
            public CompletableFuture<Void> execute(WriteContext ctx, DocId docId, RenameColumn input) {
                log.debug("Renaming column {}.{} to {} in {}",
                    input.tableId(), input.oldColId(), input.newColId(), docId);
                return ctx.backend().renameColumn(docId, input.tableId(), input.oldColId(), input.newColId());
            }

            @Override
            public CompletableFuture<Void> afterExecute(WriteContext ctx, DocId docId, RenameColumn input) {
                return invalidateTable(ctx, docId, input.tableId());
            }

            @Override
            public CompletableFuture<Optional<Entity>> readOld(WriteContext ctx, DocId docId, RenameColumn input) {
                return readColumn(ctx, docId, input.tableId(), input.oldColId());
            }

            @Override
            public CompletableFuture<Optional<Entity>> readNew(WriteContext ctx, DocId docId, RenameColumn input) {
                return readColumn(ctx, docId, input.tableId(), input.newColId());
            }

            @Override
            public String buildEntityId(RenameColumn input) {
                return columnId(input.tableId(), input.oldColId()) + " -> " + input.newColId();
            }

            @Override
            public RenamedColumn buildResult(Entity renamed, RenameColumn input) {
                return new RenamedColumn(
                    input.tableId(), input.oldColId(), input.newColId(), (String) renamed.get(ColumnFields.TYPE));
            }
        };
}
