package com.streamfirst.tabular.verified.adapters;

import com.streamfirst.tabular.verified.domain.ColumnChanges;
import com.streamfirst.tabular.verified.domain.ColumnInfo;
import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.SemanticType;
import com.streamfirst.tabular.verified.domain.TableInfo;
import com.streamfirst.tabular.verified.domain.WriteRejectedException;
import com.streamfirst.tabular.verified.ports.TabularBackendPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * In-memory implementation of TabularBackendPort for testing and development.
 * Stores values exactly as they arrive in wire encoding, per document and table.
 * Data is lost when the application stops - not suitable for production use.
 *
 * <p>Besides plain storage it can simulate backend behavior the write engine has to detect:
 * refused writes, columns silently ignored by access rules, rows, tables and column changes that
 * are accepted but never applied, renames that leave the old table behind, and references returned
 * in their tagged form.
 */
@Slf4j
public class InMemoryTabularBackendAdapter implements TabularBackendPort {

    private final Map<DocId, Map<String, TableState>> documents = new ConcurrentHashMap<>();
    private final Set<String> ignoredColumns = ConcurrentHashMap.newKeySet();
    private final Set<String> retainedRows = ConcurrentHashMap.newKeySet();
    private final Set<String> retainedTables = ConcurrentHashMap.newKeySet();
    private final Set<String> frozenColumns = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean writesDenied = new AtomicBoolean();
    private final AtomicBoolean oldTableKeptOnRename = new AtomicBoolean();
    private final AtomicBoolean referencesTagged = new AtomicBoolean();
    private final AtomicInteger reads = new AtomicInteger();
    private final Executor executor;

    public InMemoryTabularBackendAdapter() {
        this(Runnable::run);
    }

    /**
     * @param executor runs every request; a direct executor completes futures on the calling thread
     */
    public InMemoryTabularBackendAdapter(Executor executor) {
        this.executor = executor;
    }

    private static final class TableState {
        private final Map<String, ColumnInfo> columns = new LinkedHashMap<>();
        private final Map<Long, Map<String, Object>> rows = new ConcurrentSkipListMap<>();
        private final AtomicLong nextRowId = new AtomicLong(1);

        TableInfo info(String tableId) {
            return new TableInfo(tableId, new ArrayList<>(columns.values()));
        }
    }

    // Setup and fault injection

    public void createTable(DocId docId, String tableId, List<ColumnInfo> columns) {
        if (!putTable(docId, tableId, columns)) {
            throw new IllegalArgumentException("Table " + tableId + " already exists in " + docId);
        }
    }

    /** Makes every subsequent write fail with a 403 rejection. */
    public void denyWrites(boolean denied) {
        writesDenied.set(denied);
    }

    /** Accepts writes to the column but silently drops their values, as an access rule would. */
    public void ignoreWritesTo(String tableId, String colId) {
        ignoredColumns.add(tableId + "." + colId);
    }

    /** Accepts removal of the row but keeps it. */
    public void retainOnRemove(String tableId, long rowId) {
        retainedRows.add(tableId + ":" + rowId);
    }

    /** Accepts removal of the table but keeps it. */
    public void retainTableOnRemove(String tableId) {
        retainedTables.add(tableId);
    }

    /** Accepts modification and removal of the column but leaves it as it is. */
    public void ignoreChangesTo(String tableId, String colId) {
        frozenColumns.add(tableId + "." + colId);
    }

    /** Makes table renames copy the table instead of moving it. */
    public void keepOldTableOnRename(boolean keep) {
        oldTableKeptOnRename.set(keep);
    }

    /** Returns reference cells as {@code ["R", table, id]} and reference lists as {@code ["r", table, [ids]]}. */
    public void tagReferences(boolean tagged) {
        referencesTagged.set(tagged);
    }

    /** Number of fetch requests served so far. */
    public int getReadCount() {
        return reads.get();
    }

    // TabularBackendPort

    @Override
    public CompletableFuture<List<Long>> addRecords(DocId docId, String tableId, List<Map<String, Object>> rows) {
        return write(() -> {
            TableState table = requireTable(docId, tableId);
            List<Long> ids = new ArrayList<>(rows.size());
            synchronized (table) {
                rows.forEach(row -> validateColumns(table, tableId, row));
                for (Map<String, Object> row : rows) {
                    long rowId = table.nextRowId.getAndIncrement();
                    Map<String, Object> stored = new LinkedHashMap<>();
                    table.columns.keySet().forEach(colId -> stored.put(colId, null));
                    applyFields(table, tableId, stored, row);
                    table.rows.put(rowId, stored);
                    ids.add(rowId);
                }
            }
            log.debug("Added {} rows to {} in {}", ids.size(), tableId, docId);
            return ids;
        });
    }

    @Override
    public CompletableFuture<Void> updateRecords(
        DocId docId, String tableId, Map<Long, Map<String, Object>> updates) {
        return write(() -> {
            TableState table = requireTable(docId, tableId);
            synchronized (table) {
                updates.forEach((rowId, fields) -> {
                    if (!table.rows.containsKey(rowId)) {
                        throw new WriteRejectedException("Invalid row ID " + rowId + " in " + tableId, 400);
                    }
                    validateColumns(table, tableId, fields);
                });
                updates.forEach((rowId, fields) -> applyFields(table, tableId, table.rows.get(rowId), fields));
            }
            log.debug("Updated {} rows in {} in {}", updates.size(), tableId, docId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> removeRecords(DocId docId, String tableId, List<Long> rowIds) {
        return write(() -> {
            TableState table = requireTable(docId, tableId);
            int removed = 0;
            synchronized (table) {
                for (Long rowId : rowIds) {
                    if (retainedRows.contains(tableId + ":" + rowId)) {
                        log.debug("Retaining row {} of {} despite removal", rowId, tableId);
                        continue;
                    }
                    if (table.rows.remove(rowId) != null) {
                        removed++;
                    }
                }
            }
            log.debug("Removed {} of {} rows from {} in {}", removed, rowIds.size(), tableId, docId);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<Entity>> fetchRecords(DocId docId, String tableId, Collection<Long> rowIds) {
        return read(() -> {
            TableState table = table(docId, tableId).orElse(null);
            if (table == null) {
                log.debug("No table {} in {}", tableId, docId);
                return List.of();
            }
            List<Entity> result = new ArrayList<>();
            synchronized (table) {
                Collection<Long> wanted = rowIds.isEmpty() ? table.rows.keySet() : rowIds;
                for (Long rowId : wanted) {
                    Map<String, Object> row = table.rows.get(rowId);
                    if (row != null) {
                        result.add(Entity.of(rowId, present(table, row)));
                    }
                }
            }
            log.debug("Fetched {} rows from {} in {}", result.size(), tableId, docId);
            return result;
        });
    }

    @Override
    public CompletableFuture<Optional<TableInfo>> fetchTable(DocId docId, String tableId) {
        return read(() -> table(docId, tableId).map(table -> {
            synchronized (table) {
                return table.info(tableId);
            }
        }));
    }

    @Override
    public CompletableFuture<String> addTable(DocId docId, String tableId, List<ColumnInfo> columns) {
        return write(() -> {
            if (tableId.isBlank()) {
                throw new WriteRejectedException("Table ID cannot be blank", 400);
            }
            Set<String> colIds = new HashSet<>();
            for (ColumnInfo column : columns) {
                if (!colIds.add(column.colId())) {
                    throw new WriteRejectedException("Duplicate column " + column.colId() + " in " + tableId, 400);
                }
            }
            if (!putTable(docId, tableId, columns)) {
                throw new WriteRejectedException("Table " + tableId + " already exists", 400);
            }
            return tableId;
        });
    }

    @Override
    public CompletableFuture<Void> removeTable(DocId docId, String tableId) {
        return write(() -> {
            requireTable(docId, tableId);
            if (retainedTables.contains(tableId)) {
                log.debug("Retaining table {} despite removal", tableId);
                return null;
            }
            documents.getOrDefault(docId, Map.of()).remove(tableId);
            log.debug("Removed table {} from {}", tableId, docId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> addColumn(DocId docId, String tableId, ColumnInfo column) {
        return write(() -> {
            TableState table = requireTable(docId, tableId);
            synchronized (table) {
                if (table.columns.containsKey(column.colId())) {
                    throw new WriteRejectedException("Column " + column.colId() + " already exists in " + tableId, 400);
                }
                table.columns.put(column.colId(), column);
                table.rows.values().forEach(row -> row.put(column.colId(), null));
            }
            log.debug("Added column {}.{} in {}", tableId, column.colId(), docId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> modifyColumn(DocId docId, String tableId, String colId, ColumnChanges changes) {
        return write(() -> {
            TableState table = requireTable(docId, tableId);
            synchronized (table) {
                ColumnInfo column = requireColumn(table, tableId, colId);
                if (frozenColumns.contains(tableId + "." + colId)) {
                    log.debug("Ignoring changes to column {}.{}", tableId, colId);
                    return null;
                }
                table.columns.put(colId, changes.applyTo(column));
            }
            log.debug("Modified column {}.{} in {}: {}", tableId, colId, docId, changes.changedFields().keySet());
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> removeColumn(DocId docId, String tableId, String colId) {
        return write(() -> {
            TableState table = requireTable(docId, tableId);
            synchronized (table) {
                requireColumn(table, tableId, colId);
                if (frozenColumns.contains(tableId + "." + colId)) {
                    log.debug("Retaining column {}.{} despite removal", tableId, colId);
                    return null;
                }
                table.columns.remove(colId);
                table.rows.values().forEach(row -> row.remove(colId));
            }
            log.debug("Removed column {}.{} from {}", tableId, colId, docId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> renameTable(DocId docId, String oldTableId, String newTableId) {
        return write(() -> {
            Map<String, TableState> tables = documents.getOrDefault(docId, Map.of());
            TableState table = requireTable(docId, oldTableId);
            if (tables.containsKey(newTableId)) {
                throw new WriteRejectedException("Table " + newTableId + " already exists", 400);
            }
            tables.put(newTableId, table);
            if (!oldTableKeptOnRename.get()) {
                tables.remove(oldTableId);
            }
            log.debug("Renamed table {} to {} in {}", oldTableId, newTableId, docId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> renameColumn(DocId docId, String tableId, String oldColId, String newColId) {
        return write(() -> {
            TableState table = requireTable(docId, tableId);
            synchronized (table) {
                requireColumn(table, tableId, oldColId);
                if (table.columns.containsKey(newColId)) {
                    throw new WriteRejectedException("Column " + newColId + " already exists in " + tableId, 400);
                }
                Map<String, ColumnInfo> renamed = new LinkedHashMap<>();
                table.columns.forEach((colId, info) -> renamed.put(
                    colId.equals(oldColId) ? newColId : colId,
                    colId.equals(oldColId) ? info.withColId(newColId) : info));
                table.columns.clear();
                table.columns.putAll(renamed);
                table.rows.replaceAll((rowId, row) -> {
                    Map<String, Object> moved = new LinkedHashMap<>();
                    row.forEach((colId, value) -> moved.put(colId.equals(oldColId) ? newColId : colId, value));
                    return moved;
                });
            }
            log.debug("Renamed column {}.{} to {} in {}", tableId, oldColId, newColId, docId);
            return null;
        });
    }

    // Internals

    private <T> CompletableFuture<T> write(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(() -> {
            if (writesDenied.get()) {
                throw new WriteRejectedException("Access denied", 403);
            }
            return operation.get();
        }, executor);
    }

    private <T> CompletableFuture<T> read(Supplier<T> operation) {
        return CompletableFuture.supplyAsync(() -> {
            reads.incrementAndGet();
            return operation.get();
        }, executor);
    }

    private boolean putTable(DocId docId, String tableId, List<ColumnInfo> columns) {
        TableState table = new TableState();
        columns.forEach(column -> table.columns.put(column.colId(), column));
        if (documents.computeIfAbsent(docId, k -> new ConcurrentHashMap<>()).putIfAbsent(tableId, table) != null) {
            return false;
        }
        log.debug("Created table {} in {} with {} columns", tableId, docId, columns.size());
        return true;
    }

    private Optional<TableState> table(DocId docId, String tableId) {
        return Optional.ofNullable(documents.getOrDefault(docId, Map.of()).get(tableId));
    }

    private TableState requireTable(DocId docId, String tableId) {
        return table(docId, tableId)
            .orElseThrow(() -> new WriteRejectedException("Table " + tableId + " not found in " + docId, 404));
    }

    private static ColumnInfo requireColumn(TableState table, String tableId, String colId) {
        ColumnInfo column = table.columns.get(colId);
        if (column == null) {
            throw new WriteRejectedException("Invalid column " + colId + " in " + tableId, 400);
        }
        return column;
    }

    private static void validateColumns(TableState table, String tableId, Map<String, Object> fields) {
        for (String colId : fields.keySet()) {
            if (!table.columns.containsKey(colId)) {
                throw new WriteRejectedException("Invalid column " + colId + " in " + tableId, 400);
            }
        }
    }

    private void applyFields(TableState table, String tableId, Map<String, Object> target, Map<String, Object> fields) {
        fields.forEach((colId, value) -> {
            if (table.columns.get(colId).formula()) {
                log.debug("Ignoring write to formula column {}.{}", tableId, colId);
            } else if (ignoredColumns.contains(tableId + "." + colId)) {
                log.debug("Dropping write to {}.{}", tableId, colId);
            } else {
                target.put(colId, value);
            }
        });
    }

    private Map<String, Object> present(TableState table, Map<String, Object> row) {
        Map<String, Object> fields = new LinkedHashMap<>(row);
        if (!referencesTagged.get()) {
            return fields;
        }
        fields.replaceAll((colId, value) -> {
            ColumnInfo column = table.columns.get(colId);
            return column == null ? value : tagReference(column, value);
        });
        return fields;
    }

    private static Object tagReference(ColumnInfo column, Object value) {
        SemanticType type = column.semanticType();
        String target = column.type().substring(column.type().indexOf(':') + 1);
        if (type == SemanticType.REFERENCE && value instanceof Number) {
            return List.of("R", target, value);
        }
        if (type == SemanticType.REFERENCE_LIST && value instanceof List<?> list
            && !list.isEmpty() && "L".equals(list.get(0))) {
            return List.of("r", target, List.copyOf(list.subList(1, list.size())));
        }
        return value;
    }
}
