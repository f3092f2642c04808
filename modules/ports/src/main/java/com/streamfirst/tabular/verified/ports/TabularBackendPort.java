package com.streamfirst.tabular.verified.ports;

import com.streamfirst.tabular.verified.domain.ColumnChanges;
import com.streamfirst.tabular.verified.domain.ColumnInfo;
import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.TableInfo;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the remote tabular backend. Values cross this port in the backend's wire encoding
 * (list markers, epoch-second timestamps, tagged references). Implementations own transport and
 * retry policy; a refused write completes the returned future exceptionally.
 */
public interface TabularBackendPort {

    /**
     * Appends rows to a table.
     *
     * @param docId the target document
     * @param tableId the target table
     * @param rows wire-encoded field values, one map per row
     * @return the row IDs assigned by the backend, aligned with {@code rows}
     */
    CompletableFuture<List<Long>> addRecords(DocId docId, String tableId, List<Map<String, Object>> rows);

    /**
     * Updates fields of existing rows. Fields missing from a row's map are left untouched.
     *
     * @param docId the target document
     * @param tableId the target table
     * @param updates row ID to wire-encoded field values
     */
    CompletableFuture<Void> updateRecords(DocId docId, String tableId, Map<Long, Map<String, Object>> updates);

    /**
     * Removes rows from a table.
     */
    CompletableFuture<Void> removeRecords(DocId docId, String tableId, List<Long> rowIds);

    /**
     * Fetches the current state of rows. IDs that do not resolve are simply missing from the result.
     *
     * @param rowIds the rows to fetch, or empty to fetch the whole table
     * @return rows in wire encoding
     */
    CompletableFuture<List<Entity>> fetchRecords(DocId docId, String tableId, Collection<Long> rowIds);

    /**
     * Fetches table metadata including columns.
     *
     * @return the table, or empty if no table has that ID
     */
    CompletableFuture<Optional<TableInfo>> fetchTable(DocId docId, String tableId);

    /**
     * Creates a table with the given columns.
     *
     * @return the ID the backend created the table under
     */
    CompletableFuture<String> addTable(DocId docId, String tableId, List<ColumnInfo> columns);

    CompletableFuture<Void> removeTable(DocId docId, String tableId);

    CompletableFuture<Void> addColumn(DocId docId, String tableId, ColumnInfo column);

    /**
     * Changes properties of an existing column; properties the changes leave null are untouched.
     */
    CompletableFuture<Void> modifyColumn(DocId docId, String tableId, String colId, ColumnChanges changes);

    CompletableFuture<Void> removeColumn(DocId docId, String tableId, String colId);

    CompletableFuture<Void> renameTable(DocId docId, String oldTableId, String newTableId);

    CompletableFuture<Void> renameColumn(DocId docId, String tableId, String oldColId, String newColId);
}
