package com.streamfirst.tabular.verified.integration;

import com.streamfirst.tabular.verified.adapters.InMemorySchemaCacheAdapter;
import com.streamfirst.tabular.verified.adapters.InMemoryTabularBackendAdapter;
import com.streamfirst.tabular.verified.application.executors.Futures;
import com.streamfirst.tabular.verified.application.executors.WriteExecutor;
import com.streamfirst.tabular.verified.application.operations.DeletedRecords;
import com.streamfirst.tabular.verified.application.operations.DeletedTable;
import com.streamfirst.tabular.verified.application.operations.ModifiedColumn;
import com.streamfirst.tabular.verified.application.operations.RecordBatch;
import com.streamfirst.tabular.verified.application.operations.RecordOperations;
import com.streamfirst.tabular.verified.application.operations.RecordRequests.RecordUpdate;
import com.streamfirst.tabular.verified.application.operations.RemovedColumn;
import com.streamfirst.tabular.verified.application.operations.RenamedColumn;
import com.streamfirst.tabular.verified.application.operations.RenamedTable;
import com.streamfirst.tabular.verified.application.operations.SchemaOperations;
import com.streamfirst.tabular.verified.domain.ColumnChanges;
import com.streamfirst.tabular.verified.domain.ColumnInfo;
import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.TableInfo;
import com.streamfirst.tabular.verified.domain.VerificationCheck;
import com.streamfirst.tabular.verified.domain.VerificationException;
import com.streamfirst.tabular.verified.domain.WriteOptions;
import com.streamfirst.tabular.verified.domain.WriteOutcome;
import com.streamfirst.tabular.verified.domain.WriteRejectedException;
import com.streamfirst.tabular.verified.ports.WriteContext;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives verified writes through the record and schema operations against the in-memory backend,
 * including backend behavior that only read-back verification can detect.
 */
@Slf4j
public class VerifiedWritesEndToEndTest {

    private static final DocId DOC = new DocId("doc-e2e");

    private ExecutorService pool;
    private InMemoryTabularBackendAdapter backend;
    private InMemorySchemaCacheAdapter schemaCache;
    private RecordOperations records;
    private SchemaOperations schema;

    @BeforeEach
    void setupEngine() {
        // Requests complete on another thread, like a remote backend
        pool = Executors.newFixedThreadPool(4);
        backend = new InMemoryTabularBackendAdapter(pool);
        backend.createTable(DOC, "Orders", List.of(
            ColumnInfo.data("Item", "Text"),
            ColumnInfo.data("Qty", "Int"),
            ColumnInfo.data("Tags", "ChoiceList"),
            ColumnInfo.data("Due", "Date"),
            ColumnInfo.data("Shipped", "DateTime:UTC"),
            ColumnInfo.data("Customer", "Ref:People"),
            ColumnInfo.data("Watchers", "RefList:People"),
            ColumnInfo.formula("Total", "Numeric")));
        backend.createTable(DOC, "People", List.of(ColumnInfo.data("Name", "Text")));

        schemaCache = new InMemorySchemaCacheAdapter(backend);
        WriteContext ctx = new WriteContext(backend, schemaCache);
        WriteExecutor executor = new WriteExecutor();
        records = new RecordOperations(executor, ctx);
        schema = new SchemaOperations(executor, ctx);
    }

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void testTaggedListAddIsVerifiedEndToEnd() {
        RecordBatch batch = records.addRecords(DOC, "Orders",
            List.of(Map.of("Item", "Widget", "Tags", List.of("red", "blue"))), WriteOptions.verified()).join();

        assertEquals(1, batch.count());
        Entity written = batch.records().get(0);
        assertEquals(List.of("red", "blue"), written.get("Tags"));

        Entity stored = backend.fetchRecords(DOC, "Orders", List.of((Long) written.getId())).join().get(0);
        assertEquals(List.of("L", "red", "blue"), stored.get("Tags"));
    }

    @Test
    void testDatesAndTaggedReferencesVerify() {
        backend.tagReferences(true);

        RecordBatch batch = records.addRecords(DOC, "Orders", List.of(Map.of(
            "Item", "Widget",
            "Due", "2024-03-01",
            "Customer", 5L,
            "Watchers", List.of(1L, 2L))), WriteOptions.verified()).join();

        Entity read = records.getRecords(DOC, "Orders", List.of((Long) batch.records().get(0).getId())).join().get(0);
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), read.get("Due"));
        assertEquals(5L, read.get("Customer"));
        assertEquals(List.of(1L, 2L), read.get("Watchers"));
    }

    @Test
    void testSilentlyIgnoredColumnFailsVerification() {
        backend.ignoreWritesTo("Orders", "Qty");

        assertThatThrownBy(() -> Futures.await(records.addRecords(DOC, "Orders",
            List.of(Map.of("Item", "Widget", "Qty", 3)), WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> {
                assertTrue(e.hasFieldFailure("Qty"));
                assertFalse(e.hasFieldFailure("Item"));
                assertEquals("addRecords", e.getOperation());
                assertEquals("Record", e.getEntityType());
                assertEquals("Orders:[1]", e.getEntityId());
                assertThat(e.toUserMessage()).contains("- Record 1.Qty: expected 3, got null");
            });
    }

    @Test
    void testFormulaColumnWriteFailsVerification() {
        assertThatThrownBy(() -> Futures.await(records.addRecords(DOC, "Orders",
            List.of(Map.of("Item", "Widget", "Total", 10)), WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> assertTrue(e.hasFieldFailure("Total")));
    }

    @Test
    void testUnverifiedWriteSkipsDetection() {
        backend.ignoreWritesTo("Orders", "Qty");

        RecordBatch batch = records.addRecords(DOC, "Orders",
            List.of(Map.of("Item", "Widget", "Qty", 3)), WriteOptions.unverified()).join();

        assertEquals(3, batch.records().get(0).get("Qty"));
    }

    @Test
    void testRejectedWriteSurfacesBackendError() {
        backend.denyWrites(true);

        WriteOutcome<RecordBatch> outcome = new WriteExecutor().attempt(records.addRecords(DOC, "Orders",
            List.of(Map.of("Item", "Widget")), WriteOptions.verified())).join();

        assertEquals(WriteOutcome.Kind.WRITE_ERROR, outcome.getKind());
        assertThat(outcome.getWriteError()).hasValueSatisfying(
            e -> assertEquals(403, ((WriteRejectedException) e).getStatusCode()));
    }

    @Test
    void testUpdateVerifiesOnlyUpdatedFields() {
        records.addRecords(DOC, "Orders", List.of(
            Map.of("Item", "Widget", "Qty", 1),
            Map.of("Item", "Gadget", "Qty", 2)), WriteOptions.verified()).join();

        RecordBatch updated = records.updateRecords(DOC, "Orders", List.of(
            new RecordUpdate(1L, Map.of("Qty", 10)),
            new RecordUpdate(2L, Map.of("Tags", List.of("sale")))), WriteOptions.verified()).join();

        assertEquals(2, updated.count());
        List<Entity> rows = records.getRecords(DOC, "Orders", List.of(1L, 2L)).join();
        assertEquals(10, rows.get(0).get("Qty"));
        assertEquals("Widget", rows.get(0).get("Item"));
        assertEquals(List.of("sale"), rows.get(1).get("Tags"));
    }

    @Test
    void testUpdateOfIgnoredColumnFails() {
        records.addRecords(DOC, "Orders", List.of(Map.of("Item", "Widget")), WriteOptions.verified()).join();
        backend.ignoreWritesTo("Orders", "Item");

        assertThatThrownBy(() -> Futures.await(records.updateRecords(DOC, "Orders",
            List.of(new RecordUpdate(1L, Map.of("Item", "Gizmo"))), WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> {
                assertEquals("updateRecords", e.getOperation());
                assertTrue(e.hasFieldFailure("Item"));
            });
    }

    @Test
    void testDeleteDetectsSurvivingRow() {
        records.addRecords(DOC, "Orders", List.of(Map.of("Item", "A"), Map.of("Item", "B")), WriteOptions.verified()).join();
        backend.retainOnRemove("Orders", 2L);

        assertThatThrownBy(() -> Futures.await(records.deleteRecords(DOC, "Orders", List.of(1L, 2L), WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> {
                assertEquals("1 record(s) still exist after delete: 2", e.getMessage());
                assertEquals("Orders:[1,2]", e.getEntityId());
                assertThat(e.getFailedChecks()).extracting(VerificationCheck::description)
                    .containsExactly("Record 2 still exists after delete");
            });
    }

    @Test
    void testDeleteIsVerified() {
        records.addRecords(DOC, "Orders", List.of(Map.of("Item", "A"), Map.of("Item", "B")), WriteOptions.verified()).join();

        DeletedRecords deleted = records.deleteRecords(DOC, "Orders", List.of(1L, 2L), WriteOptions.verified()).join();

        assertEquals(List.of(1L, 2L), deleted.deletedIds());
        assertThat(records.getRecords(DOC, "Orders", List.of()).join()).isEmpty();
    }

    @Test
    void testWritesInvalidateCachedColumnTypes() {
        records.addRecords(DOC, "Orders", List.of(Map.of("Item", "A")), WriteOptions.unverified()).join();
        assertEquals(1, schemaCache.getInvalidationCount());
        assertFalse(schemaCache.isCached(DOC, "Orders"));

        schemaCache.getColumnTypes(DOC, "People").join();
        schema.renameTable(DOC, "Orders", "Purchases", WriteOptions.verified()).join();
        assertEquals(2, schemaCache.getInvalidationCount());
        assertFalse(schemaCache.isCached(DOC, "People"));
    }

    @Test
    void testRenameTableIsVerified() {
        RenamedTable renamed = schema.renameTable(DOC, "Orders", "Purchases", WriteOptions.verified()).join();

        assertEquals("Purchases", renamed.newTableId());
        assertThat(renamed.columns()).contains("Item", "Tags");
    }

    @Test
    void testRenameTableLeavingOldTableFails() {
        backend.keepOldTableOnRename(true);

        assertThatThrownBy(() -> Futures.await(schema.renameTable(DOC, "Orders", "Purchases", WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> {
                assertEquals("Orders -> Purchases", e.getEntityId());
                assertEquals("Table", e.getEntityType());
                assertThat(e.getFailedChecks()).extracting(VerificationCheck::description)
                    .containsExactly("Old Table should not exist");
            });
    }

    @Test
    void testRenameColumnIsVerified() {
        records.addRecords(DOC, "Orders", List.of(Map.of("Item", "Widget")), WriteOptions.verified()).join();

        RenamedColumn renamed = schema.renameColumn(DOC, "Orders", "Item", "Product", WriteOptions.verified()).join();

        assertEquals("Text", renamed.type());
        assertEquals("Widget", records.getRecords(DOC, "Orders", List.of(1L)).join().get(0).get("Product"));
        log.info("Renamed {}.{} to {}", renamed.tableId(), renamed.oldColId(), renamed.newColId());
    }

    @Test
    void testRenameOfMissingColumnIsRejected() {
        assertThatThrownBy(() -> Futures.await(schema.renameColumn(DOC, "Orders", "Nope", "Still", WriteOptions.verified())))
            .isInstanceOfSatisfying(WriteRejectedException.class, e -> assertEquals(400, e.getStatusCode()));
    }

    @Test
    void testRepeatedUpdatesToOneRowVerifyTheLastValue() {
        records.addRecords(DOC, "Orders", List.of(Map.of("Item", "Widget", "Qty", 1)), WriteOptions.verified()).join();

        RecordBatch updated = records.updateRecords(DOC, "Orders", List.of(
            new RecordUpdate(1L, Map.of("Qty", 2)),
            new RecordUpdate(1L, Map.of("Qty", 3, "Item", "Gadget"))), WriteOptions.verified()).join();

        assertEquals(1, updated.count());
        Entity row = records.getRecord(DOC, "Orders", 1L).join().orElseThrow();
        assertEquals(3, row.get("Qty"));
        assertEquals("Gadget", row.get("Item"));
    }

    @Test
    void testNanosecondTimestampVerifiesToTheMicrosecond() {
        RecordBatch batch = records.addRecords(DOC, "Orders", List.of(Map.of(
            "Item", "Widget",
            "Shipped", Instant.parse("2024-03-01T10:00:00.123456789Z"))), WriteOptions.verified()).join();

        Entity read = records.getRecord(DOC, "Orders", (Long) batch.records().get(0).getId()).join().orElseThrow();
        assertEquals(Instant.parse("2024-03-01T10:00:00.123456Z"), read.get("Shipped"));
    }

    @Test
    void testGetRecordOfMissingRowIsEmpty() {
        assertThat(records.getRecord(DOC, "Orders", 42L).join()).isEmpty();
    }

    @Test
    void testCreateTableIsVerified() {
        TableInfo created = schema.createTable(DOC, "Invoices", List.of(
            ColumnInfo.data("Number", "Text"),
            ColumnInfo.data("Amount", "Numeric")), WriteOptions.verified()).join();

        assertEquals("Invoices", created.tableId());
        assertThat(backend.fetchTable(DOC, "Invoices").join()).hasValueSatisfying(
            table -> assertThat(table.columnTypes()).containsKeys("Number", "Amount"));
        records.addRecords(DOC, "Invoices", List.of(Map.of("Number", "INV-1", "Amount", 9.5)), WriteOptions.verified()).join();
    }

    @Test
    void testCreateExistingTableIsRejected() {
        assertThatThrownBy(() -> Futures.await(schema.createTable(DOC, "People", List.of(), WriteOptions.verified())))
            .isInstanceOfSatisfying(WriteRejectedException.class, e -> assertEquals(400, e.getStatusCode()));
    }

    @Test
    void testDeleteTableIsVerified() {
        schemaCache.getColumnTypes(DOC, "People").join();

        DeletedTable deleted = schema.deleteTable(DOC, "People", WriteOptions.verified()).join();

        assertEquals("People", deleted.tableId());
        assertFalse(backend.fetchTable(DOC, "People").join().isPresent());
        assertFalse(schemaCache.isCached(DOC, "People"));
    }

    @Test
    void testDeleteTableDetectsSurvivingTable() {
        backend.retainTableOnRemove("People");

        assertThatThrownBy(() -> Futures.await(schema.deleteTable(DOC, "People", WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> {
                assertEquals("deleteTable", e.getOperation());
                assertEquals("People", e.getEntityId());
                assertThat(e.getFailedChecks()).extracting(VerificationCheck::description)
                    .containsExactly("Table People still exists after delete");
            });
    }

    @Test
    void testAddColumnIsVerified() {
        schemaCache.getColumnTypes(DOC, "Orders").join();

        ColumnInfo added = schema.addColumn(DOC, "Orders",
            ColumnInfo.formula("Discount", "Numeric").withFormula("$Qty * 0.1").withLabel("Discount"),
            WriteOptions.verified()).join();

        assertEquals("Discount", added.colId());
        assertFalse(schemaCache.isCached(DOC, "Orders"));
        assertThat(schemaCache.getColumnTypes(DOC, "Orders").join()).containsKey("Discount");
    }

    @Test
    void testAddDuplicateColumnIsRejected() {
        assertThatThrownBy(() -> Futures.await(schema.addColumn(DOC, "Orders",
            ColumnInfo.data("Item", "Text"), WriteOptions.verified())))
            .isInstanceOfSatisfying(WriteRejectedException.class, e -> assertEquals(400, e.getStatusCode()));
    }

    @Test
    void testModifyColumnVerifiesOnlyChangedProperties() {
        ModifiedColumn modified = schema.modifyColumn(DOC, "Orders", "Qty",
            ColumnChanges.builder().type("Numeric").label("Quantity").build(), WriteOptions.verified()).join();

        assertEquals("Qty", modified.colId());
        ColumnInfo column = backend.fetchTable(DOC, "Orders").join().orElseThrow().column("Qty").orElseThrow();
        assertEquals("Numeric", column.type());
        assertEquals("Quantity", column.label());
        assertFalse(column.formula());
    }

    @Test
    void testIgnoredColumnChangeFailsVerification() {
        backend.ignoreChangesTo("Orders", "Qty");

        assertThatThrownBy(() -> Futures.await(schema.modifyColumn(DOC, "Orders", "Qty",
            ColumnChanges.builder().type("Numeric").build(), WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> {
                assertEquals("modifyColumn", e.getOperation());
                assertEquals("Column", e.getEntityType());
                assertEquals("Orders.Qty", e.getEntityId());
                assertTrue(e.hasFieldFailure("type"));
                assertFalse(e.hasFieldFailure("label"));
            });
    }

    @Test
    void testRemoveColumnIsVerified() {
        records.addRecords(DOC, "Orders", List.of(Map.of("Item", "Widget", "Qty", 2)), WriteOptions.verified()).join();

        RemovedColumn removed = schema.removeColumn(DOC, "Orders", "Qty", WriteOptions.verified()).join();

        assertEquals("Qty", removed.colId());
        assertFalse(records.getRecord(DOC, "Orders", 1L).join().orElseThrow().has("Qty"));
    }

    @Test
    void testRemoveColumnDetectsSurvivingColumn() {
        backend.ignoreChangesTo("Orders", "Qty");

        assertThatThrownBy(() -> Futures.await(schema.removeColumn(DOC, "Orders", "Qty", WriteOptions.verified())))
            .isInstanceOfSatisfying(VerificationException.class, e -> {
                assertEquals("Orders.Qty", e.getEntityId());
                assertEquals("1 column(s) still exist after delete: Qty", e.getMessage());
            });
    }
}
