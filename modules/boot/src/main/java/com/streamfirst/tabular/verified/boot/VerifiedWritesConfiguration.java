package com.streamfirst.tabular.verified.boot;

import com.streamfirst.tabular.verified.adapters.InMemorySchemaCacheAdapter;
import com.streamfirst.tabular.verified.adapters.InMemoryTabularBackendAdapter;
import com.streamfirst.tabular.verified.application.executors.WriteExecutor;
import com.streamfirst.tabular.verified.application.operations.RecordBatch;
import com.streamfirst.tabular.verified.application.operations.RecordOperations;
import com.streamfirst.tabular.verified.application.operations.RenamedTable;
import com.streamfirst.tabular.verified.application.operations.SchemaOperations;
import com.streamfirst.tabular.verified.domain.ColumnInfo;
import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.ExecutorSettings;
import com.streamfirst.tabular.verified.domain.WriteOptions;
import com.streamfirst.tabular.verified.ports.SchemaCachePort;
import com.streamfirst.tabular.verified.ports.TabularBackendPort;
import com.streamfirst.tabular.verified.ports.WriteContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

/**
 * Wires the verified write engine against the in-memory adapters.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(VerifiedWritesProperties.class)
public class VerifiedWritesConfiguration {

    // --- Adapter Beans ---

    @Bean
    public InMemoryTabularBackendAdapter tabularBackend() {
        log.info("Creating in-memory tabular backend");
        return new InMemoryTabularBackendAdapter();
    }

    @Bean
    public InMemorySchemaCacheAdapter schemaCache(TabularBackendPort tabularBackend) {
        return new InMemorySchemaCacheAdapter(tabularBackend);
    }

    @Bean
    public WriteContext writeContext(TabularBackendPort tabularBackend, SchemaCachePort schemaCache) {
        return new WriteContext(tabularBackend, schemaCache);
    }

    // --- Application Service Beans ---

    @Bean
    public ExecutorSettings executorSettings(VerifiedWritesProperties properties) {
        ExecutorSettings settings = properties.toSettings();
        log.info("Verified writes: verifyByDefault={}, slowVerificationThreshold={}",
            settings.verifyByDefault(), settings.slowVerificationThreshold());
        return settings;
    }

    @Bean
    public WriteExecutor writeExecutor(ExecutorSettings executorSettings) {
        return new WriteExecutor(executorSettings);
    }

    @Bean
    public RecordOperations recordOperations(WriteExecutor writeExecutor, WriteContext writeContext) {
        return new RecordOperations(writeExecutor, writeContext);
    }

    @Bean
    public SchemaOperations schemaOperations(WriteExecutor writeExecutor, WriteContext writeContext) {
        return new SchemaOperations(writeExecutor, writeContext);
    }

    // --- Demo runner ---

    @Bean
    public CommandLineRunner demo(
        VerifiedWritesProperties properties,
        InMemoryTabularBackendAdapter tabularBackend,
        RecordOperations recordOperations,
        SchemaOperations schemaOperations) {
        return args -> {
            if (!properties.isDemo()) {
                return;
            }
            log.info("--- Starting verified writes demo ---");
            DocId doc = new DocId("demo");
            tabularBackend.createTable(doc, "Orders", List.of(
                ColumnInfo.data("Item", "Text"),
                ColumnInfo.data("Tags", "ChoiceList"),
                ColumnInfo.data("Due", "Date")));

            RecordBatch added = recordOperations.addRecords(doc, "Orders", List.of(
                Map.of("Item", "Widget", "Tags", List.of("red", "blue"), "Due", "2024-03-01")),
                WriteOptions.defaults()).join();
            log.info("Added and verified {} record(s): {}", added.count(), added.records());

            RenamedTable renamed = schemaOperations
                .renameTable(doc, "Orders", "Purchases", WriteOptions.defaults()).join();
            log.info("Renamed and verified table {} -> {}", renamed.oldTableId(), renamed.newTableId());
            log.info("--- Demo finished ---");
        };
    }
}
