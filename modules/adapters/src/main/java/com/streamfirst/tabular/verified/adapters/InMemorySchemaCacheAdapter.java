package com.streamfirst.tabular.verified.adapters;

import com.streamfirst.tabular.verified.domain.DocId;
import com.streamfirst.tabular.verified.domain.SemanticType;
import com.streamfirst.tabular.verified.domain.TableInfo;
import com.streamfirst.tabular.verified.ports.SchemaCachePort;
import com.streamfirst.tabular.verified.ports.TabularBackendPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of SchemaCachePort. Loads column types from the backend on first use
 * and keeps them until invalidated. Unknown tables are not cached.
 */
@Slf4j
@RequiredArgsConstructor
public class InMemorySchemaCacheAdapter implements SchemaCachePort {

    private record Key(DocId docId, String tableId) {}

    @NonNull private final TabularBackendPort backend;
    private final Map<Key, Map<String, SemanticType>> entries = new ConcurrentHashMap<>();
    private final AtomicInteger loads = new AtomicInteger();
    private final AtomicInteger invalidations = new AtomicInteger();

    @Override
    public CompletableFuture<Map<String, SemanticType>> getColumnTypes(DocId docId, String tableId) {
        Key key = new Key(docId, tableId);
        Map<String, SemanticType> cached = entries.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        loads.incrementAndGet();
        log.debug("Loading column types of {} in {}", tableId, docId);
        return backend.fetchTable(docId, tableId).thenApply(table -> table
            .map(TableInfo::columnTypes)
            .map(types -> {
                Map<String, SemanticType> loaded = Map.copyOf(types);
                entries.put(key, loaded);
                return loaded;
            })
            .orElseGet(Map::of));
    }

    @Override
    public void invalidateTable(DocId docId, String tableId) {
        invalidations.incrementAndGet();
        entries.remove(new Key(docId, tableId));
        log.debug("Invalidated column types of {} in {}", tableId, docId);
    }

    @Override
    public void invalidateDocument(DocId docId) {
        invalidations.incrementAndGet();
        entries.keySet().removeIf(key -> key.docId().equals(docId));
        log.debug("Invalidated column types of every table in {}", docId);
    }

    public boolean isCached(DocId docId, String tableId) {
        return entries.containsKey(new Key(docId, tableId));
    }

    public int getLoadCount() {
        return loads.get();
    }

    public int getInvalidationCount() {
        return invalidations.get();
    }
}
