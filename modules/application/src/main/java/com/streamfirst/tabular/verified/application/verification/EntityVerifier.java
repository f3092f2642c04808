package com.streamfirst.tabular.verified.application.verification;

import com.streamfirst.tabular.verified.domain.Absent;
import com.streamfirst.tabular.verified.domain.Entity;
import com.streamfirst.tabular.verified.domain.OperationContext;
import com.streamfirst.tabular.verified.domain.VerificationCheck;
import com.streamfirst.tabular.verified.domain.VerificationException;
import com.streamfirst.tabular.verified.domain.VerificationResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds verification results by comparing what was written with what the backend reports.
 * Entities are matched by identity; numeric identities match by value regardless of boxed type.
 */
@Slf4j
public final class EntityVerifier {

    private EntityVerifier() {}

    /**
     * Compares written entities with their read-back counterparts.
     *
     * <p>An entity missing from {@code read} yields a single failing "not found" check. Otherwise
     * each configured field produces one check, except fields the written entity does not carry,
     * which were not part of the write and are skipped.
     *
     * @param written the entities as the caller intended them
     * @param read the entities as currently persisted
     * @param config fields, type hints and entity label
     * @return the aggregated result with elapsed time
     */
    public static VerificationResult verifyEntities(
        List<Entity> written, Collection<Entity> read, VerificationConfig config) {
        long started = System.nanoTime();
        Map<Object, Entity> readById = indexById(read);
        List<VerificationCheck> checks = new ArrayList<>();

        for (Entity w : written) {
            Entity r = readById.get(identityKey(w.getId()));
            if (r == null) {
                checks.add(VerificationCheck.of(
                    config.getEntityName() + " " + w.getId() + " not found", false, w, null));
                continue;
            }

            Collection<String> fields = config.getFields().isEmpty() ? w.fieldNames() : config.getFields();
            for (String field : fields) {
                Object expected = w.get(field);
                if (Absent.is(expected)) {
                    continue;
                }
                Object actual = r.get(field);
                boolean passed = Canonicalizer.equivalent(expected, actual, config.columnTypeOf(field));
                checks.add(VerificationCheck.ofField(
                    config.getEntityName() + " " + w.getId() + "." + field, field, passed, expected, actual));
            }
        }

        VerificationResult result = VerificationResult.of(checks, Duration.ofNanos(System.nanoTime() - started));
        log.debug("Verified {} {} entities: {}", written.size(), config.getEntityName(), result);
        return result;
    }

    /**
     * Checks that every deleted identity is gone. Produces one check per deleted ID; when any
     * survive, the result also carries a summary error naming them.
     *
     * @param deletedIds the identities the write removed
     * @param remaining entities still resolvable after the write
     * @param entityName label used in check descriptions
     */
    public static VerificationResult verifyDeleted(
        List<?> deletedIds, Collection<Entity> remaining, String entityName) {
        long started = System.nanoTime();
        Map<Object, Entity> survivors = indexById(remaining);
        List<VerificationCheck> checks = new ArrayList<>();
        List<Object> surviving = new ArrayList<>();

        for (Object id : deletedIds) {
            Entity survivor = survivors.get(identityKey(id));
            if (survivor == null) {
                checks.add(VerificationCheck.of(entityName + " " + id + " deleted", true, "deleted", "deleted"));
            } else {
                surviving.add(id);
                checks.add(VerificationCheck.of(
                    entityName + " " + id + " still exists after delete", false, "deleted", survivor));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        if (surviving.isEmpty()) {
            return VerificationResult.of(checks, elapsed);
        }
        String error = surviving.size() + " " + entityName.toLowerCase(Locale.ROOT)
            + "(s) still exist after delete: "
            + surviving.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return VerificationResult.withError(checks, error).withDuration(elapsed);
    }

    /**
     * Throws a {@link VerificationException} carrying the result and context unless every check
     * passed.
     */
    public static void throwIfFailed(VerificationResult result, OperationContext context) {
        if (!result.isPassed()) {
            throw new VerificationException(result, context);
        }
    }

    private static Map<Object, Entity> indexById(Collection<Entity> entities) {
        Map<Object, Entity> index = new LinkedHashMap<>();
        for (Entity entity : entities) {
            index.putIfAbsent(identityKey(entity.getId()), entity);
        }
        return index;
    }

    static Object identityKey(Object id) {
        if (id instanceof Number number && !(id instanceof Double) && !(id instanceof Float)) {
            return new BigDecimal(number.toString()).stripTrailingZeros();
        }
        if (id instanceof Double || id instanceof Float) {
            double d = ((Number) id).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d).stripTrailingZeros() : id;
        }
        return id;
    }
}
