package com.streamfirst.tabular.verified.application.verification;

import com.streamfirst.tabular.verified.domain.SemanticType;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Controls which fields {@link EntityVerifier#verifyEntities} compares and how. */
@Value
@Builder
public class VerificationConfig {

    /** Label used in check descriptions, e.g. "Record" */
    @NonNull @Builder.Default String entityName = "Entity";

    /** Fields to compare; empty means every field carried by the written entity */
    @NonNull @Builder.Default List<String> fields = List.of();

    /** Semantic type per field, used as the canonicalization hint */
    @NonNull @Builder.Default Map<String, SemanticType> columnTypes = Map.of();

    public SemanticType columnTypeOf(String field) {
        return columnTypes.get(field);
    }

    public static VerificationConfig forEntity(String entityName) {
        return VerificationConfig.builder().entityName(entityName).build();
    }
}
