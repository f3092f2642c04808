package com.streamfirst.tabular.verified.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticTypeTest {

    @Test
    void testMapsBackendTypeLabels() {
        assertThat(SemanticType.fromColumnType("Text")).isEqualTo(SemanticType.TEXT);
        assertThat(SemanticType.fromColumnType("Choice")).isEqualTo(SemanticType.TEXT);
        assertThat(SemanticType.fromColumnType("Int")).isEqualTo(SemanticType.INTEGER);
        assertThat(SemanticType.fromColumnType("Numeric")).isEqualTo(SemanticType.DECIMAL);
        assertThat(SemanticType.fromColumnType("Bool")).isEqualTo(SemanticType.BOOLEAN);
        assertThat(SemanticType.fromColumnType("Date")).isEqualTo(SemanticType.DATE);
        assertThat(SemanticType.fromColumnType("ChoiceList")).isEqualTo(SemanticType.TAGGED_LIST);
        assertThat(SemanticType.fromColumnType("Attachments")).isEqualTo(SemanticType.TAGGED_LIST);
    }

    @Test
    void testIgnoresTypeParameters() {
        assertThat(SemanticType.fromColumnType("DateTime:America/New_York")).isEqualTo(SemanticType.DATE_TIME);
        assertThat(SemanticType.fromColumnType("Ref:People")).isEqualTo(SemanticType.REFERENCE);
        assertThat(SemanticType.fromColumnType("RefList:People")).isEqualTo(SemanticType.REFERENCE_LIST);
    }

    @Test
    void testUnknownLabelsAreOther() {
        assertThat(SemanticType.fromColumnType("Any")).isEqualTo(SemanticType.OTHER);
        assertThat(SemanticType.fromColumnType("")).isEqualTo(SemanticType.OTHER);
    }

    @Test
    void testTableColumnTypesFollowColumnOrder() {
        TableInfo table = new TableInfo("Orders", List.of(
            ColumnInfo.data("Item", "Text"),
            ColumnInfo.data("Owner", "Ref:People"),
            ColumnInfo.formula("Total", "Numeric")));

        assertThat(table.columnTypes()).containsExactly(
            Map.entry("Item", SemanticType.TEXT),
            Map.entry("Owner", SemanticType.REFERENCE),
            Map.entry("Total", SemanticType.DECIMAL));
        assertThat(table.column("Total")).hasValueSatisfying(c -> assertThat(c.formula()).isTrue());
        assertThat(table.column("Missing")).isEmpty();
    }
}
