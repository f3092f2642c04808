package com.streamfirst.tabular.verified.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class EntityTest {

    @Test
    void testMissingFieldIsAbsentButNullIsKept() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("Notes", null);
        Entity entity = Entity.of(1L, fields);

        assertNull(entity.get("Notes"));
        assertSame(Absent.VALUE, entity.get("Missing"));
        assertThat(entity.has("Notes")).isTrue();
    }

    @Test
    void testFieldsAreCopied() {
        Map<String, Object> fields = new HashMap<>(Map.of("Name", "Alice"));
        Entity entity = Entity.of(1L, fields);
        fields.put("Name", "Bob");

        assertThat(entity.get("Name")).isEqualTo("Alice");
    }

    @Test
    void testValuesFormatAsJson() {
        assertThat(ValueFormatter.format(Entity.of(5L, Map.of("Tags", List.of("L", "a")))))
            .isEqualTo("{\"id\":5,\"fields\":{\"Tags\":[\"L\",\"a\"]}}");
        assertThat(ValueFormatter.format(Absent.VALUE)).isEqualTo("undefined");
        assertThat(ValueFormatter.format("5")).isEqualTo("\"5\"");
        assertThat(ValueFormatter.format(5)).isEqualTo("5");
    }
}
