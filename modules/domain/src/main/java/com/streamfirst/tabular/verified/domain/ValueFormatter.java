package com.streamfirst.tabular.verified.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/** Renders field values as compact JSON for diagnostic messages. */
@Slf4j
public final class ValueFormatter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValueFormatter() {}

    public static String format(Object value) {
        if (Absent.is(value)) {
            return "undefined";
        }
        if (value instanceof Entity entity) {
            return "{\"id\":" + format(entity.getId()) + ",\"fields\":" + format(entity.getFields()) + "}";
        }
        if (value instanceof Instant instant) {
            return '"' + instant.toString() + '"';
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to toString for value of type {}", value.getClass().getName(), e);
            return String.valueOf(value);
        }
    }
}
