package com.streamfirst.tabular.verified.application.executors;

import com.streamfirst.tabular.verified.domain.Entity;

import java.util.Map;

/**
 * Strategy for modifying existing entities. Only the fields present in the update payload are
 * verified, so an untouched field that reads back differently never fails the write.
 */
public interface UpdateOperation<I, R> extends FieldVerifyingOperation<I, R> {

    /**
     * Returns the fields the input sets on the given entity, mapped to their intended values.
     */
    Map<String, Object> getUpdatedFields(I input, Entity entity);
}
