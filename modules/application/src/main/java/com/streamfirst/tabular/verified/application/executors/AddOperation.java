package com.streamfirst.tabular.verified.application.executors;

import java.util.List;

/**
 * Strategy for creating entities. Verification compares every written field, or only
 * {@link #verifyFields()} when that is non-empty.
 */
public interface AddOperation<I, R> extends FieldVerifyingOperation<I, R> {

    default List<String> verifyFields() {
        return List.of();
    }
}
