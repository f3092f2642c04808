package com.streamfirst.tabular.verified.application.operations;

import com.streamfirst.tabular.verified.domain.ColumnChanges;

/** A column whose changed properties were applied. */
public record ModifiedColumn(String tableId, String colId, ColumnChanges changes) {}
