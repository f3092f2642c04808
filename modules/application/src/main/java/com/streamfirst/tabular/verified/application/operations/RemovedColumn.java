package com.streamfirst.tabular.verified.application.operations;

/** A column confirmed to be gone from its table. */
public record RemovedColumn(String tableId, String colId) {}
