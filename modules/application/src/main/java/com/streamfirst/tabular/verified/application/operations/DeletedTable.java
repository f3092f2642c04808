package com.streamfirst.tabular.verified.application.operations;

/** A table confirmed to be gone from its document. */
public record DeletedTable(String tableId) {}
