package com.streamfirst.tabular.verified.application.operations;

/**
 * A column confirmed under its new ID.
 *
 * @param type the backend type label of the renamed column
 */
public record RenamedColumn(String tableId, String oldColId, String newColId, String type) {}
