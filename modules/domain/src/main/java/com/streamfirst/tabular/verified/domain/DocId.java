package com.streamfirst.tabular.verified.domain;

import java.util.Objects;

/**
 * Identifier of a document on the remote tabular backend. A document holds the tables that all
 * write operations target.
 *
 * @param value the document identifier as issued by the backend
 */
public record DocId(String value) {
  public DocId {
    Objects.requireNonNull(value, "Document ID cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Document ID cannot be empty");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
