package com.mindthread.backend.snippet.store;

/** Side of a pivot timestamp a temporal query looks at, and the order its results come back in. */
public enum TemporalDirection {
  /** Strictly older than the pivot, most recent first. */
  BEFORE("<", "DESC"),
  /** Strictly newer than the pivot, nearest first. */
  AFTER(">", "ASC");

  private final String comparison;
  private final String sortOrder;

  TemporalDirection(String comparison, String sortOrder) {
    this.comparison = comparison;
    this.sortOrder = sortOrder;
  }

  String comparison() {
    return comparison;
  }

  String sortOrder() {
    return sortOrder;
  }

  public boolean accepts(long timestamp, long pivot) {
    return this == BEFORE ? timestamp < pivot : timestamp > pivot;
  }
}
