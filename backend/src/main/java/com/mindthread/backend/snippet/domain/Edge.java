package com.mindthread.backend.snippet.domain;

/**
 * Undirected link between two snippets. Which endpoint is the source carries no meaning for thread
 * resolution; direction is derived from the endpoint timestamps.
 */
public record Edge(long sourceId, long targetId, double weight) {

  public static final double DEFAULT_WEIGHT = 1.0d;

  public Edge {
    if (Double.isNaN(weight) || weight < 0.0d) {
      throw new IllegalArgumentException("Edge weight must be a non-negative number: " + weight);
    }
  }

  public static Edge between(long sourceId, long targetId) {
    return new Edge(sourceId, targetId, DEFAULT_WEIGHT);
  }

  public boolean touches(long snippetId) {
    return sourceId == snippetId || targetId == snippetId;
  }

  public long other(long snippetId) {
    if (sourceId == snippetId) {
      return targetId;
    }
    if (targetId == snippetId) {
      return sourceId;
    }
    throw new IllegalArgumentException("Edge does not touch snippet " + snippetId);
  }
}
