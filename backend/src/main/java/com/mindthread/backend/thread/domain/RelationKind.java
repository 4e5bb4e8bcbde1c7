package com.mindthread.backend.thread.domain;

/** How a directional group relates to the focus, by the strategy that produced it. */
public enum RelationKind {
  /** Older snippets linked to the focus by an edge. */
  CAUSAL,
  /** Older snippets by time alone. */
  TEMPORAL,
  /** Newer snippets linked to the focus by an edge. */
  IMPLICATION,
  /** Newer goals. */
  NEXT_STEP
}
