package com.mindthread.backend.thread.service;

import com.mindthread.backend.snippet.domain.Snippet;
import com.mindthread.backend.snippet.store.QueryDeadline;
import com.mindthread.backend.thread.domain.RelationAxis;

/** Resolves one spoke of a thread context. Implementations are stateless and thread-safe. */
public interface RelationResolver<G> {

  RelationAxis axis();

  AxisResult<G> resolve(Snippet focus, QueryDeadline deadline);

  record AxisResult<G>(G group, boolean hasMore) {}
}
