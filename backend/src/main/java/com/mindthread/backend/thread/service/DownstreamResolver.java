package com.mindthread.backend.thread.service;

import com.mindthread.backend.snippet.domain.Snippet;
import com.mindthread.backend.snippet.store.GraphStore;
import com.mindthread.backend.snippet.store.QueryDeadline;
import com.mindthread.backend.snippet.store.TemporalDirection;
import com.mindthread.backend.thread.config.ThreadContextProperties;
import com.mindthread.backend.thread.domain.DirectionalGroup;
import com.mindthread.backend.thread.domain.RelationAxis;
import com.mindthread.backend.thread.domain.RelationKind;
import org.springframework.stereotype.Component;

/**
 * What followed from the focus: linked newer snippets, else the nearest newer goals. The fallback
 * narrows by type, so it can come back empty while newer snippets exist; {@code hasMore} still
 * counts every newer snippet.
 */
@Component
public class DownstreamResolver implements RelationResolver<DirectionalGroup> {

  private final GraphStore graphStore;
  private final ThreadContextProperties properties;

  public DownstreamResolver(GraphStore graphStore, ThreadContextProperties properties) {
    this.graphStore = graphStore;
    this.properties = properties;
  }

  @Override
  public RelationAxis axis() {
    return RelationAxis.DOWNSTREAM;
  }

  @Override
  public AxisResult<DirectionalGroup> resolve(Snippet focus, QueryDeadline deadline) {
    TemporalDirection direction = TemporalDirection.AFTER;
    TieredLookup.Result result =
        TieredLookup.of(
                (limit, d) ->
                    graphStore.findConnected(focus.id(), focus.timestamp(), direction, limit, d),
                (limit, d) ->
                    graphStore.findByTypeAndTimestamp(
                        focus.id(), Snippet.GOAL_TYPE, focus.timestamp(), direction, limit, d),
                d -> graphStore.countByTimestamp(focus.id(), focus.timestamp(), direction, d))
            .run(focus.id(), properties.getMotionBudget().limitFor(axis()), deadline);

    RelationKind relation =
        result.fromPrimary() ? RelationKind.IMPLICATION : RelationKind.NEXT_STEP;
    return new AxisResult<>(new DirectionalGroup(result.nodes(), relation), result.hasMore());
  }
}
