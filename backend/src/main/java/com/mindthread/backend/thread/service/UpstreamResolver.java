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

/** What led to the focus: linked older snippets, else the most recent older ones. */
@Component
public class UpstreamResolver implements RelationResolver<DirectionalGroup> {

  private final GraphStore graphStore;
  private final ThreadContextProperties properties;

  public UpstreamResolver(GraphStore graphStore, ThreadContextProperties properties) {
    this.graphStore = graphStore;
    this.properties = properties;
  }

  @Override
  public RelationAxis axis() {
    return RelationAxis.UPSTREAM;
  }

  @Override
  public AxisResult<DirectionalGroup> resolve(Snippet focus, QueryDeadline deadline) {
    TemporalDirection direction = TemporalDirection.BEFORE;
    TieredLookup.Result result =
        TieredLookup.of(
                (limit, d) ->
                    graphStore.findConnected(focus.id(), focus.timestamp(), direction, limit, d),
                (limit, d) ->
                    graphStore.findByTimestamp(focus.id(), focus.timestamp(), direction, limit, d),
                d -> graphStore.countByTimestamp(focus.id(), focus.timestamp(), direction, d))
            .run(focus.id(), properties.getMotionBudget().limitFor(axis()), deadline);

    RelationKind relation = result.fromPrimary() ? RelationKind.CAUSAL : RelationKind.TEMPORAL;
    return new AxisResult<>(new DirectionalGroup(result.nodes(), relation), result.hasMore());
  }
}
