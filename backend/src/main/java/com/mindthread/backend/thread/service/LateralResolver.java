package com.mindthread.backend.thread.service;

import com.mindthread.backend.snippet.domain.Snippet;
import com.mindthread.backend.snippet.store.GraphStore;
import com.mindthread.backend.snippet.store.QueryDeadline;
import com.mindthread.backend.thread.config.ThreadContextProperties;
import com.mindthread.backend.thread.domain.LateralGroup;
import com.mindthread.backend.thread.domain.RelationAxis;
import org.springframework.stereotype.Component;

/**
 * Snippets resembling the focus: same cluster label, else same type.
 *
 * <p>{@code hasMore} counts the union of both predicates, which is broader than whichever tier
 * produced the nodes. It may report truncation the displayed tier does not have.
 */
@Component
public class LateralResolver implements RelationResolver<LateralGroup> {

  private final GraphStore graphStore;
  private final ThreadContextProperties properties;

  public LateralResolver(GraphStore graphStore, ThreadContextProperties properties) {
    this.graphStore = graphStore;
    this.properties = properties;
  }

  @Override
  public RelationAxis axis() {
    return RelationAxis.LATERAL;
  }

  @Override
  public AxisResult<LateralGroup> resolve(Snippet focus, QueryDeadline deadline) {
    TieredLookup.Query byCluster =
        focus.hasClusterLabel()
            ? (limit, d) -> graphStore.findByClusterLabel(focus.id(), focus.clusterLabel(), limit, d)
            : TieredLookup.skipped();

    TieredLookup.Result result =
        TieredLookup.of(
                byCluster,
                (limit, d) -> graphStore.findByType(focus.id(), focus.type(), limit, d),
                d ->
                    graphStore.countByClusterLabelOrType(
                        focus.id(), focus.clusterLabel(), focus.type(), d))
            .run(focus.id(), properties.getMotionBudget().limitFor(axis()), deadline);

    return new AxisResult<>(
        new LateralGroup(result.nodes(), similarity(result)), result.hasMore());
  }

  private static double similarity(TieredLookup.Result result) {
    if (result.isEmpty()) {
      return LateralGroup.NONE;
    }
    return result.fromPrimary() ? LateralGroup.SAME_CLUSTER : LateralGroup.SAME_TYPE;
  }
}
