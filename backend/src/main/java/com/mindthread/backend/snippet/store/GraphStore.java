package com.mindthread.backend.snippet.store;

import com.mindthread.backend.snippet.domain.Snippet;
import java.util.List;
import java.util.Optional;

/**
 * Read-only query surface over snippets and the edges between them.
 *
 * <p>Every {@code find*} excludes the snippet with {@code excludeId}, returns distinct snippets and
 * orders them by timestamp (ties broken by id in the same direction). Temporal queries order as
 * their {@link TemporalDirection} says; label and type queries return the most recent snippets
 * first. The matching {@code count*} operations apply the same predicate without a limit.
 *
 * <p>Implementations must tolerate concurrent calls from several threads and must check the given
 * {@link QueryDeadline} before running a query.
 */
public interface GraphStore {

  Optional<Snippet> findById(long id, QueryDeadline deadline);

  /** Snippets sharing an edge with {@code focusId}, on the requested side of {@code pivot}. */
  List<Snippet> findConnected(
      long focusId, long pivot, TemporalDirection direction, int limit, QueryDeadline deadline);

  long countConnected(long focusId, long pivot, TemporalDirection direction, QueryDeadline deadline);

  /** Pure temporal scan, no edge requirement. */
  List<Snippet> findByTimestamp(
      long excludeId, long pivot, TemporalDirection direction, int limit, QueryDeadline deadline);

  long countByTimestamp(
      long excludeId, long pivot, TemporalDirection direction, QueryDeadline deadline);

  List<Snippet> findByTypeAndTimestamp(
      long excludeId,
      String type,
      long pivot,
      TemporalDirection direction,
      int limit,
      QueryDeadline deadline);

  long countByTypeAndTimestamp(
      long excludeId, String type, long pivot, TemporalDirection direction, QueryDeadline deadline);

  List<Snippet> findByClusterLabel(
      long excludeId, String clusterLabel, int limit, QueryDeadline deadline);

  long countByClusterLabel(long excludeId, String clusterLabel, QueryDeadline deadline);

  List<Snippet> findByType(long excludeId, String type, int limit, QueryDeadline deadline);

  long countByType(long excludeId, String type, QueryDeadline deadline);

  /**
   * Counts snippets whose cluster label equals {@code clusterLabel} or whose type equals {@code
   * type}. A {@code null} or blank label matches no label.
   */
  long countByClusterLabelOrType(
      long excludeId, String clusterLabel, String type, QueryDeadline deadline);
}
