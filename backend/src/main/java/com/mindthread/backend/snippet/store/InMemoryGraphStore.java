package com.mindthread.backend.snippet.store;

import com.mindthread.backend.snippet.domain.Edge;
import com.mindthread.backend.snippet.domain.Snippet;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.util.StringUtils;

/** Heap-backed {@link GraphStore}. Safe for concurrent readers and writers. */
public class InMemoryGraphStore implements GraphStore {

  private static final Comparator<Snippet> OLDEST_FIRST =
      Comparator.comparingLong(Snippet::timestamp).thenComparingLong(Snippet::id);

  private final Map<Long, Snippet> snippets = new ConcurrentHashMap<>();
  private final List<Edge> edges = new CopyOnWriteArrayList<>();

  public InMemoryGraphStore save(Snippet snippet) {
    Objects.requireNonNull(snippet, "snippet");
    snippets.put(snippet.id(), snippet);
    return this;
  }

  public InMemoryGraphStore saveAll(Collection<Snippet> values) {
    values.forEach(this::save);
    return this;
  }

  public InMemoryGraphStore link(Edge edge) {
    edges.add(Objects.requireNonNull(edge, "edge"));
    return this;
  }

  public InMemoryGraphStore link(long sourceId, long targetId) {
    return link(Edge.between(sourceId, targetId));
  }

  @Override
  public Optional<Snippet> findById(long id, QueryDeadline deadline) {
    deadline.checkActive("findById");
    return Optional.ofNullable(snippets.get(id));
  }

  @Override
  public List<Snippet> findConnected(
      long focusId, long pivot, TemporalDirection direction, int limit, QueryDeadline deadline) {
    deadline.checkActive("findConnected");
    return limit(connected(focusId, pivot, direction), direction, limit);
  }

  @Override
  public long countConnected(
      long focusId, long pivot, TemporalDirection direction, QueryDeadline deadline) {
    deadline.checkActive("countConnected");
    return connected(focusId, pivot, direction).count();
  }

  @Override
  public List<Snippet> findByTimestamp(
      long excludeId, long pivot, TemporalDirection direction, int limit, QueryDeadline deadline) {
    deadline.checkActive("findByTimestamp");
    return limit(matching(excludeId, temporal(pivot, direction)), direction, limit);
  }

  @Override
  public long countByTimestamp(
      long excludeId, long pivot, TemporalDirection direction, QueryDeadline deadline) {
    deadline.checkActive("countByTimestamp");
    return matching(excludeId, temporal(pivot, direction)).count();
  }

  @Override
  public List<Snippet> findByTypeAndTimestamp(
      long excludeId,
      String type,
      long pivot,
      TemporalDirection direction,
      int limit,
      QueryDeadline deadline) {
    deadline.checkActive("findByTypeAndTimestamp");
    return limit(
        matching(excludeId, ofType(type).and(temporal(pivot, direction))), direction, limit);
  }

  @Override
  public long countByTypeAndTimestamp(
      long excludeId, String type, long pivot, TemporalDirection direction, QueryDeadline deadline) {
    deadline.checkActive("countByTypeAndTimestamp");
    return matching(excludeId, ofType(type).and(temporal(pivot, direction))).count();
  }

  @Override
  public List<Snippet> findByClusterLabel(
      long excludeId, String clusterLabel, int limit, QueryDeadline deadline) {
    deadline.checkActive("findByClusterLabel");
    return limit(matching(excludeId, inCluster(clusterLabel)), TemporalDirection.BEFORE, limit);
  }

  @Override
  public long countByClusterLabel(long excludeId, String clusterLabel, QueryDeadline deadline) {
    deadline.checkActive("countByClusterLabel");
    return matching(excludeId, inCluster(clusterLabel)).count();
  }

  @Override
  public List<Snippet> findByType(long excludeId, String type, int limit, QueryDeadline deadline) {
    deadline.checkActive("findByType");
    return limit(matching(excludeId, ofType(type)), TemporalDirection.BEFORE, limit);
  }

  @Override
  public long countByType(long excludeId, String type, QueryDeadline deadline) {
    deadline.checkActive("countByType");
    return matching(excludeId, ofType(type)).count();
  }

  @Override
  public long countByClusterLabelOrType(
      long excludeId, String clusterLabel, String type, QueryDeadline deadline) {
    deadline.checkActive("countByClusterLabelOrType");
    return matching(excludeId, inCluster(clusterLabel).or(ofType(type))).count();
  }

  private Stream<Snippet> connected(long focusId, long pivot, TemporalDirection direction) {
    Set<Long> neighbourIds =
        edges.stream()
            .filter(edge -> edge.touches(focusId))
            .map(edge -> edge.other(focusId))
            .collect(Collectors.toSet());
    return neighbourIds.stream()
        .filter(id -> id != focusId)
        .map(snippets::get)
        .filter(Objects::nonNull)
        .filter(temporal(pivot, direction));
  }

  private Stream<Snippet> matching(long excludeId, Predicate<Snippet> predicate) {
    return snippets.values().stream().filter(s -> s.id() != excludeId).filter(predicate);
  }

  private static List<Snippet> limit(
      Stream<Snippet> candidates, TemporalDirection direction, int limit) {
    Comparator<Snippet> order =
        direction == TemporalDirection.BEFORE ? OLDEST_FIRST.reversed() : OLDEST_FIRST;
    return candidates.sorted(order).limit(Math.max(0, limit)).toList();
  }

  private static Predicate<Snippet> temporal(long pivot, TemporalDirection direction) {
    return snippet -> direction.accepts(snippet.timestamp(), pivot);
  }

  private static Predicate<Snippet> ofType(String type) {
    return snippet -> snippet.type().equals(type);
  }

  private static Predicate<Snippet> inCluster(String clusterLabel) {
    if (!StringUtils.hasText(clusterLabel)) {
      return snippet -> false;
    }
    return snippet -> clusterLabel.equals(snippet.clusterLabel());
  }
}
