package com.mindthread.backend.thread.service;

import com.mindthread.backend.snippet.domain.Snippet;
import com.mindthread.backend.snippet.store.QueryDeadline;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Two-tier relation lookup: a primary query over explicit structure, a fallback over implicit
 * structure that only runs when the primary finds nothing, and a count that always runs.
 *
 * <p>Whatever the store returns, the result never contains the focus, never repeats a snippet and
 * never exceeds the budget.
 */
public final class TieredLookup {

  public enum Tier {
    PRIMARY,
    FALLBACK
  }

  @FunctionalInterface
  public interface Query {
    List<Snippet> fetch(int limit, QueryDeadline deadline);
  }

  @FunctionalInterface
  public interface Count {
    long count(QueryDeadline deadline);
  }

  private final Query primary;
  private final Query fallback;
  private final Count count;

  private TieredLookup(Query primary, Query fallback, Count count) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
    this.count = Objects.requireNonNull(count, "count");
  }

  public static TieredLookup of(Query primary, Query fallback, Count count) {
    return new TieredLookup(primary, fallback, count);
  }

  /** Primary that never matches, so the fallback always decides. */
  public static Query skipped() {
    return (limit, deadline) -> List.of();
  }

  public Result run(long focusId, int budget, QueryDeadline deadline) {
    int limit = Math.max(0, budget);
    Tier tier = Tier.PRIMARY;
    List<Snippet> nodes = sanitize(primary.fetch(limit, deadline), focusId, limit);
    if (nodes.isEmpty()) {
      tier = Tier.FALLBACK;
      nodes = sanitize(fallback.fetch(limit, deadline), focusId, limit);
    }
    long total = count.count(deadline);
    return new Result(nodes, tier, total > limit);
  }

  static List<Snippet> sanitize(List<Snippet> candidates, long focusId, int limit) {
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }
    Set<Long> seen = new LinkedHashSet<>();
    List<Snippet> accepted = new ArrayList<>(Math.min(candidates.size(), limit));
    for (Snippet candidate : candidates) {
      if (accepted.size() >= limit) {
        break;
      }
      if (candidate == null || candidate.id() == focusId || !seen.add(candidate.id())) {
        continue;
      }
      accepted.add(candidate);
    }
    return List.copyOf(accepted);
  }

  public record Result(List<Snippet> nodes, Tier tier, boolean hasMore) {

    public boolean isEmpty() {
      return nodes.isEmpty();
    }

    public boolean fromPrimary() {
      return tier == Tier.PRIMARY;
    }
  }
}
