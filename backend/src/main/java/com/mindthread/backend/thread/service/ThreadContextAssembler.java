package com.mindthread.backend.thread.service;

import com.mindthread.backend.snippet.domain.Snippet;
import com.mindthread.backend.snippet.store.GraphStore;
import com.mindthread.backend.snippet.store.GraphStoreException;
import com.mindthread.backend.snippet.store.QueryDeadline;
import com.mindthread.backend.snippet.store.QueryDeadlineExceededException;
import com.mindthread.backend.snippet.store.StoreUnavailableException;
import com.mindthread.backend.thread.config.ThreadContextProperties;
import com.mindthread.backend.thread.config.ThreadContextProperties.FailurePolicy;
import com.mindthread.backend.thread.domain.AxisFailure;
import com.mindthread.backend.thread.domain.DirectionalGroup;
import com.mindthread.backend.thread.domain.LateralGroup;
import com.mindthread.backend.thread.domain.RelationAxis;
import com.mindthread.backend.thread.domain.ThreadContext;
import com.mindthread.backend.thread.domain.ThreadMeta;
import com.mindthread.backend.thread.service.RelationResolver.AxisResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link ThreadContext} by resolving the upstream, downstream and lateral axes in
 * parallel and merging them around the focus.
 *
 * <p>All store calls of one build share a {@link QueryDeadline}. When it expires the unfinished
 * axes are cancelled. Under {@link FailurePolicy#PARTIAL} a failed axis becomes an empty group plus
 * an entry in {@link ThreadMeta#failures()}; under {@link FailurePolicy#FAIL_FAST} the first failure
 * aborts the build. An unreachable store, or every axis failing, aborts under both policies.
 */
@Service
public class ThreadContextAssembler {

  private static final Logger log = LoggerFactory.getLogger(ThreadContextAssembler.class);

  private final GraphStore graphStore;
  private final List<RelationResolver<?>> resolvers;
  private final ThreadContextProperties properties;
  private final ExecutorService executorService;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public ThreadContextAssembler(
      GraphStore graphStore,
      UpstreamResolver upstreamResolver,
      DownstreamResolver downstreamResolver,
      LateralResolver lateralResolver,
      ThreadContextProperties properties,
      @Qualifier("threadResolverExecutor") ExecutorService executorService,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.graphStore = graphStore;
    this.resolvers = List.of(upstreamResolver, downstreamResolver, lateralResolver);
    this.properties = properties;
    this.executorService = executorService;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public ThreadContext build(long focusId) {
    long start = System.nanoTime();
    QueryDeadline deadline = QueryDeadline.after(properties.getBuildTimeout());
    Snippet focus;
    try {
      focus =
          graphStore
              .findById(focusId, deadline)
              .orElseThrow(() -> new FocusNotFoundException(focusId));
    } catch (FocusNotFoundException ex) {
      recordDuration("failed", start);
      throw ex;
    } catch (GraphStoreException ex) {
      recordDuration("failed", start);
      meterRegistry.counter("thread.context.focus.lookup.failures").increment();
      log.error("Failed to load focus snippet {}", focusId, ex);
      throw new ThreadContextBuildException(
          "Failed to load focus snippet " + focusId, List.of(), ex);
    }
    return assemble(focus, deadline, start);
  }

  public ThreadContext build(Snippet focus) {
    Objects.requireNonNull(focus, "focus");
    return assemble(
        focus, QueryDeadline.after(properties.getBuildTimeout()), System.nanoTime());
  }

  private ThreadContext assemble(Snippet focus, QueryDeadline deadline, long start) {
    String outcome = "failed";
    try {
      Map<RelationAxis, AxisOutcome> outcomes = resolveAll(focus, deadline);
      ThreadContext context = merge(focus, outcomes);
      outcome = context.isComplete() ? "complete" : "partial";
      log.debug(
          "Built thread context for snippet {}: upstream={}, downstream={}, lateral={}, failures={}",
          focus.id(),
          context.upstream().nodes().size(),
          context.downstream().nodes().size(),
          context.lateral().nodes().size(),
          context.meta().failures().size());
      return context;
    } finally {
      recordDuration(outcome, start);
    }
  }

  private void recordDuration(String outcome, long start) {
    meterRegistry
        .timer("thread.context.build.duration", "outcome", outcome)
        .record(Duration.ofNanos(System.nanoTime() - start));
  }

  private Map<RelationAxis, AxisOutcome> resolveAll(Snippet focus, QueryDeadline deadline) {
    CompletionService<AxisOutcome> completionService =
        new ExecutorCompletionService<>(executorService);
    Map<RelationAxis, Future<AxisOutcome>> pending = new EnumMap<>(RelationAxis.class);
    for (RelationResolver<?> resolver : resolvers) {
      pending.put(
          resolver.axis(), completionService.submit(() -> invoke(resolver, focus, deadline)));
    }

    Map<RelationAxis, AxisOutcome> outcomes = new EnumMap<>(RelationAxis.class);
    try {
      while (!pending.isEmpty()) {
        Future<AxisOutcome> done =
            completionService.poll(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
        if (done == null) {
          deadline.cancel();
          for (RelationAxis axis : pending.keySet()) {
            outcomes.put(
                axis,
                AxisOutcome.failed(
                    axis, new QueryDeadlineExceededException(axis + " axis exceeded its deadline")));
          }
          cancelAll(pending);
          pending.clear();
          break;
        }
        AxisOutcome result = done.get();
        pending.remove(result.axis());
        outcomes.put(result.axis(), result);
        if (result.failed() && abortsImmediately(result.failure())) {
          deadline.cancel();
          cancelAll(pending);
          throw abort(focus, outcomes, result.failure());
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      deadline.cancel();
      cancelAll(pending);
      throw new ThreadContextBuildException(
          "Interrupted while building thread context for snippet " + focus.id(), List.of(), ex);
    } catch (ExecutionException ex) {
      deadline.cancel();
      cancelAll(pending);
      throw new ThreadContextBuildException(
          "Axis task failed for snippet " + focus.id(), List.of(), ex.getCause());
    }

    boolean allFailed = outcomes.values().stream().allMatch(AxisOutcome::failed);
    if (allFailed) {
      throw abort(focus, outcomes, outcomes.get(RelationAxis.UPSTREAM).failure());
    }
    if (properties.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
      for (AxisOutcome outcome : outcomes.values()) {
        if (outcome.failed()) {
          throw abort(focus, outcomes, outcome.failure());
        }
      }
    }
    recordFailures(outcomes);
    return outcomes;
  }

  private AxisOutcome invoke(RelationResolver<?> resolver, Snippet focus, QueryDeadline deadline) {
    try {
      return AxisOutcome.resolved(resolver.axis(), resolver.resolve(focus, deadline));
    } catch (RuntimeException ex) {
      return AxisOutcome.failed(resolver.axis(), ex);
    }
  }

  private boolean abortsImmediately(RuntimeException failure) {
    return failure instanceof StoreUnavailableException
        || properties.getFailurePolicy() == FailurePolicy.FAIL_FAST;
  }

  private ThreadContextBuildException abort(
      Snippet focus, Map<RelationAxis, AxisOutcome> outcomes, RuntimeException cause) {
    recordFailures(outcomes);
    List<AxisFailure> failures = failuresOf(outcomes);
    log.error(
        "Aborting thread context for snippet {} after {} failed axis(es)",
        focus.id(),
        failures.size(),
        cause);
    return new ThreadContextBuildException(
        "Failed to build thread context for snippet " + focus.id(), failures, cause);
  }

  private ThreadContext merge(Snippet focus, Map<RelationAxis, AxisOutcome> outcomes) {
    AxisOutcome upstream = outcomes.get(RelationAxis.UPSTREAM);
    AxisOutcome downstream = outcomes.get(RelationAxis.DOWNSTREAM);
    AxisOutcome lateral = outcomes.get(RelationAxis.LATERAL);

    ThreadMeta meta =
        new ThreadMeta(
            clock.instant(),
            upstream.hasMore(),
            downstream.hasMore(),
            lateral.hasMore(),
            failuresOf(outcomes));

    return new ThreadContext(
        focus,
        upstream.group(DirectionalGroup.class, DirectionalGroup.unresolved()),
        downstream.group(DirectionalGroup.class, DirectionalGroup.unresolved()),
        lateral.group(LateralGroup.class, LateralGroup.unresolved()),
        meta);
  }

  private void recordFailures(Map<RelationAxis, AxisOutcome> outcomes) {
    for (AxisOutcome outcome : outcomes.values()) {
      if (!outcome.failed()) {
        continue;
      }
      AxisFailure.Reason reason = reasonOf(outcome.failure());
      log.warn(
          "Thread axis {} failed ({}): {}", outcome.axis(), reason, outcome.failure().getMessage());
      meterRegistry
          .counter(
              "thread.context.axis.failures",
              "axis",
              outcome.axis().name().toLowerCase(),
              "reason",
              reason.name().toLowerCase())
          .increment();
    }
  }

  private static List<AxisFailure> failuresOf(Map<RelationAxis, AxisOutcome> outcomes) {
    List<AxisFailure> failures = new ArrayList<>();
    for (AxisOutcome outcome : outcomes.values()) {
      if (outcome.failed()) {
        failures.add(
            new AxisFailure(
                outcome.axis(), reasonOf(outcome.failure()), outcome.failure().getMessage()));
      }
    }
    return failures;
  }

  private static AxisFailure.Reason reasonOf(RuntimeException failure) {
    if (failure instanceof QueryDeadlineExceededException) {
      return AxisFailure.Reason.TIMED_OUT;
    }
    if (failure instanceof StoreUnavailableException) {
      return AxisFailure.Reason.STORE_UNAVAILABLE;
    }
    return AxisFailure.Reason.QUERY_FAILED;
  }

  private static void cancelAll(Map<RelationAxis, Future<AxisOutcome>> pending) {
    pending.values().forEach(future -> future.cancel(true));
  }

  private record AxisOutcome(RelationAxis axis, AxisResult<?> result, RuntimeException failure) {

    static AxisOutcome resolved(RelationAxis axis, AxisResult<?> result) {
      return new AxisOutcome(axis, result, null);
    }

    static AxisOutcome failed(RelationAxis axis, RuntimeException failure) {
      return new AxisOutcome(axis, null, failure);
    }

    boolean failed() {
      return failure != null;
    }

    boolean hasMore() {
      return result != null && result.hasMore();
    }

    <G> G group(Class<G> type, G unresolved) {
      return result != null ? type.cast(result.group()) : unresolved;
    }
  }
}
