package com.mindthread.backend.snippet.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.mindthread.backend.snippet.domain.Snippet;
import com.mindthread.backend.support.PostgresTestContainer;
import com.mindthread.backend.thread.config.ThreadContextProperties;
import com.mindthread.backend.thread.domain.AxisFailure;
import com.mindthread.backend.thread.domain.RelationAxis;
import com.mindthread.backend.thread.domain.RelationKind;
import com.mindthread.backend.thread.domain.ThreadContext;
import com.mindthread.backend.thread.service.DownstreamResolver;
import com.mindthread.backend.thread.service.LateralResolver;
import com.mindthread.backend.thread.service.ThreadContextAssembler;
import com.mindthread.backend.thread.service.UpstreamResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.postgresql.util.PSQLException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class JdbcGraphStoreIntegrationTest extends PostgresTestContainer {

  @Autowired private GraphStore graphStore;
  @Autowired private ThreadContextAssembler assembler;
  @Autowired private JdbcTemplate jdbcTemplate;

  private final QueryDeadline deadline = QueryDeadline.after(Duration.ofSeconds(5));

  @BeforeEach
  void cleanTables() {
    jdbcTemplate.execute("TRUNCATE snippet_edge, snippet CASCADE");
    insertSnippet(1, 10, "note", "work");
    insertSnippet(2, 20, "note", null);
    insertSnippet(3, 30, "goal", "work");
    insertSnippet(4, 40, "note", "work");
    insertSnippet(5, 50, "note", "work");
    insertSnippet(6, 60, "goal", null);
    insertSnippet(7, 70, "note", null);
  }

  @Test
  void usesJdbcAdapter() {
    assertThat(graphStore).isInstanceOf(JdbcGraphStore.class);
  }

  @Test
  void findByIdMapsColumns() {
    assertThat(graphStore.findById(3, deadline))
        .contains(new Snippet(3, 30, "snippet 3", "goal", "work"));
    assertThat(graphStore.findById(99, deadline)).isEmpty();
  }

  @Test
  void connectedQueryIsUndirectedAndDistinct() {
    insertEdge(2, 5);
    insertEdge(5, 2);
    insertEdge(1, 5);
    insertEdge(5, 5);
    insertEdge(5, 6);

    assertThat(graphStore.findConnected(5, 50, TemporalDirection.BEFORE, 5, deadline))
        .extracting(Snippet::id)
        .containsExactly(2L, 1L);
    assertThat(graphStore.countConnected(5, 50, TemporalDirection.BEFORE, deadline)).isEqualTo(2);
    assertThat(graphStore.findConnected(5, 50, TemporalDirection.AFTER, 5, deadline))
        .extracting(Snippet::id)
        .containsExactly(6L);
  }

  @Test
  void timestampQueriesRespectDirectionAndLimit() {
    assertThat(graphStore.findByTimestamp(5, 50, TemporalDirection.BEFORE, 3, deadline))
        .extracting(Snippet::id)
        .containsExactly(4L, 3L, 2L);
    assertThat(graphStore.countByTimestamp(5, 50, TemporalDirection.BEFORE, deadline))
        .isEqualTo(4);
    assertThat(
            graphStore.findByTypeAndTimestamp(
                5, Snippet.GOAL_TYPE, 50, TemporalDirection.AFTER, 5, deadline))
        .extracting(Snippet::id)
        .containsExactly(6L);
  }

  @Test
  void lateralQueriesMatchClusterOrType() {
    assertThat(graphStore.findByClusterLabel(5, "work", 5, deadline))
        .extracting(Snippet::id)
        .containsExactly(4L, 3L, 1L);
    assertThat(graphStore.findByType(5, Snippet.NOTE_TYPE, 2, deadline))
        .extracting(Snippet::id)
        .containsExactly(7L, 4L);
    // notes 1,2,4,7 plus goal 3 through its label
    assertThat(graphStore.countByClusterLabelOrType(5, "work", Snippet.NOTE_TYPE, deadline))
        .isEqualTo(5);
    assertThat(graphStore.countByClusterLabel(5, "", deadline)).isZero();
  }

  @Test
  void assemblerBuildsThreadFromDatabase() {
    insertEdge(3, 5);

    ThreadContext context = assembler.build(5L);

    assertThat(context.focus().id()).isEqualTo(5L);
    assertThat(context.upstream().relation()).isEqualTo(RelationKind.CAUSAL);
    assertThat(context.upstream().nodes()).extracting(Snippet::id).containsExactly(3L);
    assertThat(context.meta().hasMoreUpstream()).isFalse();
    assertThat(context.downstream().relation()).isEqualTo(RelationKind.NEXT_STEP);
    assertThat(context.downstream().nodes()).extracting(Snippet::id).containsExactly(6L);
    assertThat(context.lateral().similarity()).isEqualTo(0.7d);
    assertThat(context.isComplete()).isTrue();
  }

  @Test
  void driverStatementTimeoutMeansDeadlineExceeded() {
    JdbcGraphStore stalled = stalledStore();

    assertThatThrownBy(
            () ->
                stalled.findByType(
                    5, Snippet.NOTE_TYPE, 5, QueryDeadline.after(Duration.ofSeconds(1))))
        .isInstanceOf(QueryDeadlineExceededException.class)
        .hasRootCauseInstanceOf(PSQLException.class);
  }

  @Test
  void slowLateralQueryLeavesPartialContext() {
    insertEdge(3, 5);
    JdbcGraphStore stalled = stalledStore();
    JdbcGraphStore store =
        new JdbcGraphStore(jdbcTemplate) {
          @Override
          public List<Snippet> findByClusterLabel(
              long excludeId, String clusterLabel, int limit, QueryDeadline deadline) {
            return stalled.findByClusterLabel(excludeId, clusterLabel, limit, deadline);
          }

          @Override
          public List<Snippet> findByType(
              long excludeId, String type, int limit, QueryDeadline deadline) {
            return stalled.findByType(excludeId, type, limit, deadline);
          }

          @Override
          public long countByClusterLabelOrType(
              long excludeId, String clusterLabel, String type, QueryDeadline deadline) {
            return stalled.countByClusterLabelOrType(excludeId, clusterLabel, type, deadline);
          }
        };
    ThreadContextProperties properties = new ThreadContextProperties();
    properties.setBuildTimeout(Duration.ofSeconds(1));
    ExecutorService executor = Executors.newFixedThreadPool(3);
    try {
      ThreadContextAssembler slowAssembler =
          new ThreadContextAssembler(
              store,
              new UpstreamResolver(store, properties),
              new DownstreamResolver(store, properties),
              new LateralResolver(store, properties),
              properties,
              executor,
              new SimpleMeterRegistry(),
              Clock.systemUTC());

      ThreadContext context = slowAssembler.build(5L);

      assertThat(context.upstream().nodes()).extracting(Snippet::id).containsExactly(3L);
      assertThat(context.lateral().nodes()).isEmpty();
      assertThat(context.meta().failures())
          .extracting(AxisFailure::axis, AxisFailure::reason)
          .containsExactly(
              tuple(RelationAxis.LATERAL, AxisFailure.Reason.TIMED_OUT));
    } finally {
      executor.shutdownNow();
    }
  }

  /** Store whose {@code snippet} relation is a view that sleeps on every row. */
  private JdbcGraphStore stalledStore() {
    jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS stalled");
    jdbcTemplate.execute(
        """
        CREATE OR REPLACE FUNCTION stalled.pause() RETURNS boolean
        LANGUAGE plpgsql VOLATILE AS $$
        BEGIN
          PERFORM pg_sleep(5);
          RETURN true;
        END
        $$
        """);
    jdbcTemplate.execute(
        "CREATE OR REPLACE VIEW stalled.snippet AS"
            + " SELECT s.* FROM public.snippet s WHERE stalled.pause()");
    return new JdbcGraphStore(new JdbcTemplate(dataSourceForSchema("stalled")));
  }

  private void insertSnippet(long id, long capturedAt, String type, String clusterLabel) {
    jdbcTemplate.update(
        "INSERT INTO snippet (id, content, type, captured_at, cluster_label) VALUES (?, ?, ?, ?, ?)",
        id,
        "snippet " + id,
        type,
        capturedAt,
        clusterLabel);
  }

  private void insertEdge(long sourceId, long targetId) {
    jdbcTemplate.update(
        "INSERT INTO snippet_edge (source_id, target_id) VALUES (?, ?)", sourceId, targetId);
  }
}
