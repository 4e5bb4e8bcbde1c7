package com.mindthread.backend.thread.service;

import static com.mindthread.backend.support.TestGraphStores.note;
import static com.mindthread.backend.support.TestGraphStores.properties;
import static org.assertj.core.api.Assertions.assertThat;

import com.mindthread.backend.snippet.domain.Snippet;
import com.mindthread.backend.snippet.store.InMemoryGraphStore;
import com.mindthread.backend.snippet.store.QueryDeadline;
import com.mindthread.backend.thread.domain.DirectionalGroup;
import com.mindthread.backend.thread.domain.RelationKind;
import com.mindthread.backend.thread.service.RelationResolver.AxisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UpstreamResolverTest {

  private final Snippet focus = note(5, 100);

  private InMemoryGraphStore store;
  private UpstreamResolver resolver;

  @BeforeEach
  void setUp() {
    store = new InMemoryGraphStore();
    store.save(focus);
    resolver = new UpstreamResolver(store, properties(5, 5, 8));
  }

  @Test
  void fallsBackToMostRecentOlderSnippetsWithoutEdges() {
    for (long id = 10; id < 20; id++) {
      store.save(note(id, id * 5));
    }

    AxisResult<DirectionalGroup> result = resolver.resolve(focus, QueryDeadline.none());

    assertThat(result.group().relation()).isEqualTo(RelationKind.TEMPORAL);
    assertThat(result.group().nodes())
        .extracting(Snippet::id)
        .containsExactly(19L, 18L, 17L, 16L, 15L);
    assertThat(result.hasMore()).isTrue();
  }

  @Test
  void linkedOlderSnippetMakesRelationCausal() {
    store.save(note(7, 50)).save(note(8, 90)).link(5, 7);

    AxisResult<DirectionalGroup> result = resolver.resolve(focus, QueryDeadline.none());

    assertThat(result.group().relation()).isEqualTo(RelationKind.CAUSAL);
    assertThat(result.group().nodes()).extracting(Snippet::id).containsExactly(7L);
    assertThat(result.hasMore()).isFalse();
  }

  @Test
  void edgeOrientationDoesNotMatter() {
    store.save(note(7, 50)).link(7, 5);

    AxisResult<DirectionalGroup> result = resolver.resolve(focus, QueryDeadline.none());

    assertThat(result.group().relation()).isEqualTo(RelationKind.CAUSAL);
    assertThat(result.group().nodes()).extracting(Snippet::id).containsExactly(7L);
  }

  @Test
  void linkedNewerSnippetIsNotUpstream() {
    store.save(note(7, 150)).save(note(8, 90)).link(5, 7);

    AxisResult<DirectionalGroup> result = resolver.resolve(focus, QueryDeadline.none());

    assertThat(result.group().relation()).isEqualTo(RelationKind.TEMPORAL);
    assertThat(result.group().nodes()).extracting(Snippet::id).containsExactly(8L);
  }

  @Test
  void hasMoreCountsAllOlderSnippetsEvenWhenCausal() {
    for (long id = 10; id < 16; id++) {
      store.save(note(id, id));
    }
    store.link(5, 10);

    AxisResult<DirectionalGroup> result = resolver.resolve(focus, QueryDeadline.none());

    assertThat(result.group().nodes()).extracting(Snippet::id).containsExactly(10L);
    assertThat(result.hasMore()).isTrue();
  }

  @Test
  void nothingOlderGivesEmptyTemporalGroup() {
    AxisResult<DirectionalGroup> result = resolver.resolve(focus, QueryDeadline.none());

    assertThat(result.group().nodes()).isEmpty();
    assertThat(result.group().relation()).isEqualTo(RelationKind.TEMPORAL);
    assertThat(result.hasMore()).isFalse();
  }
}
