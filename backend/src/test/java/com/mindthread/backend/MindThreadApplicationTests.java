package com.mindthread.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mindthread.backend.snippet.store.GraphStore;
import com.mindthread.backend.snippet.store.InMemoryGraphStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("memory")
class MindThreadApplicationTests {

  @Autowired private GraphStore graphStore;
  @Autowired private MockMvc mockMvc;

  @Test
  void servesThreadFromSeededMemoryStore() throws Exception {
    assertThat(graphStore).isInstanceOf(InMemoryGraphStore.class);

    mockMvc
        .perform(get("/api/threads/2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.focus.id").value(2))
        .andExpect(jsonPath("$.upstream.relation").value("CAUSAL"))
        .andExpect(jsonPath("$.upstream.nodes[0].id").value(1))
        .andExpect(jsonPath("$.downstream.relation").value("IMPLICATION"))
        .andExpect(jsonPath("$.downstream.nodes[0].id").value(3))
        .andExpect(jsonPath("$.lateral.nodes[0].id").value(3))
        .andExpect(jsonPath("$.lateral.nodes[1].id").value(1))
        .andExpect(jsonPath("$.lateral.similarity").value(0.7))
        .andExpect(jsonPath("$.meta.failures").isEmpty());

    mockMvc.perform(get("/api/threads/999")).andExpect(status().isNotFound());
  }
}
