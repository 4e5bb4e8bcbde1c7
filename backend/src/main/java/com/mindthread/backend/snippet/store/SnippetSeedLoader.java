package com.mindthread.backend.snippet.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mindthread.backend.snippet.domain.Edge;
import com.mindthread.backend.snippet.domain.Snippet;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads a JSON document of the form {@code {"snippets": [...], "edges": [...]}} into an {@link
 * InMemoryGraphStore}.
 */
public class SnippetSeedLoader {

  private static final Logger log = LoggerFactory.getLogger(SnippetSeedLoader.class);

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;

  public SnippetSeedLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
  }

  public void load(String location, InMemoryGraphStore store) {
    Resource resource = resourceLoader.getResource(location);
    SeedDocument document;
    try (InputStream input = resource.getInputStream()) {
      document = objectMapper.readValue(input, SeedDocument.class);
    } catch (IOException ex) {
      throw new IllegalStateException("Unable to load snippet seed: " + location, ex);
    }
    store.saveAll(document.snippets());
    document.edges().forEach(store::link);
    log.info(
        "Seeded in-memory snippet store from {}: {} snippets, {} edges",
        location,
        document.snippets().size(),
        document.edges().size());
  }

  record SeedDocument(List<Snippet> snippets, List<Edge> edges) {

    SeedDocument {
      snippets = snippets != null ? snippets : List.of();
      edges = edges != null ? edges : List.of();
    }
  }
}
