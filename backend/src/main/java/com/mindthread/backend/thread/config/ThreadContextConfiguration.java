package com.mindthread.backend.thread.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mindthread.backend.snippet.store.GraphStore;
import com.mindthread.backend.snippet.store.InMemoryGraphStore;
import com.mindthread.backend.snippet.store.JdbcGraphStore;
import com.mindthread.backend.snippet.store.SnippetSeedLoader;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(ThreadContextProperties.class)
public class ThreadContextConfiguration {

  private static final Logger log = LoggerFactory.getLogger(ThreadContextConfiguration.class);

  @Bean(name = "threadResolverExecutor", destroyMethod = "shutdown")
  public ExecutorService threadResolverExecutor(ThreadContextProperties properties) {
    int concurrency = properties.getExecutor().getMaxConcurrency();
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("thread-resolver-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };

    return Executors.newFixedThreadPool(concurrency, threadFactory);
  }

  @Bean
  public Clock threadContextClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "app.thread.store",
      name = "backend",
      havingValue = "jdbc",
      matchIfMissing = true)
  public GraphStore jdbcGraphStore(JdbcTemplate jdbcTemplate) {
    log.info("Using JDBC snippet store");
    return new JdbcGraphStore(jdbcTemplate);
  }

  @Bean
  @ConditionalOnProperty(prefix = "app.thread.store", name = "backend", havingValue = "memory")
  public GraphStore inMemoryGraphStore(
      ThreadContextProperties properties,
      ResourceLoader resourceLoader,
      ObjectProvider<ObjectMapper> objectMapper) {
    log.info("Using in-memory snippet store");
    InMemoryGraphStore store = new InMemoryGraphStore();
    String seedLocation = properties.getStore().getSeedLocation();
    if (StringUtils.hasText(seedLocation)) {
      new SnippetSeedLoader(resourceLoader, objectMapper.getIfAvailable(ObjectMapper::new))
          .load(seedLocation, store);
    }
    return store;
  }
}
