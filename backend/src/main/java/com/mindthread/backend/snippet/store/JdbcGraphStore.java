package com.mindthread.backend.snippet.store;

import com.mindthread.backend.snippet.domain.Snippet;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.util.StringUtils;

/** {@link GraphStore} over the {@code snippet} and {@code snippet_edge} tables. */
public class JdbcGraphStore implements GraphStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcGraphStore.class);

  private static final String QUERY_CANCELED_STATE = "57014";

  private static final String COLUMNS = "s.id, s.content, s.type, s.captured_at, s.cluster_label";

  private static final String SELECT_BY_ID_SQL =
      "SELECT " + COLUMNS + " FROM snippet s WHERE s.id = ?";

  private static final String CONNECTED_FROM =
      """
      FROM snippet s
      JOIN snippet_edge e ON (e.source_id = s.id OR e.target_id = s.id)
      WHERE (e.source_id = ? OR e.target_id = ?)
        AND s.id <> ?
        AND s.captured_at %s ?
      """;

  private static final String TIMESTAMP_FROM =
      """
      FROM snippet s
      WHERE s.id <> ?
        AND s.captured_at %s ?
      """;

  private static final String TYPE_AND_TIMESTAMP_FROM =
      """
      FROM snippet s
      WHERE s.id <> ?
        AND s.type = ?
        AND s.captured_at %s ?
      """;

  private static final String CLUSTER_FROM =
      """
      FROM snippet s
      WHERE s.id <> ?
        AND s.cluster_label = ?
      """;

  private static final String TYPE_FROM =
      """
      FROM snippet s
      WHERE s.id <> ?
        AND s.type = ?
      """;

  private static final String CLUSTER_OR_TYPE_FROM =
      """
      FROM snippet s
      WHERE s.id <> ?
        AND (s.cluster_label = ? OR s.type = ?)
      """;

  private static final RowMapper<Snippet> SNIPPET_ROW_MAPPER =
      (rs, rowNum) -> mapSnippet(rs);

  private static final ResultSetExtractor<Long> COUNT_EXTRACTOR =
      rs -> rs.next() ? rs.getLong(1) : 0L;

  private final JdbcTemplate jdbcTemplate;

  public JdbcGraphStore(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
  }

  @Override
  public Optional<Snippet> findById(long id, QueryDeadline deadline) {
    List<Snippet> rows = select("findById", SELECT_BY_ID_SQL, deadline, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Snippet> findConnected(
      long focusId, long pivot, TemporalDirection direction, int limit, QueryDeadline deadline) {
    String sql =
        "SELECT DISTINCT "
            + COLUMNS
            + "\n"
            + CONNECTED_FROM.formatted(direction.comparison())
            + orderBy(direction)
            + "LIMIT ?";
    return select("findConnected", sql, deadline, focusId, focusId, focusId, pivot, limit);
  }

  @Override
  public long countConnected(
      long focusId, long pivot, TemporalDirection direction, QueryDeadline deadline) {
    String sql =
        "SELECT COUNT(DISTINCT s.id)\n" + CONNECTED_FROM.formatted(direction.comparison());
    return count("countConnected", sql, deadline, focusId, focusId, focusId, pivot);
  }

  @Override
  public List<Snippet> findByTimestamp(
      long excludeId, long pivot, TemporalDirection direction, int limit, QueryDeadline deadline) {
    String sql =
        "SELECT "
            + COLUMNS
            + "\n"
            + TIMESTAMP_FROM.formatted(direction.comparison())
            + orderBy(direction)
            + "LIMIT ?";
    return select("findByTimestamp", sql, deadline, excludeId, pivot, limit);
  }

  @Override
  public long countByTimestamp(
      long excludeId, long pivot, TemporalDirection direction, QueryDeadline deadline) {
    String sql = "SELECT COUNT(*)\n" + TIMESTAMP_FROM.formatted(direction.comparison());
    return count("countByTimestamp", sql, deadline, excludeId, pivot);
  }

  @Override
  public List<Snippet> findByTypeAndTimestamp(
      long excludeId,
      String type,
      long pivot,
      TemporalDirection direction,
      int limit,
      QueryDeadline deadline) {
    String sql =
        "SELECT "
            + COLUMNS
            + "\n"
            + TYPE_AND_TIMESTAMP_FROM.formatted(direction.comparison())
            + orderBy(direction)
            + "LIMIT ?";
    return select("findByTypeAndTimestamp", sql, deadline, excludeId, type, pivot, limit);
  }

  @Override
  public long countByTypeAndTimestamp(
      long excludeId, String type, long pivot, TemporalDirection direction, QueryDeadline deadline) {
    String sql = "SELECT COUNT(*)\n" + TYPE_AND_TIMESTAMP_FROM.formatted(direction.comparison());
    return count("countByTypeAndTimestamp", sql, deadline, excludeId, type, pivot);
  }

  @Override
  public List<Snippet> findByClusterLabel(
      long excludeId, String clusterLabel, int limit, QueryDeadline deadline) {
    if (!StringUtils.hasText(clusterLabel)) {
      return List.of();
    }
    String sql =
        "SELECT " + COLUMNS + "\n" + CLUSTER_FROM + orderBy(TemporalDirection.BEFORE) + "LIMIT ?";
    return select("findByClusterLabel", sql, deadline, excludeId, clusterLabel, limit);
  }

  @Override
  public long countByClusterLabel(long excludeId, String clusterLabel, QueryDeadline deadline) {
    if (!StringUtils.hasText(clusterLabel)) {
      return 0L;
    }
    return count(
        "countByClusterLabel", "SELECT COUNT(*)\n" + CLUSTER_FROM, deadline, excludeId, clusterLabel);
  }

  @Override
  public List<Snippet> findByType(long excludeId, String type, int limit, QueryDeadline deadline) {
    String sql =
        "SELECT " + COLUMNS + "\n" + TYPE_FROM + orderBy(TemporalDirection.BEFORE) + "LIMIT ?";
    return select("findByType", sql, deadline, excludeId, type, limit);
  }

  @Override
  public long countByType(long excludeId, String type, QueryDeadline deadline) {
    return count("countByType", "SELECT COUNT(*)\n" + TYPE_FROM, deadline, excludeId, type);
  }

  @Override
  public long countByClusterLabelOrType(
      long excludeId, String clusterLabel, String type, QueryDeadline deadline) {
    if (!StringUtils.hasText(clusterLabel)) {
      return countByType(excludeId, type, deadline);
    }
    return count(
        "countByClusterLabelOrType",
        "SELECT COUNT(*)\n" + CLUSTER_OR_TYPE_FROM,
        deadline,
        excludeId,
        clusterLabel,
        type);
  }

  private static String orderBy(TemporalDirection direction) {
    return "ORDER BY s.captured_at %1$s, s.id %1$s\n".formatted(direction.sortOrder());
  }

  private List<Snippet> select(
      String operation, String sql, QueryDeadline deadline, Object... args) {
    deadline.checkActive(operation);
    try {
      return jdbcTemplate.query(statement(sql, deadline, args), SNIPPET_ROW_MAPPER);
    } catch (DataAccessException ex) {
      throw translate(operation, ex, deadline);
    }
  }

  private long count(String operation, String sql, QueryDeadline deadline, Object... args) {
    deadline.checkActive(operation);
    try {
      Long value = jdbcTemplate.query(statement(sql, deadline, args), COUNT_EXTRACTOR);
      return value != null ? value : 0L;
    } catch (DataAccessException ex) {
      throw translate(operation, ex, deadline);
    }
  }

  private PreparedStatementCreator statement(String sql, QueryDeadline deadline, Object[] args) {
    return connection -> {
      PreparedStatement statement = connection.prepareStatement(sql);
      for (int i = 0; i < args.length; i++) {
        statement.setObject(i + 1, args[i]);
      }
      if (deadline.isBounded()) {
        statement.setQueryTimeout(timeoutSeconds(deadline.remaining()));
      }
      return statement;
    };
  }

  static int timeoutSeconds(Duration remaining) {
    long millis = Math.max(0L, remaining.toMillis());
    long seconds = (millis + 999L) / 1000L;
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds));
  }

  private GraphStoreException translate(
      String operation, DataAccessException ex, QueryDeadline deadline) {
    // Postgres reports a statement timeout as 57014, which Spring maps to a resource failure.
    if (ex instanceof QueryTimeoutException || isQueryCanceled(ex) || deadline.isExpired()) {
      return new QueryDeadlineExceededException(operation + " timed out", ex);
    }
    if (ex instanceof DataAccessResourceFailureException) {
      log.warn("Snippet store unavailable during {}: {}", operation, ex.getMessage());
      return new StoreUnavailableException("Snippet store unavailable", ex);
    }
    return new QueryFailedException(operation + " failed", ex);
  }

  private static boolean isQueryCanceled(DataAccessException ex) {
    for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLException sqlException
          && QUERY_CANCELED_STATE.equals(sqlException.getSQLState())) {
        return true;
      }
    }
    return false;
  }

  private static Snippet mapSnippet(ResultSet rs) throws SQLException {
    return new Snippet(
        rs.getLong("id"),
        rs.getLong("captured_at"),
        rs.getString("content"),
        rs.getString("type"),
        rs.getString("cluster_label"));
  }
}
