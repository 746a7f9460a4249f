package eventbus.jdbc;

import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.spi.EventStore;
import eventbus.spi.EventStoreException;
import eventbus.util.EventRecordCodec;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC event store.
 *
 * <p>Each record occupies one row: the queried attributes (status, priority, creation time, next
 * attempt time, processing start) are kept in columns and the full record is kept as JSON in
 * {@code record_json}.
 * {@link #compareAndSet} is a single {@code UPDATE ... WHERE event_id=? AND status=?}, so it is
 * atomic on every supported database.
 *
 * <p>A row whose JSON cannot be decoded is moved to {@code DEAD_LETTER} with the decode error and
 * skipped. Subclasses supply the dialect's upsert statement. Register custom implementations via
 * {@code META-INF/services/eventbus.jdbc.JdbcEventStoreFactory}.
 *
 * @see JdbcEventStores
 */
public abstract class AbstractJdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcEventStore.class.getName());
  static final int MAX_ERROR_LENGTH = 4000;
  private static final int MAX_UPDATE_ATTEMPTS = 10;

  protected static final String COLUMNS =
      "event_id, event_type, status, priority, created_at, next_attempt_at, processing_started_at, " +
          "retry_count, last_error, record_json, updated_at";
  protected static final String PLACEHOLDERS = "?,?,?,?,?,?,?,?,?,?,?";

  private final DataSource dataSource;
  private final String tableName;
  private final EventRecordCodec codec;

  protected AbstractJdbcEventStore(DataSource dataSource, String tableName, EventRecordCodec codec) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.tableName = TableNames.validate(tableName);
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Unique identifier for this event store (e.g., "mysql", "postgresql", "h2"). Also names the
   * bundled DDL script.
   */
  public abstract String name();

  /**
   * Upsert statement for {@link #save}: binds {@link #COLUMNS} in order and replaces every
   * non-key column of an existing row.
   */
  protected abstract String upsertSql();

  public String tableName() {
    return tableName;
  }

  protected DataSource dataSource() {
    return dataSource;
  }

  /**
   * Creates the table and its indexes if they do not exist, from the bundled script
   * {@code eventbus/jdbc/schema/<name>.sql}.
   */
  public void createSchema() {
    String script = loadSchemaScript().replace("${table}", tableName);
    withConnection(conn -> {
      for (String statement : script.split(";")) {
        if (!statement.isBlank()) {
          JdbcTemplate.execute(conn, statement.trim());
        }
      }
      return null;
    });
    logger.log(Level.INFO, "Ensured {0} event table {1}", new Object[]{name(), tableName});
  }

  @Override
  public void save(EventRecord record) {
    Objects.requireNonNull(record, "record");
    Object[] row = rowValues(record);
    withConnection(conn -> JdbcTemplate.update(conn, upsertSql(), row));
  }

  @Override
  public Optional<EventRecord> get(String eventId) {
    String sql = "SELECT event_id, record_json FROM " + tableName + " WHERE event_id=?";
    List<EventRecord> found = withConnection(conn -> decodeRows(conn,
        JdbcTemplate.query(conn, sql, EncodedRow.MAPPER, eventId)));
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public boolean updateStatus(String eventId, EventStatus status, String error) {
    Objects.requireNonNull(status, "status");
    for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
      Optional<EventRecord> current = get(eventId);
      if (current.isEmpty()) {
        return false;
      }
      EventRecord record = current.get();
      if (record.status() == status) {
        return true;
      }
      if (compareAndSet(eventId, record.status(), record.transitionTo(status, Instant.now(), error))) {
        return true;
      }
    }
    throw new EventStoreException("Concurrent updates kept changing event " + eventId);
  }

  @Override
  public boolean compareAndSet(String eventId, EventStatus expected, EventRecord updated) {
    Objects.requireNonNull(expected, "expected");
    Objects.requireNonNull(updated, "updated");
    if (!eventId.equals(updated.eventId())) {
      throw new IllegalArgumentException("Record " + updated.eventId() + " cannot replace " + eventId);
    }
    String sql = "UPDATE " + tableName +
        " SET event_type=?, status=?, priority=?, created_at=?, next_attempt_at=?," +
        " processing_started_at=?, retry_count=?, last_error=?, record_json=?, updated_at=?" +
        " WHERE event_id=? AND status=?";
    Object[] row = rowValues(updated);
    Object[] params = new Object[row.length + 1];
    System.arraycopy(row, 1, params, 0, row.length - 1);
    params[row.length - 1] = eventId;
    params[row.length] = expected.name();
    return withConnection(conn -> JdbcTemplate.update(conn, sql, params)) == 1;
  }

  @Override
  public List<EventRecord> listByStatus(EventStatus status, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT event_id, record_json FROM " + tableName +
        " WHERE status=? ORDER BY created_at, event_id LIMIT ?";
    return withConnection(conn -> decodeRows(conn,
        JdbcTemplate.query(conn, sql, EncodedRow.MAPPER, status.name(), limit)));
  }

  @Override
  public List<EventRecord> listRetryDue(Instant now, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT event_id, record_json FROM " + tableName +
        " WHERE status=? AND (next_attempt_at IS NULL OR next_attempt_at <= ?)" +
        " ORDER BY created_at, event_id LIMIT ?";
    return withConnection(conn -> decodeRows(conn, JdbcTemplate.query(conn, sql, EncodedRow.MAPPER,
        EventStatus.RETRYING.name(), Timestamp.from(now), limit)));
  }

  @Override
  public List<EventRecord> listStaleProcessing(Instant startedBefore, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT event_id, record_json FROM " + tableName +
        " WHERE status=? AND (processing_started_at IS NULL OR processing_started_at < ?)" +
        " ORDER BY created_at, event_id LIMIT ?";
    return withConnection(conn -> decodeRows(conn, JdbcTemplate.query(conn, sql, EncodedRow.MAPPER,
        EventStatus.PROCESSING.name(), Timestamp.from(startedBefore), limit)));
  }

  @Override
  public long countByStatus(EventStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE status=?";
    return withConnection(conn -> JdbcTemplate.queryForLong(conn, sql, status.name()));
  }

  @Override
  public int delete(Set<EventStatus> statuses, Instant olderThan) {
    if (statuses.isEmpty()) {
      return 0;
    }
    String sql = "DELETE FROM " + tableName + " WHERE status IN (" +
        String.join(",", Collections.nCopies(statuses.size(), "?")) + ") AND created_at < ?";
    List<Object> params = new ArrayList<>();
    statuses.forEach(s -> params.add(s.name()));
    params.add(Timestamp.from(olderThan));
    return withConnection(conn -> JdbcTemplate.update(conn, sql, params.toArray()));
  }

  protected <T> T withConnection(Function<Connection, T> work) {
    try (Connection conn = dataSource.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new EventStoreException("Failed to obtain connection for " + tableName, e);
    }
  }

  private Object[] rowValues(EventRecord record) {
    return new Object[]{
        record.eventId(),
        record.eventType(),
        record.status().name(),
        record.config().priority().level(),
        Timestamp.from(record.createdAt()),
        record.nextAttemptAt() == null ? null : Timestamp.from(record.nextAttemptAt()),
        record.processingStartedAt() == null ? null : Timestamp.from(record.processingStartedAt()),
        record.retryCount(),
        truncateError(record.lastError()),
        codec.encode(record),
        Timestamp.from(Instant.now())
    };
  }

  private List<EventRecord> decodeRows(Connection conn, List<EncodedRow> rows) {
    List<EventRecord> records = new ArrayList<>(rows.size());
    for (EncodedRow row : rows) {
      try {
        records.add(codec.decode(row.json()));
      } catch (IllegalArgumentException e) {
        quarantine(conn, row.eventId(), e);
      }
    }
    return records;
  }

  private void quarantine(Connection conn, String eventId, IllegalArgumentException cause) {
    String error = truncateError("Undecodable record: " + cause.getMessage());
    String sql = "UPDATE " + tableName + " SET status=?, last_error=?, updated_at=?" +
        " WHERE event_id=? AND status<>?";
    int updated = JdbcTemplate.update(conn, sql, EventStatus.DEAD_LETTER.name(), error,
        Timestamp.from(Instant.now()), eventId, EventStatus.DEAD_LETTER.name());
    if (updated > 0) {
      logger.log(Level.SEVERE, "Moved undecodable event " + eventId + " to DEAD_LETTER", cause);
    } else {
      logger.log(Level.FINE, "Skipped undecodable dead-letter event {0}", eventId);
    }
  }

  private String loadSchemaScript() {
    String resource = "eventbus/jdbc/schema/" + name() + ".sql";
    try (InputStream in = AbstractJdbcEventStore.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new EventStoreException("Missing schema script " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new EventStoreException("Failed to read schema script " + resource, e);
    }
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  private record EncodedRow(String eventId, String json) {
    static final JdbcTemplate.RowMapper<EncodedRow> MAPPER =
        rs -> new EncodedRow(rs.getString("event_id"), rs.getString("record_json"));
  }
}
