package eventbus.jdbc;

import eventbus.util.EventRecordCodec;

import javax.sql.DataSource;
import java.util.List;

/**
 * PostgreSQL event store.
 *
 * <p>Saves with {@code INSERT ... ON CONFLICT (event_id) DO UPDATE}.
 */
public final class PostgresEventStore extends AbstractJdbcEventStore {
  public static final String NAME = "postgresql";

  public PostgresEventStore(DataSource dataSource) {
    this(dataSource, TableNames.DEFAULT_TABLE);
  }

  public PostgresEventStore(DataSource dataSource, String tableName) {
    this(dataSource, tableName, new EventRecordCodec());
  }

  public PostgresEventStore(DataSource dataSource, String tableName, EventRecordCodec codec) {
    super(dataSource, tableName, codec);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (" + PLACEHOLDERS + ")" +
        " ON CONFLICT (event_id) DO UPDATE SET event_type=EXCLUDED.event_type, status=EXCLUDED.status," +
        " priority=EXCLUDED.priority, created_at=EXCLUDED.created_at," +
        " next_attempt_at=EXCLUDED.next_attempt_at, processing_started_at=EXCLUDED.processing_started_at," +
        " retry_count=EXCLUDED.retry_count," +
        " last_error=EXCLUDED.last_error, record_json=EXCLUDED.record_json, updated_at=EXCLUDED.updated_at";
  }

  public static final class Factory implements JdbcEventStoreFactory {
    @Override
    public String name() {
      return NAME;
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
      return List.of("jdbc:postgresql:");
    }

    @Override
    public AbstractJdbcEventStore create(DataSource dataSource, String tableName, EventRecordCodec codec) {
      return new PostgresEventStore(dataSource, tableName, codec);
    }
  }
}
