package eventbus.jdbc;

import eventbus.util.EventRecordCodec;

import javax.sql.DataSource;
import java.util.List;

/**
 * MySQL event store. Also compatible with TiDB and MariaDB.
 *
 * <p>Saves with {@code INSERT ... ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlEventStore extends AbstractJdbcEventStore {
  public static final String NAME = "mysql";

  public MySqlEventStore(DataSource dataSource) {
    this(dataSource, TableNames.DEFAULT_TABLE);
  }

  public MySqlEventStore(DataSource dataSource, String tableName) {
    this(dataSource, tableName, new EventRecordCodec());
  }

  public MySqlEventStore(DataSource dataSource, String tableName, EventRecordCodec codec) {
    super(dataSource, tableName, codec);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (" + PLACEHOLDERS + ")" +
        " ON DUPLICATE KEY UPDATE event_type=VALUES(event_type), status=VALUES(status)," +
        " priority=VALUES(priority), created_at=VALUES(created_at)," +
        " next_attempt_at=VALUES(next_attempt_at), processing_started_at=VALUES(processing_started_at)," +
        " retry_count=VALUES(retry_count)," +
        " last_error=VALUES(last_error), record_json=VALUES(record_json), updated_at=VALUES(updated_at)";
  }

  public static final class Factory implements JdbcEventStoreFactory {
    @Override
    public String name() {
      return NAME;
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
      return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
    }

    @Override
    public AbstractJdbcEventStore create(DataSource dataSource, String tableName, EventRecordCodec codec) {
      return new MySqlEventStore(dataSource, tableName, codec);
    }
  }
}
