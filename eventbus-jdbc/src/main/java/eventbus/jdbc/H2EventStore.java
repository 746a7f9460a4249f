package eventbus.jdbc;

import eventbus.util.EventRecordCodec;

import javax.sql.DataSource;
import java.util.List;

/**
 * H2 event store. Primarily for testing and embedded deployments.
 *
 * <p>Saves with {@code MERGE INTO ... KEY (event_id)}.
 */
public final class H2EventStore extends AbstractJdbcEventStore {
  public static final String NAME = "h2";

  public H2EventStore(DataSource dataSource) {
    this(dataSource, TableNames.DEFAULT_TABLE);
  }

  public H2EventStore(DataSource dataSource, String tableName) {
    this(dataSource, tableName, new EventRecordCodec());
  }

  public H2EventStore(DataSource dataSource, String tableName, EventRecordCodec codec) {
    super(dataSource, tableName, codec);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected String upsertSql() {
    return "MERGE INTO " + tableName() + " (" + COLUMNS + ") KEY (event_id) VALUES (" + PLACEHOLDERS + ")";
  }

  public static final class Factory implements JdbcEventStoreFactory {
    @Override
    public String name() {
      return NAME;
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
      return List.of("jdbc:h2:");
    }

    @Override
    public AbstractJdbcEventStore create(DataSource dataSource, String tableName, EventRecordCodec codec) {
      return new H2EventStore(dataSource, tableName, codec);
    }
  }
}
