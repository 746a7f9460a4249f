package eventbus.jdbc;

import eventbus.util.EventRecordCodec;

import javax.sql.DataSource;
import java.util.List;

/**
 * Creates a dialect's {@link AbstractJdbcEventStore}. Implementations are discovered by
 * {@link JdbcEventStores} through {@link java.util.ServiceLoader}.
 */
public interface JdbcEventStoreFactory {

  /** Dialect name, e.g. "h2". */
  String name();

  /** JDBC URL prefixes this dialect handles, e.g. "jdbc:mysql:". */
  List<String> jdbcUrlPrefixes();

  AbstractJdbcEventStore create(DataSource dataSource, String tableName, EventRecordCodec codec);
}
