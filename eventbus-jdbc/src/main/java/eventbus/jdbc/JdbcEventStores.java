package eventbus.jdbc;

import eventbus.util.EventRecordCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event store dialects with auto-detection support.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventbus.jdbc.JdbcEventStoreFactory}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventStore store = JdbcEventStores.detect(dataSource);
 *
 * // Custom table
 * AbstractJdbcEventStore store = JdbcEventStores.detect(dataSource, "app_events");
 *
 * // Get a dialect by name
 * JdbcEventStoreFactory factory = JdbcEventStores.get("postgresql");
 * }</pre>
 */
public final class JdbcEventStores {

  private static final List<JdbcEventStoreFactory> FACTORIES;
  private static final Map<String, JdbcEventStoreFactory> BY_NAME = new ConcurrentHashMap<>();

  static {
    FACTORIES = ServiceLoader.load(JdbcEventStoreFactory.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (JdbcEventStoreFactory factory : FACTORIES) {
      BY_NAME.put(factory.name().toLowerCase(Locale.ROOT), factory);
    }
  }

  private JdbcEventStores() {
  }

  /**
   * Returns all registered dialects.
   */
  public static List<JdbcEventStoreFactory> all() {
    return FACTORIES;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the factory
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static JdbcEventStoreFactory get(String name) {
    JdbcEventStoreFactory factory = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (factory == null) {
      throw new IllegalArgumentException("Unknown event store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return factory;
  }

  public static AbstractJdbcEventStore detect(DataSource dataSource) {
    return detect(dataSource, TableNames.DEFAULT_TABLE);
  }

  public static AbstractJdbcEventStore detect(DataSource dataSource, String tableName) {
    return detect(dataSource, tableName, new EventRecordCodec());
  }

  /**
   * Creates the event store matching the database behind {@code dataSource}.
   *
   * @param dataSource the data source
   * @param tableName  the event table
   * @param codec      record codec
   * @return the event store
   * @throws IllegalStateException if the connection URL cannot be read
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static AbstractJdbcEventStore detect(DataSource dataSource, String tableName, EventRecordCodec codec) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event store from DataSource", e);
    }
    return detect(url).create(dataSource, tableName, codec);
  }

  /**
   * Finds the dialect for a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return the factory
   * @throws IllegalArgumentException if no dialect matches
   */
  public static JdbcEventStoreFactory detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (JdbcEventStoreFactory factory : FACTORIES) {
      for (String prefix : factory.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return factory;
        }
      }
    }

    throw new IllegalArgumentException("No event store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return FACTORIES.stream()
        .flatMap(f -> f.jdbcUrlPrefixes().stream())
        .toList();
  }
}
