package eventbus.jdbc;

import eventbus.model.EventStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcEventStoresTest {

  @Test
  void allDialectsAreRegistered() {
    Set<String> names = JdbcEventStores.all().stream()
        .map(JdbcEventStoreFactory::name)
        .collect(Collectors.toSet());

    assertEquals(Set.of("h2", "postgresql", "mysql"), names);
  }

  @Test
  void getIsCaseInsensitive() {
    assertEquals("postgresql", JdbcEventStores.get("PostgreSQL").name());
    assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.get("oracle"));
  }

  @Test
  void detectsDialectFromUrl() {
    assertEquals("mysql", JdbcEventStores.detect("jdbc:mysql://localhost/app").name());
    assertEquals("mysql", JdbcEventStores.detect("jdbc:mariadb://localhost/app").name());
    assertEquals("postgresql", JdbcEventStores.detect("jdbc:postgresql://localhost/app").name());
    assertEquals("h2", JdbcEventStores.detect("JDBC:H2:mem:test").name());
  }

  @Test
  void rejectsUnknownOrEmptyUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect("jdbc:oracle:thin:@x"));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect((String) null));
  }

  @Test
  void detectsStoreFromDataSource() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    AbstractJdbcEventStore store = JdbcEventStores.detect(dataSource, "app_events");

    assertInstanceOf(H2EventStore.class, store);
    assertEquals("app_events", store.tableName());
    store.createSchema();
    assertEquals(0, store.countByStatus(EventStatus.PENDING));
  }

  @Test
  void unreachableDataSourceFailsDetection() {
    assertThrows(IllegalStateException.class, () -> JdbcEventStores.detect(new FailingDataSource()));
  }

  private static final class FailingDataSource implements DataSource {
    @Override
    public Connection getConnection() throws SQLException {
      throw new SQLException("connection refused");
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
      throw new SQLException("connection refused");
    }

    @Override
    public PrintWriter getLogWriter() {
      return null;
    }

    @Override
    public void setLogWriter(PrintWriter out) {
    }

    @Override
    public void setLoginTimeout(int seconds) {
    }

    @Override
    public int getLoginTimeout() {
      return 0;
    }

    @Override
    public Logger getParentLogger() {
      return null;
    }

    @Override
    public <T> T unwrap(Class<T> iface) {
      return null;
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) {
      return false;
    }
  }
}
