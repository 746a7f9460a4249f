package eventbus.jdbc;

import eventbus.spi.EventStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper for the event store implementations. Every {@link SQLException} is
 * rethrown as an {@link EventStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new EventStoreException("Failed to execute update: " + e.getMessage(), e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new EventStoreException("Failed to execute query: " + e.getMessage(), e);
    }
  }

  /** Execute a SELECT returning a single number, e.g. {@code COUNT(*)}. */
  public static long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> rows = query(conn, sql, rs -> rs.getLong(1), params);
    return rows.isEmpty() ? 0L : rows.get(0);
  }

  /** Execute a parameterless DDL statement. */
  public static void execute(Connection conn, String sql) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.execute();
    } catch (SQLException e) {
      throw new EventStoreException("Failed to execute statement: " + e.getMessage(), e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
