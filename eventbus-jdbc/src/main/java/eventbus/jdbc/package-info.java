/**
 * JDBC-backed {@link eventbus.spi.EventStore} implementations.
 *
 * <p>{@link eventbus.jdbc.AbstractJdbcEventStore} holds the shared SQL, the JSON row encoding and
 * the compare-and-set update; subclasses supply the dialect's upsert: H2 ({@code MERGE}),
 * MySQL ({@code ON DUPLICATE KEY UPDATE}) and PostgreSQL ({@code ON CONFLICT}). DDL scripts ship
 * under {@code eventbus/jdbc/schema/}.
 *
 * @see eventbus.jdbc.JdbcEventStores
 */
package eventbus.jdbc;
