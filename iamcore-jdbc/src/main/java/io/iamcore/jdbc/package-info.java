/**
 * JDBC persistence for the event log.
 *
 * <p>{@link io.iamcore.jdbc.JdbcEventLog} implements {@link io.iamcore.spi.EventLog} on top of
 * a vendor {@link io.iamcore.jdbc.store.AbstractJdbcEventStore}. {@link io.iamcore.jdbc.JdbcTemplate}
 * provides lightweight JDBC helpers and {@link io.iamcore.jdbc.DataSourceConnectionProvider}
 * adapts a {@link javax.sql.DataSource}.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.iamcore.jdbc.store}: vendor event stores and their registry</li>
 *   <li>{@code io.iamcore.jdbc.tx}: manual transaction management</li>
 * </ul>
 *
 * <p>Table DDL for each supported database ships under {@code /schema/{name}.sql}.
 */
package io.iamcore.jdbc;
