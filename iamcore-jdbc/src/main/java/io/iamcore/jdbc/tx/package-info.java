/**
 * Manual JDBC transaction management.
 *
 * <p>{@link io.iamcore.jdbc.tx.JdbcTransactionManager} opens a transaction and binds its
 * connection to a {@link io.iamcore.jdbc.tx.ThreadLocalTxContext}, which
 * {@link io.iamcore.jdbc.JdbcEventLog} joins when present.
 */
package io.iamcore.jdbc.tx;
