/**
 * PostgreSQL transport: opens notification connections from a {@link javax.sql.DataSource}
 * and receives {@code NOTIFY} traffic through pgjdbc.
 *
 * <pre>{@code
 * NotificationListener listener = NotificationListener.builder()
 *     .connectionFactory(new DataSourceConnectionFactory(dataSource))
 *     .build();
 * }</pre>
 */
package io.pglisten.jdbc;
