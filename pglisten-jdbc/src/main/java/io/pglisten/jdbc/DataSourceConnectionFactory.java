package io.pglisten.jdbc;

import io.pglisten.SubscribeException;
import io.pglisten.spi.NotificationConnection;
import io.pglisten.spi.NotificationConnectionFactory;
import org.postgresql.PGConnection;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link NotificationConnectionFactory} backed by a {@link DataSource}.
 *
 * <p>Works with plain pgjdbc data sources and with pools such as HikariCP, as long as the
 * pooled connection unwraps to {@link PGConnection}. The connection is held for the whole
 * session, so a pooled data source loses one connection per running listener.
 */
public final class DataSourceConnectionFactory implements NotificationConnectionFactory {
  private final DataSource dataSource;

  public DataSourceConnectionFactory(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public NotificationConnection connect() throws SQLException, SubscribeException {
    Connection connection = dataSource.getConnection();
    try {
      if (!connection.isWrapperFor(PGConnection.class)) {
        throw new SubscribeException(null,
            "DataSource does not provide PostgreSQL connections: " + connection.getClass().getName());
      }
      PGConnection pgConnection = connection.unwrap(PGConnection.class);
      connection.setAutoCommit(true);
      return new PgNotificationConnection(connection, pgConnection);
    } catch (SQLException | SubscribeException | RuntimeException e) {
      closeQuietly(connection, e);
      throw e;
    }
  }

  private static void closeQuietly(Connection connection, Exception failure) {
    try {
      connection.close();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  @Override
  public void validateChannel(String channel) throws SubscribeException {
    try {
      ChannelNames.validate(channel);
    } catch (IllegalArgumentException e) {
      throw new SubscribeException(channel, e.getMessage(), e);
    }
  }
}
