package io.pglisten.jdbc;

import io.pglisten.Notification;
import io.pglisten.SubscribeException;
import io.pglisten.spi.NotificationConnection;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link NotificationConnection} over a pgjdbc connection.
 *
 * <p>Notifications are read with {@link PGConnection#getNotifications(int)}, which blocks
 * on the socket for at most the requested wait. {@link #close()} unsubscribes before
 * releasing the connection so a pooled connection returns to its pool clean.
 */
public final class PgNotificationConnection implements NotificationConnection {
  private static final Logger logger = Logger.getLogger(PgNotificationConnection.class.getName());

  private final Connection connection;
  private final PGConnection pgConnection;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param connection   JDBC connection in auto-commit mode
   * @param pgConnection the same connection unwrapped to pgjdbc
   */
  public PgNotificationConnection(Connection connection, PGConnection pgConnection) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.pgConnection = Objects.requireNonNull(pgConnection, "pgConnection");
  }

  @Override
  public void listen(String channel) throws SQLException, SubscribeException {
    String sql = "LISTEN " + quote(channel);
    try (Statement statement = connection.createStatement()) {
      statement.execute(sql);
    } catch (SQLException e) {
      if (isRejection(e)) {
        throw new SubscribeException(channel,
            "Server rejected LISTEN on channel " + channel + " (SQLSTATE " + e.getSQLState() + ")", e);
      }
      throw e;
    }
  }

  private static String quote(String channel) throws SubscribeException {
    try {
      return ChannelNames.quote(channel);
    } catch (IllegalArgumentException e) {
      throw new SubscribeException(channel, e.getMessage(), e);
    }
  }

  /**
   * Syntax/access rule violations (class 42) and data exceptions (class 22) describe the
   * request, not the connection, and fail the same way on every retry.
   */
  static boolean isRejection(SQLException e) {
    String state = e.getSQLState();
    return state != null && (state.startsWith("42") || state.startsWith("22"));
  }

  @Override
  public List<Notification> receive(Duration maxWait) throws SQLException {
    int timeoutMs = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, maxWait.toMillis()));
    PGNotification[] received = pgConnection.getNotifications(timeoutMs);
    if (received == null || received.length == 0) {
      return Collections.emptyList();
    }
    Instant now = Instant.now();
    List<Notification> result = new ArrayList<>(received.length);
    for (PGNotification notification : received) {
      result.add(new Notification(notification.getName(), notification.getParameter(), now));
    }
    return result;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      if (!connection.isClosed()) {
        try (Statement statement = connection.createStatement()) {
          statement.execute("UNLISTEN *");
        }
      }
    } catch (SQLException e) {
      logger.log(Level.FINE, "UNLISTEN failed; connection is likely already broken", e);
    }
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close notification connection", e);
    }
  }
}
