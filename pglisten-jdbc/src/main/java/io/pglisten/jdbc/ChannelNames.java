package io.pglisten.jdbc;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Channel name validation and quoting for PostgreSQL {@code LISTEN}.
 *
 * <p>Channel names are identifiers. The server truncates identifiers longer than
 * {@value #MAX_IDENTIFIER_BYTES} bytes without failing, after which incoming notifications
 * would carry a name no handler is registered under, so such names are rejected up front.
 */
public final class ChannelNames {
  /** PostgreSQL's {@code NAMEDATALEN - 1}. */
  public static final int MAX_IDENTIFIER_BYTES = 63;

  private ChannelNames() {}

  /**
   * @param channel channel name
   * @return {@code channel}, unchanged
   * @throws IllegalArgumentException if the name is empty, contains NUL, or is too long
   */
  public static String validate(String channel) {
    Objects.requireNonNull(channel, "channel");
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("Channel name must not be empty");
    }
    if (channel.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("Channel name must not contain NUL: " + channel);
    }
    int bytes = channel.getBytes(StandardCharsets.UTF_8).length;
    if (bytes > MAX_IDENTIFIER_BYTES) {
      throw new IllegalArgumentException("Channel name exceeds " + MAX_IDENTIFIER_BYTES
          + " bytes (" + bytes + "): " + channel);
    }
    return channel;
  }

  /**
   * Quotes {@code channel} as a delimited identifier, doubling embedded quotes.
   * Case is preserved, so {@code "Orders"} and {@code "orders"} stay distinct channels.
   */
  public static String quote(String channel) {
    return '"' + validate(channel).replace("\"", "\"\"") + '"';
  }
}
