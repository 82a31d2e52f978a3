/**
 * Connection supervision.
 *
 * <p>{@link io.pglisten.connect.NotificationConnector} holds exactly one connection at a
 * time, subscribes it to the run's channel set and reconnects with
 * {@linkplain io.pglisten.connect.ExponentialBackoffReconnectPolicy jittered exponential backoff}
 * whenever the connection is lost.
 *
 * @see io.pglisten.connect.NotificationConnector
 * @see io.pglisten.connect.ReconnectPolicy
 */
package io.pglisten.connect;
