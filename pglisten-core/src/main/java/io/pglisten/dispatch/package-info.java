/**
 * Per-channel fan-out.
 *
 * <p>{@link io.pglisten.dispatch.NotificationDispatcher} routes the connector's stream into one
 * buffer per channel (unbounded FIFO for {@code ALL}, a single overwritable slot for
 * {@code LAST}) and runs one delivery loop per channel with a bounded wait, so a slow or
 * failing handler only ever affects its own channel.
 *
 * @see io.pglisten.dispatch.NotificationDispatcher
 * @see io.pglisten.dispatch.NotificationStream
 */
package io.pglisten.dispatch;
