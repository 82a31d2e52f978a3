/**
 * Service provider interfaces: the notification transport
 * ({@link io.pglisten.spi.NotificationConnectionFactory},
 * {@link io.pglisten.spi.NotificationConnection}), the connector's output
 * ({@link io.pglisten.spi.NotificationSink}) and metrics
 * ({@link io.pglisten.spi.MetricsExporter}).
 */
package io.pglisten.spi;
