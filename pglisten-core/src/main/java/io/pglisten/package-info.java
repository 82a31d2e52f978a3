/**
 * Root API for pglisten: a supervised, multi-channel PostgreSQL {@code LISTEN}/{@code NOTIFY}
 * consumer.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain io.pglisten.connect.NotificationConnector connector} owns one dedicated
 * connection, subscribes it to a fixed channel set and reconnects with jittered exponential
 * backoff whenever it is lost. Decoded {@link io.pglisten.Notification}s flow into the
 * {@linkplain io.pglisten.dispatch.NotificationDispatcher dispatcher}, which keeps one buffer and
 * one delivery thread per channel. A delivery thread waits up to the
 * {@link io.pglisten.NotificationTimeout} for the next notification and otherwise hands its
 * handler a {@link io.pglisten.TimeoutSignal}.
 *
 * <p>Delivery is at-most-once: {@code NOTIFY} is not persisted by the server, so notifications
 * sent while disconnected are lost. The steady cadence of timeout signals is what makes such
 * gaps visible.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>pglisten-core</b> - model, connector, dispatcher, SPIs (zero external deps)</li>
 *   <li><b>pglisten-jdbc</b> - PostgreSQL transport on pgjdbc</li>
 *   <li><b>pglisten-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>pglisten-spring-boot-starter</b> - auto-configuration and {@code @ChannelListener}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var listener = NotificationListener.builder()
 *     .connectionFactory(new DataSourceConnectionFactory(dataSource))
 *     .build();
 *
 * ListenerRun run = listener.run(List.of(
 *         ChannelRegistration.all("orders", event -> System.out.println(event)),
 *         ChannelRegistration.last("prices", event -> refreshPrices())),
 *     NotificationTimeout.of(Duration.ofSeconds(10)));
 *
 * // later
 * run.cancel();
 * }</pre>
 *
 * @see io.pglisten.NotificationListener
 * @see io.pglisten.ListenerRun
 * @see io.pglisten.ChannelHandler
 * @see io.pglisten.ListenPolicy
 */
package io.pglisten;
