package io.pglisten.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.pglisten.ChannelEvent;
import io.pglisten.ChannelHandler;
import io.pglisten.ChannelRegistration;
import io.pglisten.ConnectionState;
import io.pglisten.ListenPolicy;
import io.pglisten.ListenerRun;
import io.pglisten.Notification;
import io.pglisten.NotificationListener;
import io.pglisten.NotificationTimeout;
import io.pglisten.SubscribeException;
import io.pglisten.TimeoutSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

@DockerAvailable
@Testcontainers
class PostgresNotificationIntegrationTest {

  private static final Duration WAIT = Duration.ofSeconds(10);

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("pglisten_test");

  private static SimpleDataSource dataSource;
  private final List<ListenerRun> runs = new ArrayList<>();

  @BeforeAll
  static void initDataSource() {
    dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
  }

  @AfterEach
  void cancelRuns() {
    runs.forEach(ListenerRun::cancel);
  }

  private ListenerRun start(DataSource source, List<ChannelRegistration> registrations,
      NotificationTimeout timeout) {
    NotificationListener listener = NotificationListener.builder()
        .connectionFactory(new DataSourceConnectionFactory(source))
        .reconnectPolicy(attempts -> 100)
        .pollInterval(Duration.ofMillis(100))
        .build();
    ListenerRun run = listener.run(registrations, timeout);
    runs.add(run);
    return run;
  }

  private static void notify(String channel, String payload) throws Exception {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement("SELECT pg_notify(?, ?)")) {
      ps.setString(1, channel);
      ps.setString(2, payload);
      ps.execute();
    }
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + WAIT.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Condition not met within " + WAIT);
      }
      Thread.sleep(20);
    }
  }

  static final class Recorder implements ChannelHandler {
    final List<ChannelEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(ChannelEvent event) {
      events.add(event);
    }

    List<String> payloads() {
      List<String> result = new ArrayList<>();
      for (ChannelEvent event : events) {
        if (event instanceof Notification n) {
          result.add(n.payload());
        }
      }
      return result;
    }
  }

  @Test
  void deliversNotifyTrafficPerChannel() throws Exception {
    Recorder orders = new Recorder();
    Recorder invoices = new Recorder();
    ListenerRun run = start(dataSource, List.of(
        ChannelRegistration.all("orders", orders),
        ChannelRegistration.all("Invoices", invoices)), NotificationTimeout.NONE);
    await(() -> run.connectionState() == ConnectionState.LISTENING);

    notify("orders", "1");
    notify("Invoices", "a");
    notify("orders", "2");
    notify("invoices", "wrong-case");

    await(() -> orders.events.size() == 2 && invoices.events.size() == 1);
    assertEquals(List.of("1", "2"), orders.payloads());
    assertEquals(List.of("a"), invoices.payloads());
  }

  @Test
  void emptyPayloadArrivesAsEmptyString() throws Exception {
    Recorder recorder = new Recorder();
    ListenerRun run = start(dataSource, List.of(ChannelRegistration.all("bare", recorder)),
        NotificationTimeout.NONE);
    await(() -> run.connectionState() == ConnectionState.LISTENING);

    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("NOTIFY bare");
    }

    await(() -> recorder.events.size() == 1);
    assertEquals(List.of(""), recorder.payloads());
  }

  @Test
  void silentChannelReceivesTimeouts() throws Exception {
    Recorder recorder = new Recorder();
    start(dataSource, List.of(ChannelRegistration.all("quiet", recorder)), NotificationTimeout.ofMillis(200));

    await(() -> recorder.events.size() >= 2);
    assertEquals(new TimeoutSignal("quiet"), recorder.events.get(0));
  }

  @Test
  void reconnectsAfterBackendIsTerminated() throws Exception {
    Recorder recorder = new Recorder();
    ListenerRun run = start(dataSource, List.of(ChannelRegistration.last("resilient", recorder)),
        NotificationTimeout.NONE);
    await(() -> run.connectionState() == ConnectionState.LISTENING);
    notify("resilient", "before");
    await(() -> recorder.events.size() == 1);
    Set<Integer> killed = listenerPids();
    assertEquals(1, killed.size());

    terminate(killed);

    await(() -> {
      Set<Integer> current = listenerPids();
      return current.size() == 1 && !current.containsAll(killed)
          && run.connectionState() == ConnectionState.LISTENING;
    });
    notify("resilient", "after");

    await(() -> recorder.events.size() == 2);
    assertEquals(List.of("before", "after"), recorder.payloads());
    assertFalse(run.isDone());
  }

  @Test
  void overlongChannelFailsRunWithoutConnecting() throws Exception {
    int openedBefore = dataSource.opened.get();
    ListenerRun run = start(dataSource, List.of(ChannelRegistration.all("c".repeat(64), new Recorder())),
        NotificationTimeout.NONE);

    assertThrows(SubscribeException.class, () -> run.await(WAIT));
    assertEquals(openedBefore, dataSource.opened.get());
  }

  @Test
  void pooledConnectionIsReturnedUnsubscribed() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(postgres.getJdbcUrl());
    config.setUsername(postgres.getUsername());
    config.setPassword(postgres.getPassword());
    config.setMaximumPoolSize(1);
    config.setPoolName("pglisten-test-pool");

    try (HikariDataSource pool = new HikariDataSource(config)) {
      ListenerRun run = start(pool, List.of(ChannelRegistration.all("pooled", new Recorder())),
          NotificationTimeout.NONE);
      await(() -> run.connectionState() == ConnectionState.LISTENING);

      run.cancel();

      try (Connection conn = pool.getConnection();
           Statement st = conn.createStatement();
           ResultSet rs = st.executeQuery("SELECT count(*) FROM pg_listening_channels()")) {
        assertTrue(rs.next());
        assertEquals(0, rs.getInt(1));
      }
    }
  }

  @Test
  void mapEntryPointUsesOnePolicyForAllChannels() throws Exception {
    Recorder recorder = new Recorder();
    NotificationListener listener = NotificationListener.builder()
        .connectionFactory(new DataSourceConnectionFactory(dataSource))
        .pollInterval(Duration.ofMillis(100))
        .build();
    ListenerRun run = listener.run(Map.of("bulk", recorder), ListenPolicy.ALL, NotificationTimeout.NONE);
    runs.add(run);
    await(() -> run.connectionState() == ConnectionState.LISTENING);

    for (int i = 0; i < 50; i++) {
      notify("bulk", String.valueOf(i));
    }

    await(() -> recorder.events.size() == 50);
    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      expected.add(String.valueOf(i));
    }
    assertEquals(expected, recorder.payloads());
  }

  private static void terminate(Set<Integer> pids) throws Exception {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement("SELECT pg_terminate_backend(?)")) {
      for (int pid : pids) {
        ps.setInt(1, pid);
        ps.execute();
      }
    }
  }

  /** Backends whose most recent statement was a LISTEN, i.e. live listener sessions. */
  private static Set<Integer> listenerPids() {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT pid FROM pg_stat_activity"
             + " WHERE query LIKE 'LISTEN%' AND pid <> pg_backend_pid()")) {
      Set<Integer> pids = new HashSet<>();
      while (rs.next()) {
        pids.add(rs.getInt(1));
      }
      return pids;
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }
}
