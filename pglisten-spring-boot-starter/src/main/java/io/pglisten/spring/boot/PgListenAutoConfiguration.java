package io.pglisten.spring.boot;

import io.pglisten.NotificationListener;
import io.pglisten.connect.ExponentialBackoffReconnectPolicy;
import io.pglisten.connect.ReconnectPolicy;
import io.pglisten.jdbc.DataSourceConnectionFactory;
import io.pglisten.spi.MetricsExporter;
import io.pglisten.spi.NotificationConnectionFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the notification listener.
 *
 * <p>Opens notification connections from the application's {@link DataSource}, collects
 * {@link ChannelListener} beans and runs them for the lifetime of the context.
 *
 * @see PgListenProperties
 * @see PgListenMicrometerAutoConfiguration
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@ConditionalOnClass(NotificationListener.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "pglisten", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PgListenProperties.class)
public class PgListenAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(NotificationConnectionFactory.class)
  public DataSourceConnectionFactory notificationConnectionFactory(DataSource dataSource) {
    return new DataSourceConnectionFactory(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ReconnectPolicy.class)
  public ExponentialBackoffReconnectPolicy reconnectPolicy(PgListenProperties props) {
    return new ExponentialBackoffReconnectPolicy(
        props.getReconnect().getBaseDelayMs(), props.getReconnect().getMaxDelayMs());
  }

  @Bean
  @ConditionalOnMissingBean
  public NotificationListener notificationListener(PgListenProperties props,
      NotificationConnectionFactory connectionFactory,
      ReconnectPolicy reconnectPolicy,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return NotificationListener.builder()
        .connectionFactory(connectionFactory)
        .reconnectPolicy(reconnectPolicy)
        .metrics(metricsProvider.getIfAvailable())
        .pollInterval(props.getPollInterval())
        .shutdownTimeout(props.getShutdownTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ChannelListenerRegistry channelListenerRegistry() {
    return new ChannelListenerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public ChannelListenerRegistrar channelListenerRegistrar(ListableBeanFactory beanFactory,
      ChannelListenerRegistry registry, PgListenProperties props) {
    return new ChannelListenerRegistrar(beanFactory, registry, props.getPolicy());
  }

  @Bean
  @ConditionalOnMissingBean
  public NotificationListenerLifecycle notificationListenerLifecycle(NotificationListener listener,
      ChannelListenerRegistry registry, PgListenProperties props) {
    return new NotificationListenerLifecycle(listener, registry, props.toNotificationTimeout());
  }
}
