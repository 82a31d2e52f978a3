package io.pglisten.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.pglisten.micrometer.MicrometerMetricsExporter;
import io.pglisten.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code pglisten.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link PgListenAutoConfiguration} so the exporter is injected into the
 * listener.
 */
@AutoConfiguration(before = PgListenAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "pglisten.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PgListenProperties.class)
public class PgListenMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter pgListenMetricsExporter(MeterRegistry meterRegistry,
      PgListenProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
