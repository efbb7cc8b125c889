package notifier.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import notifier.micrometer.MicrometerMetricsExporter;
import notifier.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code notifier.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link NotifierAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the dispatcher, and after Actuator's meter registry
 * auto-configuration so a registry it contributes is visible to the condition.
 */
@AutoConfiguration(
    before = NotifierAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "notifier.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(NotifierProperties.class)
public class NotifierMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, NotifierProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
