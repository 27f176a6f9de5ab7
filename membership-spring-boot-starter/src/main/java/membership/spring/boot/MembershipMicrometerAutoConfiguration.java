package membership.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import membership.micrometer.MicrometerMetricsExporter;
import membership.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code membership.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link MembershipAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the {@link membership.MembershipManager}.
 */
@AutoConfiguration(before = MembershipAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "membership.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MembershipProperties.class)
public class MembershipMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MembershipProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
