package uibridge.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import uibridge.micrometer.MicrometerMetricsExporter;
import uibridge.spi.MetricsExporter;

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
 * {@link MeterRegistry} bean exists and {@code uibridge.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link UiBridgeAutoConfiguration} so the {@link MetricsExporter} bean is
 * available for injection into the pipeline. The pipeline closes the exporter, which removes
 * its meters.
 */
@AutoConfiguration(before = UiBridgeAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "uibridge.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(UiBridgeProperties.class)
public class UiBridgeMicrometerAutoConfiguration {

  @Bean(destroyMethod = "")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, UiBridgeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
