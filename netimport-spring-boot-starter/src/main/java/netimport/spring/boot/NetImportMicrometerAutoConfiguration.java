package netimport.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import netimport.micrometer.MicrometerMetricsExporter;
import netimport.spi.MetricsExporter;

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
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code netimport.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link NetImportAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link netimport.NetImport} composite.
 */
@AutoConfiguration(before = NetImportAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "netimport.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(NetImportProperties.class)
public class NetImportMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  @ConditionalOnBean(MeterRegistry.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, NetImportProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
