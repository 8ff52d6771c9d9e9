package io.clype.reactoramqp.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import io.clype.reactoramqp.metrics.AmqpClientMetrics;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Auto-configuration for AMQP client metrics.
 *
 * <p>This configuration is automatically enabled when:</p>
 * <ul>
 *   <li>Micrometer is on the classpath</li>
 *   <li>A {@link MeterRegistry} bean exists</li>
 *   <li>The {@code amqp.client.metrics.enabled} property is true (default)</li>
 * </ul>
 *
 * <p>Runs before {@link AmqpClientAutoConfiguration} so that the shared RPC client picks
 * the metrics up.</p>
 *
 * @see AmqpClientMetrics
 */
@AutoConfiguration(before = AmqpClientAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "amqp.client.metrics", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class AmqpClientMetricsAutoConfiguration {

    /**
     * Creates the AMQP client metrics bean.
     *
     * @param registry the Micrometer meter registry
     * @return the configured metrics instance
     */
    @Bean
    @ConditionalOnMissingBean
    public AmqpClientMetrics amqpClientMetrics(MeterRegistry registry) {
        return new AmqpClientMetrics(registry);
    }
}
