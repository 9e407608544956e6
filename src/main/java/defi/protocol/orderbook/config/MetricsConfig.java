package defi.protocol.orderbook.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics configuration for Prometheus monitoring
 */
@Slf4j
@Configuration
public class MetricsConfig {

    /**
     * Common tags added to every metric published
     */
    @Bean
    public List<Tag> commonTags(@Value("${spring.application.name:hybrid-order-book}") String applicationName) {
        return List.of(
            Tag.of("service", applicationName),
            Tag.of("component", "matching-engine")
        );
    }

    @Bean
    public MeterBinder commonTagsBinder(List<Tag> commonTags) {
        return (MeterRegistry registry) -> {
            registry.config().commonTags(commonTags);
            log.info("Registered common metric tags: {}", commonTags);
        };
    }
}
