package syncengine.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import syncengine.micrometer.MicrometerMetricsExporter;
import syncengine.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SyncMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("sync.metrics.name-prefix=planning.sync").run(ctx -> {
            assertNotNull(ctx.getBean(MicrometerMetricsExporter.class));
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("planning.sync.events.enqueued").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("sync.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void notCreatedWithoutMeterRegistry() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SyncMicrometerAutoConfiguration.class))
            .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
