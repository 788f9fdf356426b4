package io.clype.reactorinstances;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import io.clype.reactorinstances.concurrency.InstanceSchedulers;
import io.clype.reactorinstances.config.InstanceWriterAutoConfiguration;
import io.clype.reactorinstances.config.InstanceWriterProperties;
import io.clype.reactorinstances.service.BulkInstanceWriter;
import io.clype.reactorinstances.service.WriterSettings;
import io.clype.reactorinstances.transport.CredentialProvider;
import io.clype.reactorinstances.transport.InstancesTransport;
import io.clype.reactorinstances.transport.JdkHttpTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.assertj.core.api.Assertions.assertThat;

class LibrarySmokeTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(InstanceWriterAutoConfiguration.class))
            .withPropertyValues("instances.writer.token=secret");

    @AfterEach
    void tearDown() {
        InstanceSchedulers.setConcurrencyEnabled(true);
    }

    @Test
    void testAutoConfigurationWithoutBaseUrl() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(BulkInstanceWriter.class);
        });
    }

    @Test
    void testAutoConfigurationWithProperties() {
        contextRunner
                .withPropertyValues("instances.writer.base-url=https://api.example.com/api/v1/projects/plant")
                .run(context -> {
                    assertThat(context).hasSingleBean(BulkInstanceWriter.class);
                    assertThat(context).hasSingleBean(CredentialProvider.class);
                    assertThat(context).getBean(InstancesTransport.class).isInstanceOf(JdkHttpTransport.class);

                    InstanceWriterProperties properties = context.getBean(InstanceWriterProperties.class);
                    assertThat(properties.getTimeout()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(properties.getCreateLimit()).isEqualTo(1000);
                    assertThat(properties.getDeleteLimit()).isEqualTo(1000);
                    assertThat(properties.getMaxWorkers()).isEqualTo(4);
                    assertThat(properties.isCompressPayload()).isTrue();
                    assertThat(properties.getRetry().getBackoffFactor()).isEqualTo(0.5);
                    assertThat(properties.getRetry().getMaxBackoff()).isEqualTo(Duration.ofSeconds(60));
                    assertThat(properties.getRetry().getMaxRetriesPerCategory()).isEqualTo(10);
                    assertThat(properties.getRetry().isJitter()).isTrue();
                    assertThat(properties.getMetrics().isEnabled()).isTrue();
                });
    }

    @Test
    void testCustomProperties() {
        contextRunner
                .withPropertyValues(
                        "instances.writer.base-url=https://api.example.com/api/v1/projects/plant",
                        "instances.writer.create-limit=500",
                        "instances.writer.max-workers=2",
                        "instances.writer.compress-payload=false",
                        "instances.writer.retry.backoff-factor=0.1",
                        "instances.writer.retry.max-backoff=5s",
                        "instances.writer.retry.max-retries-per-category=3",
                        "instances.writer.retry.jitter=false")
                .run(context -> {
                    WriterSettings settings = context.getBean(InstanceWriterProperties.class).toWriterSettings();
                    assertThat(settings.createLimit()).isEqualTo(500);
                    assertThat(settings.maxWorkers()).isEqualTo(2);
                    assertThat(settings.compressPayload()).isFalse();
                    assertThat(settings.backoffPolicy().maxBackoff()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(settings.backoffPolicy().maxRetriesPerCategory()).isEqualTo(3);
                    assertThat(settings.backoffPolicy().jitter()).isFalse();
                });
    }

    @Test
    void testInvalidLimitFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "instances.writer.base-url=https://api.example.com/api/v1/projects/plant",
                        "instances.writer.delete-limit=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void testConcurrencyDisabledByProperty() {
        contextRunner
                .withPropertyValues(
                        "instances.writer.base-url=https://api.example.com/api/v1/projects/plant",
                        "instances.writer.concurrency-enabled=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(BulkInstanceWriter.class);
                    assertThat(InstanceSchedulers.isConcurrencyEnabled()).isFalse();
                });
    }

    @Test
    void testCustomCredentialProviderIsUsed() {
        CredentialProvider custom = headers -> headers.put("Authorization", "Bearer rotated");
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(InstanceWriterAutoConfiguration.class))
                .withBean(CredentialProvider.class, () -> custom)
                .withPropertyValues("instances.writer.base-url=https://api.example.com/api/v1/projects/plant")
                .run(context -> {
                    assertThat(context).hasSingleBean(BulkInstanceWriter.class);
                    assertThat(context.getBean(CredentialProvider.class)).isSameAs(custom);
                });
    }

    @Test
    void testMetricsRegisteredWithMeterRegistry() {
        contextRunner
                .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("instances.writer.base-url=https://api.example.com/api/v1/projects/plant")
                .run(context -> {
                    assertThat(context).hasSingleBean(BulkInstanceWriter.class);
                    SimpleMeterRegistry registry = context.getBean(SimpleMeterRegistry.class);
                    assertThat(registry.find("instances.writer.requests.sent").tag("operation", "apply").counter())
                            .isNotNull();
                });
    }

    @Test
    void testMetricsDisabledWhenPropertyFalse() {
        contextRunner
                .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues(
                        "instances.writer.base-url=https://api.example.com/api/v1/projects/plant",
                        "instances.writer.metrics.enabled=false")
                .run(context -> {
                    SimpleMeterRegistry registry = context.getBean(SimpleMeterRegistry.class);
                    assertThat(registry.find("instances.writer.requests.sent").counter()).isNull();
                });
    }
}
