package io.clype.reactorinstances.config;

import java.net.URI;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.clype.reactorinstances.concurrency.InstanceSchedulers;
import io.clype.reactorinstances.service.BulkInstanceWriter;
import io.clype.reactorinstances.transport.BearerTokenCredentialProvider;
import io.clype.reactorinstances.transport.CredentialProvider;
import io.clype.reactorinstances.transport.InstancesTransport;
import io.clype.reactorinstances.transport.JdkHttpTransport;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Spring Boot auto-configuration for the bulk instance writer.
 *
 * <p>This configuration is automatically enabled when the {@code instances.writer.base-url}
 * property is set in your application configuration.</p>
 *
 * <p><b>Bean Customization:</b> All beans created by this configuration use
 * {@code @ConditionalOnMissingBean}. Provide your own {@link CredentialProvider} to plug in a
 * token source that refreshes expiring tokens; the default one sends the static
 * {@code instances.writer.token}.</p>
 *
 * <p><b>Metrics:</b> When a {@link MeterRegistry} bean exists and
 * {@code instances.writer.metrics.enabled} is true (default), the writer registers
 * {@code instances.writer.*} meters.</p>
 *
 * @see InstanceWriterProperties
 * @see BulkInstanceWriter
 */
@AutoConfiguration
@EnableConfigurationProperties(InstanceWriterProperties.class)
@ConditionalOnProperty(prefix = "instances.writer", name = "base-url")
public class InstanceWriterAutoConfiguration {

    private final InstanceWriterProperties properties;

    public InstanceWriterAutoConfiguration(InstanceWriterProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the HTTP transport. One JDK HTTP client, without retries, serves every request.
     *
     * @return the transport
     */
    @Bean
    @ConditionalOnMissingBean
    public InstancesTransport instancesTransport() {
        return new JdkHttpTransport(URI.create(properties.getBaseUrl()), properties.getTimeout());
    }

    /**
     * Creates a credential provider for the static {@code instances.writer.token}.
     *
     * @return the credential provider
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "instances.writer", name = "token")
    public CredentialProvider instancesCredentialProvider() {
        return BearerTokenCredentialProvider.ofToken(properties.getToken());
    }

    /**
     * Creates the writer.
     *
     * @param transport     the transport to send requests with
     * @param credentials   the credential provider
     * @param objectMapper  the application's mapper, if any
     * @param meterRegistry the meter registry, if any
     * @return the configured writer
     */
    @Bean
    @ConditionalOnMissingBean
    public BulkInstanceWriter bulkInstanceWriter(
            InstancesTransport transport,
            CredentialProvider credentials,
            ObjectProvider<ObjectMapper> objectMapper,
            ObjectProvider<MeterRegistry> meterRegistry) {
        InstanceSchedulers.setConcurrencyEnabled(properties.isConcurrencyEnabled());
        MeterRegistry registry = properties.getMetrics().isEnabled() ? meterRegistry.getIfAvailable() : null;

        return new BulkInstanceWriter(
                transport,
                credentials,
                properties.toWriterSettings(),
                objectMapper.getIfAvailable(ObjectMapper::new),
                registry);
    }
}
