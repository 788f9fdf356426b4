package io.clype.reactorinstances.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.clype.reactorinstances.retry.BackoffPolicy;
import io.clype.reactorinstances.service.WriterSettings;

/**
 * Configuration properties for the bulk instance writer.
 *
 * <p>These properties are bound to the {@code instances.writer} prefix in your
 * application configuration.</p>
 *
 * <p><b>Example Configuration (application.yml):</b></p>
 * <pre>{@code
 * instances:
 *   writer:
 *     base-url: https://api.example.com/api/v1/projects/my-project
 *     token: ${API_TOKEN}
 *     timeout: 30s
 *     create-limit: 1000
 *     delete-limit: 1000
 *     max-workers: 4
 *     compress-payload: true
 *     concurrency-enabled: true
 *     retry:
 *       backoff-factor: 0.5
 *       max-backoff: 60s
 *       max-retries-per-category: 10
 *       jitter: true
 *     metrics:
 *       enabled: true
 * }</pre>
 *
 * @see InstanceWriterAutoConfiguration
 */
@ConfigurationProperties(prefix = "instances.writer")
public class InstanceWriterProperties {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private String baseUrl;
    private String token;
    private Duration timeout = DEFAULT_TIMEOUT;
    private int createLimit = WriterSettings.DEFAULT_CREATE_LIMIT;
    private int deleteLimit = WriterSettings.DEFAULT_DELETE_LIMIT;
    private int maxWorkers = WriterSettings.DEFAULT_MAX_WORKERS;
    private boolean compressPayload = true;
    private boolean concurrencyEnabled = true;
    private RetryConfig retry = new RetryConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public int getCreateLimit() { return createLimit; }
    public void setCreateLimit(int createLimit) { this.createLimit = createLimit; }

    public int getDeleteLimit() { return deleteLimit; }
    public void setDeleteLimit(int deleteLimit) { this.deleteLimit = deleteLimit; }

    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

    public boolean isCompressPayload() { return compressPayload; }
    public void setCompressPayload(boolean compressPayload) { this.compressPayload = compressPayload; }

    public boolean isConcurrencyEnabled() { return concurrencyEnabled; }
    public void setConcurrencyEnabled(boolean concurrencyEnabled) { this.concurrencyEnabled = concurrencyEnabled; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Converts the bound values into writer settings.
     *
     * @return the settings
     * @throws IllegalArgumentException if a value is out of range
     */
    public WriterSettings toWriterSettings() {
        BackoffPolicy policy = new BackoffPolicy(retry.getBackoffFactor(), retry.getMaxBackoff(),
                retry.getMaxRetriesPerCategory(), retry.isJitter());
        return new WriterSettings(createLimit, deleteLimit, maxWorkers, policy, compressPayload);
    }

    /** Retry budget and backoff. */
    public static class RetryConfig {
        private double backoffFactor = BackoffPolicy.DEFAULT_BACKOFF_FACTOR;
        private Duration maxBackoff = BackoffPolicy.DEFAULT_MAX_BACKOFF;
        private int maxRetriesPerCategory = BackoffPolicy.DEFAULT_MAX_RETRIES_PER_CATEGORY;
        private boolean jitter = true;

        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        public int getMaxRetriesPerCategory() { return maxRetriesPerCategory; }
        public void setMaxRetriesPerCategory(int maxRetriesPerCategory) { this.maxRetriesPerCategory = maxRetriesPerCategory; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    /** Metrics configuration. */
    public static class MetricsConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
