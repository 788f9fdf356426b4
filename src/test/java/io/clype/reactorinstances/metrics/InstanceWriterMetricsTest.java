package io.clype.reactorinstances.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.reactorinstances.retry.FailureCategory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class InstanceWriterMetricsTest {

    private SimpleMeterRegistry registry;
    private InstanceWriterMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new InstanceWriterMetrics(registry, "apply");
    }

    @Test
    void shouldRecordRequestsAndLatency() {
        metrics.recordRequest(5_000_000L);
        metrics.recordRequest(3_000_000L);

        assertEquals(2.0, registry.counter("instances.writer.requests.sent", "operation", "apply").count());
        assertEquals(2, registry.get("instances.writer.request.latency").timer().count());
    }

    @Test
    void shouldRecordItemOutcomes() {
        metrics.recordSuccess(500);
        metrics.recordFailure(3);

        assertEquals(500.0, registry.counter("instances.writer.items.succeeded", "operation", "apply").count());
        assertEquals(3.0, registry.counter("instances.writer.items.failed", "operation", "apply").count());
        assertEquals(1.0, registry.counter("instances.writer.requests.failed", "operation", "apply").count());
    }

    @Test
    void shouldTagRetriesByCategory() {
        metrics.recordRetry(FailureCategory.READ);
        metrics.recordRetry(FailureCategory.READ);
        metrics.recordRetry(FailureCategory.STATUS);
        metrics.recordSplit();

        assertEquals(2.0, registry.counter("instances.writer.retries", "operation", "apply", "category", "read").count());
        assertEquals(1.0, registry.counter("instances.writer.retries", "operation", "apply", "category", "status").count());
        assertEquals(0.0, registry.counter("instances.writer.retries", "operation", "apply", "category", "connect").count());
        assertEquals(1.0, registry.counter("instances.writer.tasks.split", "operation", "apply").count());
    }

    @Test
    void shouldTrackActiveRequests() {
        assertEquals(0.0, registry.get("instances.writer.requests.active").gauge().value());

        metrics.incrementActiveRequests();
        metrics.incrementActiveRequests();
        assertEquals(2.0, registry.get("instances.writer.requests.active").gauge().value());

        metrics.decrementActiveRequests();
        assertEquals(1.0, registry.get("instances.writer.requests.active").gauge().value());
    }

    @Test
    void shouldShareActiveGaugeBetweenInstancesOfSameOperation() {
        InstanceWriterMetrics second = new InstanceWriterMetrics(registry, "apply");

        second.incrementActiveRequests();
        assertEquals(1.0, registry.get("instances.writer.requests.active").tag("operation", "apply").gauge().value());

        metrics.incrementActiveRequests();
        second.decrementActiveRequests();
        assertEquals(1.0, registry.get("instances.writer.requests.active").tag("operation", "apply").gauge().value());
    }

    @Test
    void shouldNotShareActiveGaugeAcrossRegistries() {
        SimpleMeterRegistry other = new SimpleMeterRegistry();
        InstanceWriterMetrics elsewhere = new InstanceWriterMetrics(other, "apply");

        elsewhere.incrementActiveRequests();

        assertEquals(1.0, other.get("instances.writer.requests.active").gauge().value());
        assertEquals(0.0, registry.get("instances.writer.requests.active").gauge().value());
    }

    @Test
    void shouldKeepOperationsApart() {
        InstanceWriterMetrics delete = new InstanceWriterMetrics(registry, "delete");

        delete.recordSuccess(7);

        assertEquals(7.0, registry.counter("instances.writer.items.succeeded", "operation", "delete").count());
        assertEquals(0.0, registry.counter("instances.writer.items.succeeded", "operation", "apply").count());
    }
}
