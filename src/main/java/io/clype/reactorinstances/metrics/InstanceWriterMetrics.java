package io.clype.reactorinstances.metrics;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.MapMaker;

import io.clype.reactorinstances.retry.FailureCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters of one writer operation ({@code apply} or {@code delete}).
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code instances.writer.requests.sent} - requests issued, including retries</li>
 *   <li>{@code instances.writer.requests.failed} - tasks that ended in a terminal error</li>
 *   <li>{@code instances.writer.tasks.split} - tasks halved after a rate-limit or server error</li>
 *   <li>{@code instances.writer.retries} - retries in place, tagged with {@code category}</li>
 *   <li>{@code instances.writer.items.succeeded} - items confirmed by the server</li>
 *   <li>{@code instances.writer.items.failed} - items of failed tasks</li>
 *   <li>{@code instances.writer.request.latency} - round trip of a single request</li>
 *   <li>{@code instances.writer.requests.active} - requests in flight</li>
 * </ul>
 *
 * <p>All meters carry the {@code operation} tag. Meters are shared by every instance created
 * for the same registry and operation, the in-flight gauge included.</p>
 */
public class InstanceWriterMetrics {

    private static final String METRIC_PREFIX = "instances.writer";
    private static final double[] LATENCY_PERCENTILES = {0.5, 0.95, 0.99};

    /** In-flight counters per registry (weakly held) and operation; one gauge reads each. */
    private static final ConcurrentMap<MeterRegistry, ConcurrentMap<String, AtomicInteger>> ACTIVE_REQUESTS =
            new MapMaker().weakKeys().makeMap();

    private final Counter requestsSent;
    private final Counter requestsFailed;
    private final Counter tasksSplit;
    private final Map<FailureCategory, Counter> retries;
    private final Counter itemsSucceeded;
    private final Counter itemsFailed;
    private final Timer requestLatency;
    private final AtomicInteger activeRequests;

    /**
     * @param registry  the Micrometer registry to register meters with
     * @param operation {@code apply} or {@code delete}
     */
    public InstanceWriterMetrics(MeterRegistry registry, String operation) {
        String operationTag = operation == null || operation.isEmpty() ? "unknown" : operation;
        Tags tags = Tags.of("operation", operationTag);

        this.requestsSent = Counter.builder(METRIC_PREFIX + ".requests.sent")
                .description("Requests sent to the instances API, retries included")
                .tags(tags)
                .register(registry);

        this.requestsFailed = Counter.builder(METRIC_PREFIX + ".requests.failed")
                .description("Tasks that ended in a terminal error")
                .tags(tags)
                .register(registry);

        this.tasksSplit = Counter.builder(METRIC_PREFIX + ".tasks.split")
                .description("Tasks halved after a rate-limit or server error")
                .tags(tags)
                .register(registry);

        this.retries = new EnumMap<>(FailureCategory.class);
        for (FailureCategory category : FailureCategory.values()) {
            retries.put(category, Counter.builder(METRIC_PREFIX + ".retries")
                    .description("Requests resubmitted without splitting")
                    .tags(tags.and("category", category.name().toLowerCase()))
                    .register(registry));
        }

        this.itemsSucceeded = Counter.builder(METRIC_PREFIX + ".items.succeeded")
                .description("Items confirmed by the instances API")
                .tags(tags)
                .register(registry);

        this.itemsFailed = Counter.builder(METRIC_PREFIX + ".items.failed")
                .description("Items of tasks that failed")
                .tags(tags)
                .register(registry);

        this.requestLatency = Timer.builder(METRIC_PREFIX + ".request.latency")
                .description("Round trip of a single request")
                .tags(tags)
                .publishPercentiles(LATENCY_PERCENTILES)
                .register(registry);

        this.activeRequests = ACTIVE_REQUESTS
                .computeIfAbsent(registry, r -> new ConcurrentHashMap<>())
                .computeIfAbsent(operationTag, op -> new AtomicInteger(0));
        Gauge.builder(METRIC_PREFIX + ".requests.active", activeRequests, AtomicInteger::get)
                .description("Requests in flight")
                .tags(tags)
                .register(registry);
    }

    public void recordRequest(long latencyNanos) {
        requestsSent.increment();
        requestLatency.record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    public void recordSuccess(int itemCount) {
        itemsSucceeded.increment(itemCount);
    }

    public void recordFailure(int itemCount) {
        requestsFailed.increment();
        itemsFailed.increment(itemCount);
    }

    public void recordSplit() {
        tasksSplit.increment();
    }

    public void recordRetry(FailureCategory category) {
        retries.get(category).increment();
    }

    public void incrementActiveRequests() {
        activeRequests.incrementAndGet();
    }

    public void decrementActiveRequests() {
        activeRequests.decrementAndGet();
    }
}
