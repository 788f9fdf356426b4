package io.clype.reactorinstances.service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.clype.reactorinstances.concurrency.InstanceSchedulers;
import io.clype.reactorinstances.metrics.InstanceWriterMetrics;
import io.clype.reactorinstances.model.ApplyOptions;
import io.clype.reactorinstances.model.CompoundInstanceException;
import io.clype.reactorinstances.model.InstanceApply;
import io.clype.reactorinstances.model.InstanceApplyResult;
import io.clype.reactorinstances.model.InstanceId;
import io.clype.reactorinstances.transport.CredentialProvider;
import io.clype.reactorinstances.transport.InstancesTransport;
import io.micrometer.core.instrument.MeterRegistry;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Bulk upsert and delete of nodes and edges.
 *
 * <p>The input is cut into requests no larger than the endpoint's item limit, which are sent
 * concurrently on the process-wide pools of {@link InstanceSchedulers}. Requests that hit a
 * rate limit or a transient server error are halved and retried (see
 * {@link SplitRetryExecutor}).</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * BulkInstanceWriter writer = new BulkInstanceWriter(
 *     new JdkHttpTransport(URI.create("https://api.example.com/api/v1/projects/plant"), Duration.ofSeconds(30)),
 *     BearerTokenCredentialProvider.ofToken(token),
 *     WriterSettings.defaults());
 *
 * try {
 *     List<InstanceApplyResult> written = writer.applyFast(instances);
 * } catch (CompoundInstanceException e) {
 *     List<InstanceId> retry = List.copyOf(e.getFailed().keySet());
 * }
 * }</pre>
 *
 * <p><b>Error Handling:</b> A call either returns a result for every confirmed item or throws a
 * single {@link CompoundInstanceException} that accounts for every item: the failed ones with
 * their error and the successful ones with their result.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Each call owns its own headers and retry
 * state; only the worker pools are shared.</p>
 */
public class BulkInstanceWriter {

    private static final Logger log = LoggerFactory.getLogger(BulkInstanceWriter.class);

    public static final String APPLY_PATH = "/models/instances";
    public static final String DELETE_PATH = "/models/instances/delete";

    private final InstancesTransport transport;
    private final CredentialProvider credentials;
    private final WriterSettings settings;
    private final PayloadEncoder encoder;
    private final InstanceWriterMetrics applyMetrics;
    private final InstanceWriterMetrics deleteMetrics;

    public BulkInstanceWriter(InstancesTransport transport, CredentialProvider credentials, WriterSettings settings) {
        this(transport, credentials, settings, new ObjectMapper(), null);
    }

    /**
     * Creates a new BulkInstanceWriter.
     *
     * @param transport     sends requests; must not retry by itself
     * @param credentials   provides and refreshes the authorization header
     * @param settings      limits, concurrency and retry budget
     * @param objectMapper  JSON mapper for request bodies and responses
     * @param meterRegistry optional registry for {@link InstanceWriterMetrics} (may be null)
     */
    public BulkInstanceWriter(
            InstancesTransport transport,
            CredentialProvider credentials,
            WriterSettings settings,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.encoder = new PayloadEncoder(Objects.requireNonNull(objectMapper, "objectMapper cannot be null"),
                settings.compressPayload());
        this.applyMetrics = meterRegistry == null ? null : new InstanceWriterMetrics(meterRegistry, "apply");
        this.deleteMetrics = meterRegistry == null ? null : new InstanceWriterMetrics(meterRegistry, "delete");
    }

    // ==========================================================================
    // Upsert
    // ==========================================================================

    public List<InstanceApplyResult> applyFast(List<InstanceApply> items) {
        return applyFast(items, ApplyOptions.defaults());
    }

    /**
     * Upserts nodes and edges, blocking until every item is resolved.
     *
     * @param items   the instances to write; an empty list returns immediately without a request
     * @param options request-level flags
     * @return one result per written instance, in no particular order across requests
     * @throws CompoundInstanceException if any item failed
     */
    public List<InstanceApplyResult> applyFast(List<InstanceApply> items, ApplyOptions options) {
        return applyFastAsync(items, options).block();
    }

    /**
     * Reactive form of {@link #applyFast(List, ApplyOptions)}.
     *
     * @param items   the instances to write
     * @param options request-level flags
     * @return a Mono of the results, or a {@link CompoundInstanceException} error
     */
    public Mono<List<InstanceApplyResult>> applyFastAsync(List<InstanceApply> items, ApplyOptions options) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        return run(APPLY_PATH, items, settings.createLimit(), InstanceApply::toPayload, options.toParameters(),
                InstanceSchedulers.writeScheduler(), InstanceSchedulers.MAX_WRITE_WORKERS, applyMetrics,
                InstanceApply::id, InstanceApplyResult::fromJson);
    }

    // ==========================================================================
    // Delete
    // ==========================================================================

    /**
     * Deletes nodes and edges, blocking until every item is resolved.
     *
     * @param ids the identities to delete; an empty list returns immediately without a request
     * @return the identities the server confirmed as deleted
     * @throws CompoundInstanceException if any item failed
     */
    public List<InstanceId> deleteFast(List<InstanceId> ids) {
        return deleteFastAsync(ids).block();
    }

    /**
     * Reactive form of {@link #deleteFast(List)}.
     *
     * @param ids the identities to delete
     * @return a Mono of the deleted identities, or a {@link CompoundInstanceException} error
     */
    public Mono<List<InstanceId>> deleteFastAsync(List<InstanceId> ids) {
        Objects.requireNonNull(ids, "ids cannot be null");
        return run(DELETE_PATH, ids, settings.deleteLimit(), InstanceId::toJson, Map.of(),
                InstanceSchedulers.deleteScheduler(), InstanceSchedulers.MAX_DELETE_WORKERS, deleteMetrics,
                id -> id, InstanceId::fromJson);
    }

    // ==========================================================================
    // Shared pipeline
    // ==========================================================================

    private <T, R> Mono<List<R>> run(
            String endpointPath,
            List<T> items,
            int limit,
            Function<? super T, ?> itemMapper,
            Map<String, Object> parameters,
            Scheduler scheduler,
            int ceiling,
            InstanceWriterMetrics metrics,
            Function<? super T, InstanceId> idOf,
            Function<JsonNode, R> decodeResult) {
        if (items.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.defer(() -> {
            List<InstanceTask<T>> tasks = ItemChunker.chunk(endpointPath, items, limit, settings.backoffPolicy());
            int concurrency = InstanceSchedulers.effectiveConcurrency(settings.maxWorkers(), ceiling);
            SplitRetryExecutor<T> executor = new SplitRetryExecutor<>(transport, credentials, encoder,
                    newHeaders(), itemMapper, parameters, scheduler, metrics);

            log.debug("Sending {} items to {} in {} requests, {} at a time",
                    items.size(), endpointPath, tasks.size(), concurrency);

            return TaskSummary.run(tasks, executor::execute, concurrency)
                    .map(summary -> {
                        summary.raiseCompoundExceptionIfFailedTasks(TaskOutcome::items, idOf, decodeResult);
                        return summary.joinedResults(decodeResult);
                    });
        });
    }

    private Map<String, String> newHeaders() {
        Map<String, String> headers = new ConcurrentHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        if (encoder.isCompressing()) {
            headers.put("Content-Encoding", "gzip");
        }
        credentials.refreshHeader(headers);
        return headers;
    }
}
