package io.clype.reactorinstances.service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.Uninterruptibles;

import io.clype.reactorinstances.metrics.InstanceWriterMetrics;
import io.clype.reactorinstances.model.InstanceApiException;
import io.clype.reactorinstances.model.NoAccessException;
import io.clype.reactorinstances.retry.FailureCategory;
import io.clype.reactorinstances.retry.RetryTracker;
import io.clype.reactorinstances.service.PayloadEncoder.EncodedRequest;
import io.clype.reactorinstances.transport.ConnectionFailedException;
import io.clype.reactorinstances.transport.CredentialProvider;
import io.clype.reactorinstances.transport.InstancesTransport;
import io.clype.reactorinstances.transport.ReadTimeoutException;
import io.clype.reactorinstances.transport.TransportResponse;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * Sends one task and resolves it to leaf {@link TaskOutcome}s, splitting the task when the
 * backend pushes back.
 *
 * <p>Per attempt:</p>
 * <ul>
 *   <li><b>2xx:</b> success; the response {@code items} become the outcome's results.</li>
 *   <li><b>401:</b> {@link NoAccessException}, no retry.</li>
 *   <li><b>429, 502, 503, 504:</b> counted against the {@code STATUS} budget. Within budget a
 *       single-item task is resent as is, and a larger task is halved, each half getting its own
 *       copy of the tracker. One pause precedes both halves, which then run one after the
 *       other and concatenate their outcomes in half order. Out of budget the task fails with
 *       an {@link InstanceApiException} carrying the request payload.</li>
 *   <li><b>Read timeout / connection failure:</b> counted against {@code READ} / {@code CONNECT}
 *       and resent unchanged while within budget.</li>
 *   <li><b>Anything else:</b> the task fails immediately.</li>
 * </ul>
 *
 * <p>The recursion ends at single-item tasks. Copied trackers keep the parent's counters, so no
 * path through the split tree sees more than {@code maxRetriesPerCategory} status failures.</p>
 *
 * <p>Resending in place goes through a {@link Retry} spec driven by the task's
 * {@link RetryTracker}; splitting recurses into {@link #execute(InstanceTask)}. The credential
 * header is refreshed before every pause. The returned flux never signals an error: every
 * failure becomes a {@link TaskOutcome#failure(List, Throwable)} covering the items of the task
 * that failed.</p>
 *
 * <p>One executor serves one top-level call; {@code headers} is shared by all its tasks.</p>
 *
 * @param <T> item type
 */
public class SplitRetryExecutor<T> {

    private static final Logger log = LoggerFactory.getLogger(SplitRetryExecutor.class);

    /** Statuses that mean "too much right now" rather than "wrong request". */
    public static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 502, 503, 504);

    private static final int TOO_MANY_REQUESTS = 429;
    private static final int UNAUTHORIZED = 401;
    private static final String REQUEST_ID_HEADER = "x-request-id";
    private static final String RETRY_AFTER_HEADER = "Retry-After";

    /** Pattern for sanitizing log output - removes all control characters. */
    private static final Pattern LOG_SANITIZE_PATTERN = Pattern.compile("[\\p{Cntrl}\\p{Cc}]");

    private final InstancesTransport transport;
    private final CredentialProvider credentials;
    private final PayloadEncoder encoder;
    private final Map<String, String> headers;
    private final Function<? super T, ?> itemMapper;
    private final Map<String, Object> parameters;
    private final Scheduler scheduler;
    private final InstanceWriterMetrics metrics;

    /**
     * @param transport   sends the requests; must not retry by itself
     * @param credentials refreshes the authorization header before each pause
     * @param encoder     builds request bodies and reads responses
     * @param headers     the operation's mutable, thread-safe header map
     * @param itemMapper  maps an item to its JSON form
     * @param parameters  top-level request fields repeated on every request
     * @param scheduler   where the blocking transport call runs
     * @param metrics     optional metrics (may be null)
     */
    public SplitRetryExecutor(
            InstancesTransport transport,
            CredentialProvider credentials,
            PayloadEncoder encoder,
            Map<String, String> headers,
            Function<? super T, ?> itemMapper,
            Map<String, Object> parameters,
            Scheduler scheduler,
            InstanceWriterMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials cannot be null");
        this.encoder = Objects.requireNonNull(encoder, "encoder cannot be null");
        this.headers = Objects.requireNonNull(headers, "headers cannot be null");
        this.itemMapper = Objects.requireNonNull(itemMapper, "itemMapper cannot be null");
        this.parameters = Map.copyOf(Objects.requireNonNull(parameters, "parameters cannot be null"));
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.metrics = metrics;
    }

    /**
     * Runs a task to completion.
     *
     * @param task the task to send
     * @return the leaf outcomes: one for an unsplit task, several after splits; never an error
     */
    public Flux<TaskOutcome<T>> execute(InstanceTask<T> task) {
        return Flux.defer(() -> {
            EncodedRequest request;
            try {
                request = encoder.encode(task.items(), itemMapper, parameters);
            } catch (RuntimeException e) {
                return Flux.just(fail(task, e));
            }
            return attempt(task, request);
        });
    }

    private Flux<TaskOutcome<T>> attempt(InstanceTask<T> task, EncodedRequest request) {
        return send(task, request)
                .flatMap(response -> screen(task, request, response))
                .retryWhen(createRetrySpec(task))
                .flatMapMany(response -> onResponse(task, request, response))
                .onErrorResume(e -> Flux.just(fail(task, e)));
    }

    private Mono<TransportResponse> send(InstanceTask<T> task, EncodedRequest request) {
        return Mono.fromCallable(() -> {
            long start = System.nanoTime();
            if (metrics != null) {
                metrics.incrementActiveRequests();
            }
            try {
                return Objects.requireNonNull(
                        transport.send(task.endpointPath(), request.body(), Map.copyOf(headers)),
                        "transport returned no response");
            } finally {
                if (metrics != null) {
                    metrics.decrementActiveRequests();
                    metrics.recordRequest(System.nanoTime() - start);
                }
            }
        }).subscribeOn(scheduler);
    }

    /**
     * Lets through successes and retryable statuses of splittable tasks; turns everything else
     * into an error. A retryable status of a single-item task becomes a {@link RetryableStatus}
     * for the retry spec to resend.
     */
    private Mono<TransportResponse> screen(InstanceTask<T> task, EncodedRequest request, TransportResponse response) {
        int status = response.statusCode();
        if (response.isSuccessful()) {
            return Mono.just(response);
        }
        if (status == UNAUTHORIZED) {
            return Mono.error(new NoAccessException(encoder.errorMessage(response), requestId(response), request.json()));
        }
        if (!RETRYABLE_STATUS_CODES.contains(status)) {
            return Mono.error(apiError(response, request));
        }
        if (task.size() == 1) {
            return Mono.error(new RetryableStatus(response, apiError(response, request)));
        }
        return Mono.just(response);
    }

    /**
     * Resends the same request after read timeouts, connection failures and retryable statuses
     * of single-item tasks, as long as the task's tracker allows it. Any other error, or an
     * exhausted budget, ends the retries with the underlying error.
     */
    private Retry createRetrySpec(InstanceTask<T> task) {
        RetryTracker tracker = task.tracker();
        return Retry.from(companion -> companion.concatMap(retrySignal -> {
            Throwable failure = retrySignal.failure();
            FailureCategory category = categoryOf(failure);
            Throwable cause = failure instanceof RetryableStatus retryable ? retryable.apiError : failure;

            if (category == null || !tracker.shouldRetry(category)) {
                return Mono.error(cause);
            }

            Duration pause = failure instanceof RetryableStatus status
                    ? pauseFor(tracker, status.response)
                    : tracker.backoffDuration();
            log.warn("{} failure for {} items at {}, resending (attempt {}/{}, backoff {}ms): {}",
                    category, task.size(), task.endpointPath(), tracker.failures(category),
                    tracker.policy().maxRetriesPerCategory(), pause.toMillis(), sanitizeForLog(cause.getMessage()));
            if (metrics != null) {
                metrics.recordRetry(category);
            }
            return Mono.fromRunnable(() -> credentials.refreshHeader(headers)).then(waitFor(pause));
        }));
    }

    private static FailureCategory categoryOf(Throwable failure) {
        if (failure instanceof ReadTimeoutException) {
            return FailureCategory.READ;
        }
        if (failure instanceof ConnectionFailedException) {
            return FailureCategory.CONNECT;
        }
        if (failure instanceof RetryableStatus) {
            return FailureCategory.STATUS;
        }
        return null;
    }

    private Flux<TaskOutcome<T>> onResponse(InstanceTask<T> task, EncodedRequest request, TransportResponse response) {
        if (response.isSuccessful()) {
            List<JsonNode> results = encoder.decodeItems(response);
            log.debug("Request to {} with {} items succeeded with status {}",
                    task.endpointPath(), task.size(), response.statusCode());
            if (metrics != null) {
                metrics.recordSuccess(task.size());
            }
            return Flux.just(TaskOutcome.success(task.items(), results));
        }

        RetryTracker tracker = task.tracker();
        if (!tracker.shouldRetry(FailureCategory.STATUS)) {
            throw apiError(response, request);
        }
        Duration pause = pauseFor(tracker, response);
        List<InstanceTask<T>> halves = task.split();
        log.warn("Status {} for {} items at {}, splitting into {} + {} (status attempt {}/{}, backoff {}ms)",
                response.statusCode(), task.size(), task.endpointPath(), halves.get(0).size(), halves.get(1).size(),
                tracker.failures(FailureCategory.STATUS), tracker.policy().maxRetriesPerCategory(), pause.toMillis());
        if (metrics != null) {
            metrics.recordSplit();
        }
        return Mono.fromRunnable(() -> credentials.refreshHeader(headers))
                .then(waitFor(pause))
                .thenMany(Flux.concat(execute(halves.get(0)), execute(halves.get(1))))
                .onErrorResume(e -> Flux.just(fail(task, e)));
    }

    /**
     * Waits without blocking on the pools. Inline execution sleeps on the calling thread so that
     * every request of the call stays on that thread.
     */
    private Mono<Void> waitFor(Duration pause) {
        if (scheduler == Schedulers.immediate()) {
            return Mono.fromRunnable(() -> Uninterruptibles.sleepUninterruptibly(pause));
        }
        return Mono.delay(pause).then();
    }

    private Duration pauseFor(RetryTracker tracker, TransportResponse response) {
        if (response.statusCode() == TOO_MANY_REQUESTS) {
            Optional<Duration> retryAfter = retryAfter(response);
            if (retryAfter.isPresent()) {
                Duration cap = tracker.policy().maxBackoff();
                return retryAfter.get().compareTo(cap) > 0 ? cap : retryAfter.get();
            }
        }
        return tracker.backoffDuration();
    }

    private static Optional<Duration> retryAfter(TransportResponse response) {
        return response.header(RETRY_AFTER_HEADER).flatMap(value -> {
            try {
                double seconds = Double.parseDouble(value.trim());
                if (!Double.isFinite(seconds) || seconds < 0) {
                    return Optional.empty();
                }
                return Optional.of(Duration.ofNanos((long) (seconds * 1e9)));
            } catch (NumberFormatException e) {
                // HTTP-date form is not used by the instances API
                return Optional.empty();
            }
        });
    }

    private InstanceApiException apiError(TransportResponse response, EncodedRequest request) {
        return new InstanceApiException(response.statusCode(), encoder.errorMessage(response),
                requestId(response), request.json());
    }

    private static String requestId(TransportResponse response) {
        return response.header(REQUEST_ID_HEADER).orElse(null);
    }

    private TaskOutcome<T> fail(InstanceTask<T> task, Throwable error) {
        String kind = error instanceof IOException ? "transport" : error.getClass().getSimpleName();
        log.error("Request to {} with {} items failed ({}): {} [{}]", task.endpointPath(), task.size(), kind,
                sanitizeForLog(error.getMessage()), task.tracker());
        if (metrics != null) {
            metrics.recordFailure(task.size());
        }
        return TaskOutcome.failure(task.items(), error);
    }

    /** A retryable status on a single-item task; carries the error to raise once the budget is spent. */
    private static final class RetryableStatus extends RuntimeException {

        private final transient TransportResponse response;
        private final InstanceApiException apiError;

        RetryableStatus(TransportResponse response, InstanceApiException apiError) {
            super(apiError.getMessage(), apiError, false, false);
            this.response = response;
            this.apiError = apiError;
        }
    }

    /**
     * Sanitizes a string for safe logging by removing all control characters.
     */
    private static String sanitizeForLog(String input) {
        if (input == null) {
            return "null";
        }
        return LOG_SANITIZE_PATTERN.matcher(input).replaceAll("_");
    }
}
