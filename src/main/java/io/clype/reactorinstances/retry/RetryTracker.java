package io.clype.reactorinstances.retry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry bookkeeping owned by exactly one task.
 *
 * <p>Counts failures per {@link FailureCategory} against the shared, immutable
 * {@link BackoffPolicy}. When a task is split, each half gets its own {@link #copy()}, so the
 * halves never see each other's failures.</p>
 *
 * <p>Not thread-safe: a tracker is only touched by the task that owns it, and a task runs one
 * attempt at a time.</p>
 */
public final class RetryTracker {

    private static final int MAX_EXPONENT = 62;

    private final BackoffPolicy policy;
    private final Map<FailureCategory, Integer> failures;

    public RetryTracker(BackoffPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.failures = new EnumMap<>(FailureCategory.class);
    }

    private RetryTracker(RetryTracker source) {
        this.policy = source.policy;
        this.failures = new EnumMap<>(source.failures);
    }

    /**
     * Records a failure of the given category and tells whether another attempt is allowed.
     *
     * @param category the kind of failure that just happened
     * @return true while the category's failure count is within {@code maxRetriesPerCategory}
     */
    public boolean shouldRetry(FailureCategory category) {
        int count = failures.merge(category, 1, Integer::sum);
        return count <= policy.maxRetriesPerCategory();
    }

    /**
     * Computes the pause before the next attempt:
     * {@code min(maxBackoff, backoffFactor * 2^totalFailures)}, jittered if the policy says so.
     * Never negative and never above {@code maxBackoff}.
     *
     * @return the pause duration
     */
    public Duration backoffDuration() {
        double capSeconds = policy.maxBackoff().toNanos() / 1e9;
        int exponent = Math.min(totalFailures(), MAX_EXPONENT);
        double seconds = Math.min(capSeconds, policy.backoffFactor() * Math.pow(2, exponent));
        if (policy.jitter()) {
            seconds *= ThreadLocalRandom.current().nextDouble();
        }
        long nanos = (long) (Math.max(0.0, Math.min(seconds, capSeconds)) * 1e9);
        return Duration.ofNanos(nanos);
    }

    /**
     * Returns an independent tracker with the same counters and the same policy.
     *
     * @return the copy
     */
    public RetryTracker copy() {
        return new RetryTracker(this);
    }

    public int failures(FailureCategory category) {
        return failures.getOrDefault(category, 0);
    }

    public int totalFailures() {
        int total = 0;
        for (int count : failures.values()) {
            total += count;
        }
        return total;
    }

    public BackoffPolicy policy() {
        return policy;
    }

    @Override
    public String toString() {
        return "RetryTracker{read=" + failures(FailureCategory.READ)
                + ", connect=" + failures(FailureCategory.CONNECT)
                + ", status=" + failures(FailureCategory.STATUS) + "}";
    }
}
