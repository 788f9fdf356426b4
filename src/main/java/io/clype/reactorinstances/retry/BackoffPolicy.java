package io.clype.reactorinstances.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable backoff configuration shared by every {@link RetryTracker} of a writer.
 *
 * @param backoffFactor         base of the exponential backoff in seconds; the pause before the
 *                              n-th retry is {@code backoffFactor * 2^n}
 * @param maxBackoff            upper bound of any single pause
 * @param maxRetriesPerCategory retries allowed per {@link FailureCategory}
 * @param jitter                randomize each pause uniformly in {@code [0, computed)}
 */
public record BackoffPolicy(
    double backoffFactor,
    Duration maxBackoff,
    int maxRetriesPerCategory,
    boolean jitter
) {
    public static final double DEFAULT_BACKOFF_FACTOR = 0.5;
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES_PER_CATEGORY = 10;

    public BackoffPolicy {
        Objects.requireNonNull(maxBackoff, "maxBackoff cannot be null");
        if (!Double.isFinite(backoffFactor) || backoffFactor < 0) {
            throw new IllegalArgumentException("backoffFactor must be a non-negative number, got: " + backoffFactor);
        }
        if (maxBackoff.isNegative()) {
            throw new IllegalArgumentException("maxBackoff must not be negative");
        }
        if (maxRetriesPerCategory < 0) {
            throw new IllegalArgumentException("maxRetriesPerCategory must not be negative");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_BACKOFF, DEFAULT_MAX_RETRIES_PER_CATEGORY, true);
    }
}
