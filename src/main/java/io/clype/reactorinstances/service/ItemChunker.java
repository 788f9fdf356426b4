package io.clype.reactorinstances.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.Lists;

import io.clype.reactorinstances.retry.BackoffPolicy;
import io.clype.reactorinstances.retry.RetryTracker;

/**
 * Cuts an input list into tasks no larger than the endpoint's per-request item limit.
 */
public final class ItemChunker {

    private ItemChunker() {
    }

    /**
     * Partitions {@code items} into consecutive tasks of at most {@code limit} items, keeping
     * input order inside each task. Every task starts with a fresh {@link RetryTracker}.
     *
     * @param endpointPath the endpoint the tasks will be posted to
     * @param items        the input; an empty list yields no tasks
     * @param limit        the per-request item cap (positive)
     * @param policy       the backoff policy of the new trackers
     * @param <T>          item type
     * @return the tasks, in input order
     */
    public static <T> List<InstanceTask<T>> chunk(String endpointPath, List<T> items, int limit, BackoffPolicy policy) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        List<InstanceTask<T>> tasks = new ArrayList<>((items.size() + limit - 1) / limit);
        for (List<T> chunk : Lists.partition(items, limit)) {
            tasks.add(new InstanceTask<>(endpointPath, chunk, new RetryTracker(policy)));
        }
        return tasks;
    }
}
