package io.clype.reactorinstances.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.clype.reactorinstances.retry.RetryTracker;

/**
 * One request's worth of items plus the retry state that belongs to them.
 *
 * @param <T>          item type, {@code InstanceApply} for writes and {@code InstanceId} for deletes
 * @param endpointPath the endpoint the items are posted to
 * @param items        the items, in request order (non-empty, copied)
 * @param tracker      retry state owned by this task alone
 */
public record InstanceTask<T>(
    String endpointPath,
    List<T> items,
    RetryTracker tracker
) {
    public InstanceTask {
        Objects.requireNonNull(endpointPath, "endpointPath cannot be null");
        Objects.requireNonNull(tracker, "tracker cannot be null");
        items = List.copyOf(Objects.requireNonNull(items, "items cannot be null"));
        if (items.isEmpty()) {
            throw new IllegalArgumentException("a task needs at least one item");
        }
    }

    public int size() {
        return items.size();
    }

    /**
     * Halves the task: the first half holds {@code floor(n/2)} items, the second the rest.
     * Each half gets its own copy of the tracker.
     *
     * @return the two halves, in item order
     * @throws IllegalStateException if the task holds a single item
     */
    public List<InstanceTask<T>> split() {
        if (items.size() < 2) {
            throw new IllegalStateException("a single-item task cannot be split");
        }
        int half = items.size() / 2;
        List<InstanceTask<T>> halves = new ArrayList<>(2);
        halves.add(new InstanceTask<>(endpointPath, items.subList(0, half), tracker.copy()));
        halves.add(new InstanceTask<>(endpointPath, items.subList(half, items.size()), tracker.copy()));
        return halves;
    }
}
