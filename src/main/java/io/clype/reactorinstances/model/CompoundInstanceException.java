package io.clype.reactorinstances.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised by a bulk write or delete when at least one task failed for good.
 *
 * <p>Every input item is accounted for: {@link #getFailed()} maps each item of a failed task
 * to the error that ended it, and {@link #getSuccessful()} holds the typed results of the tasks
 * that went through. Callers can resubmit exactly the keys of {@link #getFailed()}.</p>
 *
 * <p>The message names the number of failed items followed by the first cause's message; the
 * first cause is also available through {@link #getCause()}.</p>
 */
public class CompoundInstanceException extends RuntimeException {

    private final Map<InstanceId, Throwable> failed;
    private final List<Object> successful;

    /**
     * Creates a new CompoundInstanceException.
     *
     * @param failed     identity of every failed item mapped to its error (non-empty, insertion ordered)
     * @param successful typed results of the successful tasks
     */
    public CompoundInstanceException(Map<InstanceId, Throwable> failed, List<?> successful) {
        super(buildMessage(failed), failed.values().stream().findFirst().orElse(null));
        this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        this.successful = List.<Object>copyOf(successful);
    }

    private static String buildMessage(Map<InstanceId, Throwable> failed) {
        String firstMessage = failed.values().stream()
                .findFirst()
                .map(Throwable::getMessage)
                .orElse("unknown error");
        return failed.size() + " instance(s) failed: " + firstMessage;
    }

    /**
     * Returns each failed item's identity mapped to the error of the task that carried it.
     *
     * @return immutable, insertion-ordered map
     */
    public Map<InstanceId, Throwable> getFailed() {
        return failed;
    }

    /**
     * Returns the results of the tasks that succeeded. Elements are {@link InstanceApplyResult}
     * for writes and {@link InstanceId} for deletes.
     *
     * @return immutable list of typed results
     */
    public List<Object> getSuccessful() {
        return successful;
    }

    public int getFailureCount() {
        return failed.size();
    }
}
