package io.clype.reactorinstances.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;

import io.clype.reactorinstances.model.CompoundInstanceException;
import io.clype.reactorinstances.model.InstanceId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Joined leaf outcomes of all tasks of one top-level call.
 *
 * @param <T> item type
 */
public final class TaskSummary<T> {

    private final List<TaskOutcome<T>> outcomes;

    public TaskSummary(List<TaskOutcome<T>> outcomes) {
        this.outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes cannot be null"));
    }

    /**
     * Runs every task through {@code executor}, at most {@code concurrency} at a time, and
     * waits for all of them.
     *
     * <p>Uses {@code flatMap}: outcomes arrive in completion order, not task order.</p>
     *
     * @param tasks       the top-level tasks
     * @param executor    resolves one task to its leaf outcomes
     * @param concurrency maximum number of top-level tasks in flight
     * @param <T>         item type
     * @return the summary, emitted once every task has resolved
     */
    public static <T> Mono<TaskSummary<T>> run(
            List<InstanceTask<T>> tasks,
            Function<InstanceTask<T>, Flux<TaskOutcome<T>>> executor,
            int concurrency) {
        if (tasks.isEmpty()) {
            return Mono.just(new TaskSummary<>(List.of()));
        }
        return Flux.fromIterable(tasks)
                .flatMap(executor, concurrency)
                .collectList()
                .map(TaskSummary::new);
    }

    public List<TaskOutcome<T>> outcomes() {
        return outcomes;
    }

    public List<TaskOutcome<T>> succeeded() {
        return outcomes.stream().filter(TaskOutcome::isSuccess).toList();
    }

    public List<TaskOutcome<T>> failed() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> !outcome.isSuccess());
    }

    /**
     * Counts the items over all leaf outcomes. Equals the input size of the call.
     *
     * @return the item count
     */
    public int itemCount() {
        return outcomes.stream().mapToInt(outcome -> outcome.items().size()).sum();
    }

    /**
     * Flattens the result entries of all successful outcomes.
     *
     * @param unwrapFn decodes one result entry
     * @param <R>      typed result
     * @return the decoded results
     */
    public <R> List<R> joinedResults(Function<JsonNode, R> unwrapFn) {
        List<R> results = new ArrayList<>();
        for (TaskOutcome<T> outcome : outcomes) {
            if (outcome.isSuccess()) {
                for (JsonNode entry : outcome.results()) {
                    results.add(unwrapFn.apply(entry));
                }
            }
        }
        return results;
    }

    /**
     * Throws a {@link CompoundInstanceException} if any outcome failed.
     *
     * @param taskUnwrapFn    extracts the items of a failed outcome
     * @param elementUnwrapFn maps an item to its identity
     * @param resultUnwrapFn  decodes the result entries of the successful outcomes
     * @throws CompoundInstanceException mapping every item of every failed outcome to its error
     */
    public void raiseCompoundExceptionIfFailedTasks(
            Function<TaskOutcome<T>, List<T>> taskUnwrapFn,
            Function<? super T, InstanceId> elementUnwrapFn,
            Function<JsonNode, ?> resultUnwrapFn) {
        if (!hasFailures()) {
            return;
        }
        Map<InstanceId, Throwable> failed = new LinkedHashMap<>();
        for (TaskOutcome<T> outcome : failed()) {
            for (T item : taskUnwrapFn.apply(outcome)) {
                failed.putIfAbsent(elementUnwrapFn.apply(item), outcome.error());
            }
        }
        throw new CompoundInstanceException(failed, joinedResults(resultUnwrapFn));
    }
}
