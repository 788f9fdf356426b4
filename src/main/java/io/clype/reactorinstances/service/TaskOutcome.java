package io.clype.reactorinstances.service;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Final state of a leaf task: either the decoded result entries or the error that ended it.
 *
 * @param <T>     item type
 * @param items   the items the leaf task carried
 * @param results raw result entries of the response ({@code items} array); empty on failure
 * @param error   the terminal error; null on success
 */
public record TaskOutcome<T>(
    List<T> items,
    List<JsonNode> results,
    Throwable error
) {
    public TaskOutcome {
        items = List.copyOf(Objects.requireNonNull(items, "items cannot be null"));
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static <T> TaskOutcome<T> success(List<T> items, List<JsonNode> results) {
        return new TaskOutcome<>(items, results, null);
    }

    public static <T> TaskOutcome<T> failure(List<T> items, Throwable error) {
        return new TaskOutcome<>(items, List.of(), Objects.requireNonNull(error, "error cannot be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
