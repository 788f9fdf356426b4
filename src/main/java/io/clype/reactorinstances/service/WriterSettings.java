package io.clype.reactorinstances.service;

import java.util.Objects;

import io.clype.reactorinstances.concurrency.InstanceSchedulers;
import io.clype.reactorinstances.retry.BackoffPolicy;

/**
 * Tuning of a {@link BulkInstanceWriter}.
 *
 * @param createLimit     maximum items per upsert request
 * @param deleteLimit     maximum items per delete request
 * @param maxWorkers      requested concurrency; capped by the backend ceilings in {@link InstanceSchedulers}
 * @param backoffPolicy   retry budget and backoff
 * @param compressPayload gzip request bodies
 */
public record WriterSettings(
    int createLimit,
    int deleteLimit,
    int maxWorkers,
    BackoffPolicy backoffPolicy,
    boolean compressPayload
) {
    public static final int DEFAULT_CREATE_LIMIT = 1000;
    public static final int DEFAULT_DELETE_LIMIT = 1000;
    public static final int DEFAULT_MAX_WORKERS = 4;

    public WriterSettings {
        Objects.requireNonNull(backoffPolicy, "backoffPolicy cannot be null");
        if (createLimit <= 0) {
            throw new IllegalArgumentException("createLimit must be positive");
        }
        if (deleteLimit <= 0) {
            throw new IllegalArgumentException("deleteLimit must be positive");
        }
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive");
        }
    }

    public static WriterSettings defaults() {
        return new WriterSettings(DEFAULT_CREATE_LIMIT, DEFAULT_DELETE_LIMIT, DEFAULT_MAX_WORKERS,
                BackoffPolicy.defaults(), true);
    }
}
