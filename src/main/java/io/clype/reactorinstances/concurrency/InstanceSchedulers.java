package io.clype.reactorinstances.concurrency;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Suppliers;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Process-wide worker pools for instance writes and deletes.
 *
 * <p>The instances API allows a different number of concurrent requests per endpoint, so each
 * operation kind has its own bounded pool with a hard thread ceiling. Pools are created lazily,
 * at most once per process, and are never disposed. Their threads are daemons.</p>
 *
 * <p>With concurrency disabled (debugging, deterministic runs) both accessors return
 * {@link Schedulers#immediate()} and {@link #effectiveConcurrency(int, int)} returns 1. Every
 * request then runs on the calling thread, backoff pauses included.</p>
 *
 * <p><b>Thread Safety:</b> Pool creation is guarded by Guava's memoizing supplier; the
 * concurrency switch is volatile.</p>
 */
public final class InstanceSchedulers {

    private static final Logger log = LoggerFactory.getLogger(InstanceSchedulers.class);

    /** Backend ceiling of concurrent upsert requests. */
    public static final int MAX_WRITE_WORKERS = 4;

    /** Backend ceiling of concurrent delete requests. */
    public static final int MAX_DELETE_WORKERS = 2;

    /** Queued tasks per pool before submissions are rejected. */
    private static final int QUEUED_TASK_CAP = 100_000;

    /** Idle threads are released after this many seconds; the pool itself stays. */
    private static final int THREAD_TTL_SECONDS = 60;

    private static final Supplier<Scheduler> WRITE_SCHEDULER =
            Suppliers.memoize(() -> createPool(MAX_WRITE_WORKERS, "instances-write"));

    private static final Supplier<Scheduler> DELETE_SCHEDULER =
            Suppliers.memoize(() -> createPool(MAX_DELETE_WORKERS, "instances-delete"));

    private static volatile boolean concurrencyEnabled = true;

    private InstanceSchedulers() {
    }

    /**
     * Returns the shared pool for upserts, or the inline scheduler if concurrency is disabled.
     *
     * @return the write scheduler
     */
    public static Scheduler writeScheduler() {
        return concurrencyEnabled ? WRITE_SCHEDULER.get() : Schedulers.immediate();
    }

    /**
     * Returns the shared pool for deletes, or the inline scheduler if concurrency is disabled.
     *
     * @return the delete scheduler
     */
    public static Scheduler deleteScheduler() {
        return concurrencyEnabled ? DELETE_SCHEDULER.get() : Schedulers.immediate();
    }

    /**
     * Number of top-level tasks that may run at once: {@code min(requested, ceiling)}, at least 1.
     *
     * @param requestedWorkers the caller's configured concurrency
     * @param ceiling          {@link #MAX_WRITE_WORKERS} or {@link #MAX_DELETE_WORKERS}
     * @return the effective concurrency, 1 when concurrency is disabled
     */
    public static int effectiveConcurrency(int requestedWorkers, int ceiling) {
        if (!concurrencyEnabled) {
            return 1;
        }
        return Math.max(1, Math.min(requestedWorkers, ceiling));
    }

    public static boolean isConcurrencyEnabled() {
        return concurrencyEnabled;
    }

    /**
     * Switches between the shared pools and inline execution for the whole process.
     *
     * @param enabled false to run every request on the calling thread
     */
    public static void setConcurrencyEnabled(boolean enabled) {
        if (concurrencyEnabled != enabled) {
            log.info("Instance writer concurrency {}", enabled ? "enabled" : "disabled");
        }
        concurrencyEnabled = enabled;
    }

    private static Scheduler createPool(int threadCap, String name) {
        log.debug("Creating {} pool with {} threads", name, threadCap);
        return Schedulers.newBoundedElastic(threadCap, QUEUED_TASK_CAP, name, THREAD_TTL_SECONDS, true);
    }
}
