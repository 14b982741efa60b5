package com.questrail.supervision.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SupervisionConfig
 * -----------------------------------------------------------------------------
 * Operational configuration of a {@code SupervisionRuntime}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>schedulerKind</b>: {@link SchedulerKind#EVENT_LOOP} runs every
 *       operation on one Netty event-loop thread; {@link SchedulerKind#THREAD_POOL}
 *       runs them on a scheduled thread pool.</li>
 *   <li><b>schedulerThreads</b>: pool size for {@code THREAD_POOL}; must be 1
 *       for {@code EVENT_LOOP}.</li>
 *   <li><b>threadNamePrefix</b>: prefix of scheduler thread names.</li>
 *   <li><b>shutdownTimeout</b>: how long {@code stop()} waits for running
 *       operations before forcing termination.</li>
 * </ul>
 */
public record SupervisionConfig(
        SchedulerKind schedulerKind,
        int schedulerThreads,
        String threadNamePrefix,
        Duration shutdownTimeout
) {
    public enum SchedulerKind {
        EVENT_LOOP,
        THREAD_POOL
    }

    public SupervisionConfig {
        Objects.requireNonNull(schedulerKind, "schedulerKind");
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be >= 1");
        }
        if (schedulerKind == SchedulerKind.EVENT_LOOP && schedulerThreads != 1) {
            throw new IllegalArgumentException("EVENT_LOOP scheduler runs exactly one thread");
        }
        if (threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix must not be blank");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
    }

    /**
     * A thread pool of {@code threads} threads with default naming and shutdown timeout.
     */
    public static SupervisionConfig threadPool(int threads) {
        return new SupervisionConfig(SchedulerKind.THREAD_POOL, threads, "supervision", Duration.ofSeconds(5));
    }

    /**
     * Defaults: one Netty event-loop thread named {@code supervision}, 5 s shutdown timeout.
     */
    public static SupervisionConfig defaults() {
        return new SupervisionConfig(SchedulerKind.EVENT_LOOP, 1, "supervision", Duration.ofSeconds(5));
    }
}
