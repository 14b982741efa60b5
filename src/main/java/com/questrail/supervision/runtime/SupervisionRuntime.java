package com.questrail.supervision.runtime;

import com.questrail.supervision.config.SupervisionConfig;
import com.questrail.supervision.internal.time.ExecutorOperationScheduler;
import com.questrail.supervision.internal.time.MonotonicClock;
import com.questrail.supervision.internal.time.OperationScheduler;
import com.questrail.supervision.internal.time.SystemMonotonicClock;
import com.questrail.supervision.internal.time.netty.NettyEventLoopScheduler;
import com.questrail.supervision.observability.NullObservabilitySink;
import com.questrail.supervision.observability.SupervisionObservabilitySink;
import com.questrail.supervision.pool.OperationPool;
import com.questrail.supervision.service.DiagnosticOutcomeHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SupervisionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the scheduler that supervised
 * services and operation pools run on.
 *
 * <p>Services are constructed with {@link #scheduler()}, {@link #clock()} and
 * {@link #observabilitySink()} from one runtime. Several runtimes may live in
 * one process without sharing anything.</p>
 *
 * <h2>Lifecycle</h2>
 * The scheduler threads are created by {@link Builder#build()}.
 * {@link #stop()} shuts them down, waiting up to the configured shutdown
 * timeout for running operations. After that a thread pool interrupts what
 * still runs; an event loop cannot be interrupted and is left to finish on
 * its own. Close services before stopping their runtime.
 */
public final class SupervisionRuntime {
    private static final Logger log = LoggerFactory.getLogger(SupervisionRuntime.class);

    private final SupervisionConfig config;
    private final OperationScheduler scheduler;
    private final MonotonicClock clock;
    private final SupervisionObservabilitySink observabilitySink;
    private final ScheduledExecutorService executor;
    private final NettyEventLoopScheduler eventLoop;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private SupervisionRuntime(
            SupervisionConfig config,
            OperationScheduler scheduler,
            MonotonicClock clock,
            SupervisionObservabilitySink observabilitySink,
            ScheduledExecutorService executor,
            NettyEventLoopScheduler eventLoop) {
        this.config = config;
        this.scheduler = scheduler;
        this.clock = clock;
        this.observabilitySink = observabilitySink;
        this.executor = executor;
        this.eventLoop = eventLoop;
    }

    public OperationScheduler scheduler() {
        return scheduler;
    }

    public MonotonicClock clock() {
        return clock;
    }

    public SupervisionObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    public SupervisionConfig config() {
        return config;
    }

    /**
     * Creates an operation pool on this runtime's scheduler reporting outcomes
     * to this runtime's sink.
     */
    public OperationPool newOperationPool(Integer maxTasks, Integer defaultLimit) {
        return new OperationPool(scheduler, maxTasks, defaultLimit, new DiagnosticOutcomeHandler(observabilitySink));
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Stops the scheduler. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        if (eventLoop != null) {
            try {
                if (!eventLoop.shutdown(config.shutdownTimeout())) {
                    log.warn("event loop did not terminate within {}, leaving the running operation behind",
                            config.shutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return;
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("scheduler did not terminate within {}, interrupting remaining operations",
                        config.shutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SupervisionConfig config = SupervisionConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private SupervisionObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(SupervisionConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withObservabilitySink(SupervisionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public SupervisionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            if (config.schedulerKind() == SupervisionConfig.SchedulerKind.EVENT_LOOP) {
                NettyEventLoopScheduler eventLoop = new NettyEventLoopScheduler(config.threadNamePrefix(), clock);
                return new SupervisionRuntime(config, eventLoop, clock, observabilitySink, null, eventLoop);
            }

            ScheduledExecutorService executor = Executors.newScheduledThreadPool(
                    config.schedulerThreads(),
                    new DefaultThreadFactory(config.threadNamePrefix(), true));
            OperationScheduler scheduler = new ExecutorOperationScheduler(executor, clock);
            return new SupervisionRuntime(config, scheduler, clock, observabilitySink, executor, null);
        }
    }
}
