package com.questrail.supervision.service;

import com.questrail.supervision.event.DataEvent;
import com.questrail.supervision.internal.time.Cancellable;
import com.questrail.supervision.internal.time.ExecutorOperationScheduler;
import com.questrail.supervision.internal.time.OperationScheduler;
import com.questrail.supervision.internal.time.SystemMonotonicClock;
import com.questrail.supervision.observability.OperationCancelledEvent;
import com.questrail.supervision.observability.OperationFailedEvent;
import com.questrail.supervision.observability.OperationSucceededEvent;
import com.questrail.supervision.observability.RecordingObservabilitySink;
import com.questrail.supervision.observability.ServiceClosedEvent;
import com.questrail.supervision.time.DeterministicOperationScheduler;
import com.questrail.supervision.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AbstractSupervisedService}.
 *
 * Most tests run on a deterministic scheduler: operations execute only inside
 * {@code scheduler.runDueTasks()}, on the test thread. The real-thread tests
 * at the end cover interrupt-driven cancellation.
 */
class AbstractSupervisedServiceTest
{
    /** Stand-in for the owning session. */
    record Node(String jid) { }

    /**
     * Service recording what reached its hooks.
     */
    static class RecordingService extends AbstractSupervisedService<Node> {

        final List<Object> results = Collections.synchronizedList(new ArrayList<>());
        final List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

        RecordingService(Node node, OperationScheduler scheduler) {
            super(node, scheduler, null, new RecordingObservabilitySink(), null);
        }

        <T> OperationHandle<T> start(Operation<T> operation) {
            return spawn(operation);
        }

        @Override
        protected void onOperationFailed(OperationHandle<?> operation, Throwable failure) {
            failures.add(failure);
        }

        @Override
        protected void onOperationSucceeded(OperationHandle<?> operation, Object result) {
            results.add(result);
        }
    }

    private final Node node = new Node("client@example.org");

    private ManualMonotonicClock clock;
    private DeterministicOperationScheduler scheduler;
    private RecordingService service;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicOperationScheduler(clock);
        service = new RecordingService(node, scheduler);
    }

    @Test
    void boundToNodeUntilClosed() {
        assertEquals(node, service.node().orElseThrow());
        assertFalse(service.isClosed());
        assertEquals(0, service.trackedOperationCount());
    }

    @Test
    void nullNodeIsRejected() {
        assertThrows(NullPointerException.class, () -> new RecordingService(null, scheduler));
    }

    @Test
    void successAndFailureReachTheirHooksOnce() {
        OperationHandle<Integer> a = service.start(ctx -> 42);
        OperationHandle<Integer> b = service.start(ctx -> {
            throw new IllegalStateException("boom");
        });
        assertEquals(2, service.trackedOperationCount());

        scheduler.runDueTasks();

        assertEquals(List.of(42), service.results);
        assertEquals(1, service.failures.size());
        assertEquals("boom", service.failures.get(0).getMessage());
        assertEquals(OperationState.SUCCEEDED, a.state());
        assertEquals(OperationState.FAILED, b.state());
        assertEquals(0, service.trackedOperationCount());
    }

    @Test
    void operationIsTrackedWhileItRuns() {
        AtomicInteger trackedDuringRun = new AtomicInteger(-1);
        OperationHandle<String> handle = service.start(ctx -> {
            trackedDuringRun.set(service.trackedOperationCount());
            return "ok";
        });

        assertTrue(service.trackedOperations().contains(handle));
        scheduler.runDueTasks();

        assertEquals(1, trackedDuringRun.get());
        assertFalse(service.trackedOperations().contains(handle));
    }

    @Test
    void failureDoesNotAffectOtherOperations() {
        service.start(ctx -> {
            throw new RuntimeException("first fails");
        });
        service.start(ctx -> "second runs");
        service.start(ctx -> {
            throw new Exception("checked failure");
        });
        service.start(ctx -> "fourth runs");

        assertDoesNotThrow(scheduler::runDueTasks);

        assertEquals(List.of("second runs", "fourth runs"), service.results);
        assertEquals(2, service.failures.size());
        assertEquals(0, service.trackedOperationCount());
    }

    @Test
    void nullResultIsStillASuccess() {
        service.start(ctx -> null);

        scheduler.runDueTasks();

        assertEquals(1, service.results.size());
        assertNull(service.results.get(0));
        assertTrue(service.failures.isEmpty());
    }

    @Test
    void closeCancelsPendingOperationSilently() {
        AtomicBoolean ran = new AtomicBoolean(false);
        OperationHandle<String> c = service.start(ctx -> {
            ran.set(true);
            return "never";
        });

        service.close();
        scheduler.runDueTasks();

        assertFalse(ran.get());
        assertEquals(OperationState.CANCELLED, c.state());
        assertTrue(service.failures.isEmpty());
        assertTrue(service.results.isEmpty());
        assertEquals(0, service.trackedOperationCount());
        assertTrue(service.node().isEmpty());
        assertTrue(service.isClosed());
    }

    @Test
    void closeIsIdempotent() {
        service.start(ctx -> "pending");

        service.close();
        int trackedAfterFirst = service.trackedOperationCount();
        service.close();

        assertEquals(trackedAfterFirst, service.trackedOperationCount());
        assertEquals(0, service.trackedOperationCount());
        assertTrue(service.node().isEmpty());
        assertTrue(service.isClosed());
    }

    @Test
    void closeDoesNotTouchFinishedOperations() {
        OperationHandle<Integer> done = service.start(ctx -> 1);
        scheduler.runDueTasks();

        service.close();

        assertEquals(OperationState.SUCCEEDED, done.state());
        assertEquals(List.of(1), service.results);
    }

    @Test
    void explicitCancelIsNotAFailure() {
        OperationHandle<Integer> handle = service.start(ctx -> 1);

        assertTrue(handle.cancel());
        scheduler.runDueTasks();

        assertTrue(service.failures.isEmpty());
        assertTrue(service.results.isEmpty());
        assertEquals(0, service.trackedOperationCount());
        assertFalse(service.isClosed());
    }

    @Test
    void delayedOperationRunsAtItsDeadline() {
        OperationHandle<String> handle = service.spawnAfter(Duration.ofMillis(100), ctx -> "late");

        scheduler.runDueTasks();
        assertEquals(OperationState.PENDING, handle.state());
        assertEquals(1, service.trackedOperationCount());

        clock.advanceMillis(100);
        scheduler.runDueTasks();

        assertEquals(List.of("late"), service.results);
        assertEquals(0, service.trackedOperationCount());
    }

    @Test
    void closeCancelsDelayedOperationBeforeItStarts() {
        AtomicBoolean ran = new AtomicBoolean(false);
        service.spawnAfter(Duration.ofSeconds(1), ctx -> {
            ran.set(true);
            return null;
        });

        service.close();
        clock.advanceMillis(2000);
        scheduler.runDueTasks();

        assertFalse(ran.get());
        assertEquals(0, scheduler.pendingTasks());
        assertEquals(0, service.trackedOperationCount());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.spawnAfter(Duration.ofMillis(-1), ctx -> null));
        assertEquals(0, service.trackedOperationCount());
    }

    @Test
    void spawnAfterCloseIsTrackedAndCancelledByNextClose() {
        service.close();

        OperationHandle<String> late = service.start(ctx -> "late");
        assertEquals(1, service.trackedOperationCount());

        service.close();

        assertEquals(OperationState.CANCELLED, late.state());
        assertEquals(0, service.trackedOperationCount());
    }

    @Test
    void rejectedSubmissionIsNotTracked() {
        OperationScheduler rejecting = new OperationScheduler() {
            @Override
            public Cancellable submit(Runnable task) {
                throw new RejectedExecutionException("shut down");
            }

            @Override
            public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
                throw new RejectedExecutionException("shut down");
            }
        };
        RecordingService rejected = new RecordingService(node, rejecting);

        assertThrows(RejectedExecutionException.class, () -> rejected.start(ctx -> 1));
        assertEquals(0, rejected.trackedOperationCount());
        assertTrue(rejected.failures.isEmpty());
    }

    @Test
    void throwingHookIsContained() {
        AbstractSupervisedService<Node> fragile = new AbstractSupervisedService<>(node, scheduler) {
            @Override
            protected void onOperationSucceeded(OperationHandle<?> operation, Object result) {
                throw new IllegalStateException("hook bug");
            }
        };

        fragile.spawn(ctx -> "value");

        assertDoesNotThrow(scheduler::runDueTasks);
        assertEquals(0, fragile.trackedOperationCount());
    }

    @Test
    void defaultHooksReportToObservabilitySink() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        AbstractSupervisedService<Node> plain =
                new AbstractSupervisedService<>(node, scheduler, clock, sink, null) { };

        plain.spawn("ok", ctx -> 42);
        plain.spawn("bad", ctx -> {
            throw new IllegalStateException("boom");
        });
        scheduler.runDueTasks();

        List<OperationSucceededEvent> succeeded = sink.eventsOfType(OperationSucceededEvent.class);
        List<OperationFailedEvent> failed = sink.eventsOfType(OperationFailedEvent.class);
        assertEquals(1, succeeded.size());
        assertEquals(42, succeeded.get(0).result());
        assertTrue(succeeded.get(0).operation().contains("name=ok"));
        assertEquals(1, failed.size());
        assertEquals("boom", failed.get(0).failure().getMessage());
        assertTrue(failed.get(0).operation().contains("name=bad"));
        assertFalse(sink.hasEventOfType(OperationCancelledEvent.class));
    }

    @Test
    void closeIsReportedOnceWithCancelledCount() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        AbstractSupervisedService<Node> plain =
                new AbstractSupervisedService<>(node, scheduler, clock, sink, null) { };
        plain.spawn(ctx -> "a");
        plain.spawn(ctx -> "b");

        plain.close();
        plain.close();

        List<ServiceClosedEvent> closed = sink.eventsOfType(ServiceClosedEvent.class);
        assertEquals(1, closed.size());
        assertEquals(2, closed.get(0).cancelledOperations());
        assertEquals(2, sink.eventsOfType(OperationCancelledEvent.class).size());
        assertFalse(sink.hasEventOfType(OperationFailedEvent.class));
    }

    @Test
    void customOutcomeHandlerReceivesOutcomes() {
        List<String> seen = new ArrayList<>();
        OperationOutcomeHandler handler = new OperationOutcomeHandler() {
            @Override
            public void onOperationFailed(OperationHandle<?> operation, Throwable failure) {
                seen.add("failed:" + failure.getMessage());
            }

            @Override
            public void onOperationSucceeded(OperationHandle<?> operation, Object result) {
                seen.add("succeeded:" + result);
            }
        };
        AbstractSupervisedService<Node> custom =
                new AbstractSupervisedService<>(node, scheduler, clock, new RecordingObservabilitySink(), handler) { };

        custom.spawn(ctx -> 1);
        custom.spawn(ctx -> {
            throw new RuntimeException("x");
        });
        scheduler.runDueTasks();

        assertEquals(List.of("succeeded:1", "failed:x"), seen);
    }

    @Test
    void outcomeCanBeHandedOnThroughDataEvent() throws Exception {
        DataEvent<String> outcome = new DataEvent<>();
        AbstractSupervisedService<Node> forwarding = new AbstractSupervisedService<>(node, scheduler) {
            @Override
            protected void onOperationFailed(OperationHandle<?> operation, Throwable failure) {
                outcome.resolveWithFailure(failure);
            }
        };

        forwarding.spawn(ctx -> {
            throw new IllegalStateException("negotiation failed");
        });
        scheduler.runDueTasks();

        ExecutionException e = assertThrows(ExecutionException.class, outcome::peek);
        assertEquals("negotiation failed", e.getCause().getMessage());
    }

    // ------------------------
    // Real threads
    // ------------------------

    @Test
    void closeInterruptsBlockedOperationWithoutReportingFailure() throws Exception {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            RecordingService threaded = new RecordingService(node,
                    new ExecutorOperationScheduler(executor, SystemMonotonicClock.INSTANCE));
            DataEvent<String> never = new DataEvent<>();
            CountDownLatch running = new CountDownLatch(1);

            OperationHandle<String> c = threaded.start(ctx -> {
                running.countDown();
                return never.await();
            });
            assertTrue(running.await(1, TimeUnit.SECONDS));

            threaded.close();

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> c.completion().toCompletableFuture().get(1, TimeUnit.SECONDS));
            assertInstanceOf(CancellationException.class, e.getCause());
            assertEquals(OperationState.CANCELLED, c.state());
            assertEquals(0, threaded.trackedOperationCount());
            assertTrue(threaded.failures.isEmpty());
            assertTrue(threaded.node().isEmpty());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentSpawnsAreAllObserved() throws Exception {
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(4);
        try {
            RecordingService threaded = new RecordingService(node,
                    new ExecutorOperationScheduler(executor, SystemMonotonicClock.INSTANCE));
            List<OperationHandle<Integer>> handles = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                int n = i;
                handles.add(threaded.start(ctx -> {
                    if (n % 10 == 0) {
                        throw new IllegalArgumentException("bad " + n);
                    }
                    return n;
                }));
            }

            for (OperationHandle<Integer> handle : handles) {
                handle.completion().handle((value, failure) -> null)
                        .toCompletableFuture().get(2, TimeUnit.SECONDS);
            }

            assertEquals(90, threaded.results.size());
            assertEquals(10, threaded.failures.size());
            assertEquals(0, threaded.trackedOperationCount());
        } finally {
            executor.shutdownNow();
        }
    }
}
