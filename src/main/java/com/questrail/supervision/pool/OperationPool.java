package com.questrail.supervision.pool;

import com.questrail.supervision.internal.exec.SupervisedOperation;
import com.questrail.supervision.internal.time.OperationScheduler;
import com.questrail.supervision.observability.Slf4jSupervisionObservabilitySink;
import com.questrail.supervision.service.DiagnosticOutcomeHandler;
import com.questrail.supervision.service.Operation;
import com.questrail.supervision.service.OperationHandle;
import com.questrail.supervision.service.OperationOutcomeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * OperationPool
 * =============================================================================
 * Runs supervised operations under per-group limits on how many may run at
 * once.
 *
 * <h2>Groups</h2>
 * Each operation belongs to zero or more groups, identified by any key with
 * sensible {@code equals}/{@code hashCode}. Groups come into existence on
 * demand. Every operation is also a member of {@link #ROOT_GROUP}, so the
 * root group's limit ({@code maxTasks}) bounds the whole pool.
 *
 * <h2>Limits</h2>
 * <ul>
 *   <li>A group's limit is its explicit limit if one was set, otherwise the
 *       pool's default limit. The default never applies to the root group.</li>
 *   <li>A limit of zero blocks the group entirely.</li>
 *   <li>Lowering a limit below the number of running operations leaves them
 *       running; new spawns are refused until the group drops below it.</li>
 * </ul>
 *
 * <h2>Admission</h2>
 * {@link #spawn(Set, Operation)} checks every group and reserves a slot in
 * each atomically. If any group is full, {@link PoolLimitExceededException}
 * is thrown and the operation never starts. Slots are released when the
 * operation terminates, whatever the outcome.
 *
 * <h2>Outcomes</h2>
 * Failures and results go to an {@link OperationOutcomeHandler} exactly as
 * for a supervised service; cancellations are dropped.
 */
public final class OperationPool
{
    private static final Logger log = LoggerFactory.getLogger(OperationPool.class);

    /**
     * The group every pool operation belongs to.
     */
    public static final Object ROOT_GROUP = RootGroup.INSTANCE;

    private final OperationScheduler scheduler;
    private final OperationOutcomeHandler outcomeHandler;
    private final Integer defaultLimit;

    private final Object lock = new Object();

    // Guarded by lock.
    private final Map<Object, Integer> limits = new HashMap<>();
    private final Map<Object, Integer> counts = new HashMap<>();
    private final Set<SupervisedOperation<?>> running = new HashSet<>();

    /**
     * Unlimited pool reporting outcomes through SLF4J.
     */
    public OperationPool(OperationScheduler scheduler)
    {
        this(scheduler, null, null, null);
    }

    /**
     * @param scheduler      scheduler running the operations
     * @param maxTasks       limit for the whole pool; {@code null} for none
     * @param defaultLimit   limit for groups without an explicit one; {@code null} for none
     * @param outcomeHandler receives failures and results; {@code null} selects SLF4J diagnostics
     */
    public OperationPool(OperationScheduler scheduler,
                         Integer maxTasks,
                         Integer defaultLimit,
                         OperationOutcomeHandler outcomeHandler)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.outcomeHandler = Objects.requireNonNullElseGet(outcomeHandler,
                () -> new DiagnosticOutcomeHandler(Slf4jSupervisionObservabilitySink.forClass(OperationPool.class)));
        this.defaultLimit = requireValidLimit(defaultLimit);
        setLimit(ROOT_GROUP, maxTasks);
    }

    /**
     * Sets the limit of {@code group}. {@code null} clears it.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public void setLimit(Object group, Integer limit)
    {
        Objects.requireNonNull(group, "group");
        if (limit == null) {
            clearLimit(group);
            return;
        }
        requireValidLimit(limit);

        synchronized (lock) {
            limits.put(group, limit);
        }
    }

    /**
     * Removes the explicit limit of {@code group}, if any.
     */
    public void clearLimit(Object group)
    {
        Objects.requireNonNull(group, "group");
        synchronized (lock) {
            limits.remove(group);
        }
    }

    /**
     * @return the explicit limit of {@code group}; the default limit is not reported here
     */
    public Optional<Integer> getLimit(Object group)
    {
        Objects.requireNonNull(group, "group");
        synchronized (lock) {
            return Optional.ofNullable(limits.get(group));
        }
    }

    public Optional<Integer> defaultLimit()
    {
        return Optional.ofNullable(defaultLimit);
    }

    /**
     * @return number of operations currently running (or pending) in {@code group}
     */
    public int getTaskCount(Object group)
    {
        Objects.requireNonNull(group, "group");
        synchronized (lock) {
            return counts.getOrDefault(group, 0);
        }
    }

    public <T> OperationHandle<T> spawn(Set<?> groups, Operation<T> operation)
    {
        return spawn(groups, null, operation);
    }

    /**
     * Admits {@code operation} into {@code groups} (plus the root group) and
     * starts it.
     *
     * @throws PoolLimitExceededException if any of the groups is full
     */
    public <T> OperationHandle<T> spawn(Set<?> groups, String name, Operation<T> operation)
    {
        Objects.requireNonNull(groups, "groups");
        Objects.requireNonNull(operation, "operation");

        Set<Object> memberships = new LinkedHashSet<>();
        memberships.add(ROOT_GROUP);
        memberships.addAll(groups);
        Set<Object> frozen = Collections.unmodifiableSet(memberships);

        SupervisedOperation<T> handle = new SupervisedOperation<>(name, operation,
                terminated -> operationTerminated(terminated, frozen));

        synchronized (lock) {
            for (Object group : frozen) {
                Integer limit = effectiveLimitLocked(group);
                if (limit != null && counts.getOrDefault(group, 0) >= limit) {
                    throw new PoolLimitExceededException(group, limit);
                }
            }
            for (Object group : frozen) {
                counts.merge(group, 1, Integer::sum);
            }
            running.add(handle);
        }

        try {
            handle.startScheduled(scheduler.submit(handle));
        } catch (RuntimeException e) {
            // Releases the reserved slots through operationTerminated.
            handle.cancel();
            throw e;
        }
        return handle;
    }

    /**
     * Requests cancellation of every operation in the pool.
     *
     * @return number of operations a cancellation was requested for
     */
    public int cancelAll()
    {
        List<SupervisedOperation<?>> snapshot;
        synchronized (lock) {
            snapshot = List.copyOf(running);
        }

        int cancelled = 0;
        for (SupervisedOperation<?> operation : snapshot) {
            if (operation.cancel()) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private Integer effectiveLimitLocked(Object group)
    {
        Integer explicit = limits.get(group);
        if (explicit != null || group == ROOT_GROUP) {
            return explicit;
        }
        return defaultLimit;
    }

    private void operationTerminated(SupervisedOperation<?> operation, Set<Object> memberships)
    {
        synchronized (lock) {
            if (!running.remove(operation)) {
                return;
            }
            for (Object group : memberships) {
                counts.computeIfPresent(group, (g, n) -> n > 1 ? n - 1 : null);
            }
        }

        try {
            switch (operation.state()) {
                case CANCELLED -> log.debug("{} cancelled", operation);
                case FAILED -> outcomeHandler.onOperationFailed(operation, operation.failure());
                case SUCCEEDED -> outcomeHandler.onOperationSucceeded(operation, operation.result());
                default -> throw new IllegalStateException("not terminal: " + operation);
            }
        } catch (RuntimeException e) {
            log.error("outcome handling for {} threw", operation, e);
        }
    }

    private static Integer requireValidLimit(Integer limit)
    {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, was " + limit);
        }
        return limit;
    }

    private enum RootGroup {
        INSTANCE;

        @Override
        public String toString() {
            return "<root>";
        }
    }
}
