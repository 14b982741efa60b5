package com.questrail.supervision.service;

/**
 * A unit of asynchronous work run under supervision.
 *
 * <p>Cancellation is cooperative. A running operation is told about a
 * cancellation request through its {@link OperationContext} and through an
 * interrupt of the thread running it. Blocking calls that honour interrupts
 * (for instance {@code DataEvent.await()}) end the operation promptly; long
 * computations should poll {@link OperationContext#throwIfCancellationRequested()}.</p>
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface Operation<T>
{
    T run(OperationContext context) throws Exception;
}
