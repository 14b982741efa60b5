/**
 * Netty-backed scheduling.
 *
 * <p>Netty types MUST NOT escape this package. Everything above it sees only
 * {@link com.questrail.supervision.internal.time.OperationScheduler} and
 * {@link com.questrail.supervision.internal.time.Cancellable}.</p>
 */
package com.questrail.supervision.internal.time.netty;
