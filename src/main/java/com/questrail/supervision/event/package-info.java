/**
 * Single-Assignment Events
 * =============================================================================
 *
 * {@link com.questrail.supervision.event.DataEvent} hands one outcome from one
 * producer to any number of waiters, once per cycle.
 *
 * <h2>Cycles</h2>
 * <ul>
 *   <li>A cycle resolves at most once, with a value or with a failure.</li>
 *   <li>{@code reset()} abandons the current cycle and starts a new one.</li>
 *   <li>Waiters and completion stages are bound to the cycle they were
 *       obtained in and never observe a later one.</li>
 * </ul>
 */
package com.questrail.supervision.event;
