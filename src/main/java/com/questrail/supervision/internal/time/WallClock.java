package com.questrail.supervision.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly to timestamp diagnostic records.
 * It MUST NOT drive delays or timeouts.
 */
public interface WallClock
{
    Instant now();
}
