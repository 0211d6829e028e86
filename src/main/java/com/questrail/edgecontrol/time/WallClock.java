package com.questrail.edgecontrol.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Calendar time. Used to age sensor samples and backups, to test time-of-day
 * windows and to stamp records. It may jump; operational bounds use
 * {@link MonotonicClock}.
 */
public interface WallClock
{
    Instant now();
}
