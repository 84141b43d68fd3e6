package com.fleetsync.unavailability.model;

import java.time.Clock;
import java.time.Instant;
import java.time.Year;
import java.time.ZoneId;

/**
 * Calendar year in scope for a run. Only records starting inside it take part in reconciliation.
 */
public record SyncWindow(
    Year year,
    ZoneId zone
) {

    public static SyncWindow of(Integer targetYear, ZoneId zone, Clock clock) {
        Year year = targetYear == null ? Year.now(clock.withZone(zone)) : Year.of(targetYear);
        return new SyncWindow(year, zone);
    }

    public Instant start() {
        return year.atDay(1).atStartOfDay(zone).toInstant();
    }

    public Instant end() {
        return year.plusYears(1).atDay(1).atStartOfDay(zone).toInstant();
    }

    public boolean contains(Unavailability unavailability) {
        Instant startTime = unavailability.startTime();
        return startTime != null && !startTime.isBefore(start()) && startTime.isBefore(end());
    }
}
