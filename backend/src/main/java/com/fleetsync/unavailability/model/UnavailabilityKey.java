package com.fleetsync.unavailability.model;

import java.time.Instant;

/**
 * Identifies the same occurrence on both sides; the destination id is deliberately not part of it.
 */
public record UnavailabilityKey(
    String resourceId,
    Instant startTime,
    Instant endTime,
    String reason
) {
}
