package com.fleetsync.unavailability.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A period during which a resource cannot be planned.
 *
 * <p>{@code id} is the destination-side id and is null until the destination assigns one.
 * {@code externalId} points at the master record a destination record was copied from.
 */
public record Unavailability(
    String id,
    String resourceId,
    String externalId,
    Instant startTime,
    Instant endTime,
    String reason,
    String description
) {

    public Unavailability {
        reason = reason == null ? "" : reason;
        description = description == null ? "" : description;
    }

    public UnavailabilityKey key() {
        return new UnavailabilityKey(resourceId, startTime, endTime, reason);
    }

    public Unavailability withId(String newId) {
        return new Unavailability(newId, resourceId, externalId, startTime, endTime, reason, description);
    }

    /**
     * Copy of this master record addressed to a destination resource and linked back to its master id.
     */
    public Unavailability toDestination(String destinationResourceId, String destinationId) {
        return new Unavailability(destinationId, destinationResourceId, id, startTime, endTime, reason, description);
    }

    public boolean sameMutableFields(Unavailability other) {
        return Objects.equals(description, other.description) && Objects.equals(externalId, other.externalId);
    }
}
