package com.fleetsync.unavailability.repository;

import com.fleetsync.unavailability.model.Unavailability;

/**
 * Read/write access to the destination environment's unavailabilities.
 */
public interface UnavailabilityRepository extends UnavailabilitySource {

    /**
     * @return the record with the id the destination assigned
     */
    Unavailability create(Unavailability unavailability);

    Unavailability update(Unavailability unavailability);

    void delete(String resourceId, String unavailabilityId);
}
