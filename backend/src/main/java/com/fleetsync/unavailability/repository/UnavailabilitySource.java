package com.fleetsync.unavailability.repository;

import com.fleetsync.unavailability.model.Unavailability;
import java.time.Instant;
import java.util.List;

public interface UnavailabilitySource {

    List<Unavailability> getAllForResource(String resourceId, Instant startTime);
}
