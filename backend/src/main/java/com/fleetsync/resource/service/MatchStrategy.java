package com.fleetsync.resource.service;

import com.fleetsync.resource.model.Resource;
import java.util.List;
import java.util.Optional;

/**
 * One rule in the resource matching chain.
 */
public interface MatchStrategy {

    String name();

    /**
     * Returns the first candidate this rule accepts for the master resource.
     * Candidates are already restricted to destination resources nobody has claimed yet.
     */
    Optional<Resource> attemptMatch(Resource master, List<Resource> candidates);
}
