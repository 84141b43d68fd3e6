package com.fleetsync.resource.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Master resource id to destination resource id, in master order, plus the master ids nothing matched.
 */
public record MatchResult(
    Map<String, String> matches,
    List<String> unmatchedMasterIds
) {

    public MatchResult {
        matches = Collections.unmodifiableMap(new LinkedHashMap<>(matches));
        unmatchedMasterIds = List.copyOf(unmatchedMasterIds);
    }

    public List<ResourcePair> pairs() {
        List<ResourcePair> pairs = new ArrayList<>(matches.size());
        matches.forEach((masterId, localId) -> pairs.add(new ResourcePair(masterId, localId)));
        return pairs;
    }

    public int matchedCount() {
        return matches.size();
    }

    public int totalMasterCount() {
        return matches.size() + unmatchedMasterIds.size();
    }
}
