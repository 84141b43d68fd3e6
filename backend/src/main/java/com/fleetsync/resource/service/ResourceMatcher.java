package com.fleetsync.resource.service;

import com.fleetsync.resource.model.MatchResult;
import com.fleetsync.resource.model.Resource;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs master resources with destination resources by running an ordered strategy chain.
 *
 * <p>Master resources are processed in input order. A destination resource claimed by one
 * master resource is no longer a candidate for the ones that follow.
 */
public class ResourceMatcher {

    private static final Logger log = LoggerFactory.getLogger(ResourceMatcher.class);

    private final List<MatchStrategy> strategies;

    public ResourceMatcher(List<MatchStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public MatchResult match(List<Resource> masterResources, List<Resource> localResources) {
        List<Resource> candidates = distinctById(localResources);
        Map<String, String> matches = new LinkedHashMap<>();
        List<String> unmatched = new ArrayList<>();
        Set<String> seenMasterIds = new HashSet<>();

        for (Resource master : masterResources) {
            if (!seenMasterIds.add(master.id())) {
                continue;
            }

            Optional<Resource> claimed = findMatch(master, candidates);
            if (claimed.isPresent()) {
                matches.put(master.id(), claimed.get().id());
                candidates.remove(claimed.get());
            } else {
                unmatched.add(master.id());
                log.warn("No match found for master resource: id={}, name={}", master.id(), master.name());
            }
        }

        log.info("Matched {} out of {} master resources", matches.size(), matches.size() + unmatched.size());
        return new MatchResult(matches, unmatched);
    }

    private Optional<Resource> findMatch(Resource master, List<Resource> candidates) {
        for (MatchStrategy strategy : strategies) {
            Optional<Resource> match = strategy.attemptMatch(master, candidates);
            if (match.isPresent()) {
                log.debug("Matched master {} to local {} by {}", master.id(), match.get().id(), strategy.name());
                return match;
            }
        }
        return Optional.empty();
    }

    private List<Resource> distinctById(List<Resource> resources) {
        List<Resource> distinct = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Resource resource : resources) {
            if (seen.add(resource.id())) {
                distinct.add(resource);
            }
        }
        return distinct;
    }
}
