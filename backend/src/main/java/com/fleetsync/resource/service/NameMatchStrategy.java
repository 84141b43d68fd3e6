package com.fleetsync.resource.service;

import com.fleetsync.resource.model.Resource;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class NameMatchStrategy implements MatchStrategy {

    @Override
    public String name() {
        return "name";
    }

    @Override
    public Optional<Resource> attemptMatch(Resource master, List<Resource> candidates) {
        String masterName = normalize(master.name());
        if (masterName.isEmpty()) {
            return Optional.empty();
        }

        return candidates.stream()
            .filter(candidate -> masterName.equals(normalize(candidate.name())))
            .findFirst();
    }

    private String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
