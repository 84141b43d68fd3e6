package com.fleetsync.resource.service;

import com.fleetsync.resource.model.Resource;
import java.util.List;
import java.util.Optional;

public class LicensePlateMatchStrategy implements MatchStrategy {

    @Override
    public String name() {
        return "license-plate";
    }

    @Override
    public Optional<Resource> attemptMatch(Resource master, List<Resource> candidates) {
        String plate = master.licensePlate();
        if (plate.isEmpty()) {
            return Optional.empty();
        }

        return candidates.stream()
            .filter(candidate -> plate.equals(candidate.licensePlate()))
            .findFirst();
    }
}
