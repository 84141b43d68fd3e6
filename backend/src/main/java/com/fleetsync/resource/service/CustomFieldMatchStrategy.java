package com.fleetsync.resource.service;

import com.fleetsync.resource.model.Resource;
import java.util.List;
import java.util.Optional;

/**
 * Matches when every designated custom field is non-empty on both sides and equal (case-sensitive).
 */
public class CustomFieldMatchStrategy implements MatchStrategy {

    private final String name;
    private final List<String> fieldKeys;

    public CustomFieldMatchStrategy(String name, List<String> fieldKeys) {
        if (fieldKeys == null || fieldKeys.isEmpty()) {
            throw new IllegalArgumentException("Custom field match group '" + name + "' has no field keys");
        }
        this.name = name;
        this.fieldKeys = List.copyOf(fieldKeys);
    }

    @Override
    public String name() {
        return "custom-field:" + name;
    }

    @Override
    public Optional<Resource> attemptMatch(Resource master, List<Resource> candidates) {
        for (String key : fieldKeys) {
            if (master.customField(key).isEmpty()) {
                return Optional.empty();
            }
        }

        return candidates.stream()
            .filter(candidate -> fieldKeys.stream().allMatch(key -> master.customField(key).equals(candidate.customField(key))))
            .findFirst();
    }
}
