package com.fleetsync.resource.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only snapshot of a Qargo resource (driver, truck, trailer, ...) used as a matching anchor.
 *
 * <p>The license plate is stored normalized: uppercase with whitespace and punctuation removed.
 */
public record Resource(
    String id,
    String name,
    String licensePlate,
    Map<String, String> customFields
) {

    public Resource {
        name = name == null ? "" : name;
        licensePlate = normalizeLicensePlate(licensePlate);
        customFields = customFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
    }

    public String customField(String key) {
        String value = customFields.get(key);
        return value == null ? "" : value;
    }

    public static String normalizeLicensePlate(String licensePlate) {
        if (licensePlate == null) {
            return "";
        }
        return licensePlate.replaceAll("[^\\p{L}\\p{N}]", "").toUpperCase(Locale.ROOT);
    }
}
