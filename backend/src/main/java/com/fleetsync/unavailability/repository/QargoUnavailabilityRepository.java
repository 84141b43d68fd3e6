package com.fleetsync.unavailability.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetsync.qargo.QargoApiClient;
import com.fleetsync.unavailability.model.Unavailability;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public class QargoUnavailabilityRepository implements UnavailabilityRepository {

    private final QargoApiClient client;
    private final ObjectMapper objectMapper;

    public QargoUnavailabilityRepository(QargoApiClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Unavailability> getAllForResource(String resourceId, Instant startTime) {
        List<Unavailability> unavailabilities = new ArrayList<>();
        for (JsonNode item : client.getUnavailabilities(resourceId, startTime)) {
            unavailabilities.add(toUnavailability(resourceId, item));
        }
        return unavailabilities;
    }

    @Override
    public Unavailability create(Unavailability unavailability) {
        JsonNode created = client.createUnavailability(unavailability.resourceId(), toPayload(unavailability));
        String assignedId = text(created, "id");
        return unavailability.withId(assignedId.isBlank() ? null : assignedId);
    }

    @Override
    public Unavailability update(Unavailability unavailability) {
        if (unavailability.id() == null || unavailability.id().isBlank()) {
            throw new IllegalArgumentException("Cannot update unavailability without ID");
        }
        client.updateUnavailability(unavailability.resourceId(), unavailability.id(), toPayload(unavailability));
        return unavailability;
    }

    @Override
    public void delete(String resourceId, String unavailabilityId) {
        client.deleteUnavailability(resourceId, unavailabilityId);
    }

    private Unavailability toUnavailability(String resourceId, JsonNode item) {
        String id = text(item, "id");
        String externalId = text(item, "external_id");
        String startTime = text(item, "start_time");
        if (startTime.isBlank()) {
            throw new IllegalArgumentException(
                "Unavailability " + (id.isBlank() ? "<no id>" : id) + " of resource " + resourceId + " has no start_time"
            );
        }
        return new Unavailability(
            id.isBlank() ? null : id,
            resourceId,
            externalId.isBlank() ? null : externalId,
            parseTimestamp(startTime),
            parseTimestamp(text(item, "end_time")),
            text(item, "reason"),
            text(item, "description")
        );
    }

    private ObjectNode toPayload(Unavailability unavailability) {
        ObjectNode payload = objectMapper.createObjectNode();
        if (unavailability.externalId() != null) {
            payload.put("external_id", unavailability.externalId());
        }
        payload.put("start_time", formatTimestamp(unavailability.startTime()));
        payload.put("end_time", formatTimestamp(unavailability.endTime()));
        payload.put("reason", unavailability.reason());
        payload.put("description", unavailability.description());
        return payload;
    }

    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException exception) {
                throw new IllegalArgumentException("Unparsable unavailability timestamp: " + value, exception);
            }
        }
    }

    private String formatTimestamp(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNull() || value.isMissingNode() ? "" : value.asText("").trim();
    }
}
