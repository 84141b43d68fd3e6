package com.fleetsync.resource.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetsync.qargo.QargoApiClient;
import com.fleetsync.resource.model.Resource;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class QargoResourceSource implements ResourceSource {

    private static final List<String> LICENSED_KINDS = List.of("truck", "van", "tractor");

    private final QargoApiClient client;

    public QargoResourceSource(QargoApiClient client) {
        this.client = client;
    }

    @Override
    public String environment() {
        return client.getEnvironment();
    }

    @Override
    public void openSession() {
        client.ensureSession();
    }

    @Override
    public List<Resource> listResources() {
        List<Resource> resources = new ArrayList<>();
        for (JsonNode item : client.getResources()) {
            String id = item.path("id").asText("");
            if (id.isBlank()) {
                continue;
            }
            resources.add(new Resource(
                id,
                item.path("name").asText(""),
                licensePlate(item),
                customFields(item.path("custom_fields"))
            ));
        }
        return resources;
    }

    private String licensePlate(JsonNode item) {
        for (String kind : LICENSED_KINDS) {
            String plate = item.path(kind).path("license_plate").asText("");
            if (!plate.isBlank()) {
                return plate;
            }
        }
        return "";
    }

    private Map<String, String> customFields(JsonNode node) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (!node.isObject()) {
            return fields;
        }

        Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            fields.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return fields;
    }
}
