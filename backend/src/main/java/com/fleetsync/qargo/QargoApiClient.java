package com.fleetsync.qargo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class QargoApiClient {

    private static final Logger log = LoggerFactory.getLogger(QargoApiClient.class);

    private static final int MAX_PAGES = 10_000;

    private final QargoTokenProvider tokenProvider;
    private final QargoProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public QargoApiClient(
        QargoTokenProvider tokenProvider,
        QargoProperties properties,
        ObjectMapper objectMapper,
        HttpClient httpClient
    ) {
        this.tokenProvider = tokenProvider;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    public String getEnvironment() {
        return tokenProvider.getEnvironment();
    }

    public void ensureSession() {
        tokenProvider.getToken();
    }

    public List<JsonNode> getResources() {
        List<JsonNode> resources = paginatedGet("/resources/resource", Map.of());
        log.info("Retrieved {} resources from Qargo {}", resources.size(), getEnvironment());
        return resources;
    }

    public List<JsonNode> getUnavailabilities(String resourceId, Instant startTime) {
        Map<String, String> params = new LinkedHashMap<>();
        if (startTime != null) {
            params.put("start_time", startTime.toString());
        }

        List<JsonNode> unavailabilities = paginatedGet(unavailabilityPath(resourceId), params);
        log.debug(
            "Retrieved {} unavailabilities for resource {} from Qargo {}",
            unavailabilities.size(),
            resourceId,
            getEnvironment()
        );
        return unavailabilities;
    }

    public JsonNode createUnavailability(String resourceId, JsonNode payload) {
        return send("POST", unavailabilityPath(resourceId), payload);
    }

    public JsonNode updateUnavailability(String resourceId, String unavailabilityId, JsonNode payload) {
        if (unavailabilityId == null || unavailabilityId.isBlank()) {
            throw new IllegalArgumentException("Cannot update unavailability without an ID");
        }
        return send("PUT", unavailabilityPath(resourceId) + "/" + encode(unavailabilityId), payload);
    }

    public void deleteUnavailability(String resourceId, String unavailabilityId) {
        if (unavailabilityId == null || unavailabilityId.isBlank()) {
            throw new IllegalArgumentException("Cannot delete unavailability without an ID");
        }
        send("DELETE", unavailabilityPath(resourceId) + "/" + encode(unavailabilityId), null);
    }

    private List<JsonNode> paginatedGet(String path, Map<String, String> params) {
        List<JsonNode> items = new ArrayList<>();
        String cursor = null;

        for (int page = 0; page < MAX_PAGES; page++) {
            Map<String, String> pageParams = new LinkedHashMap<>(params);
            if (cursor != null) {
                pageParams.put("cursor", cursor);
            }

            JsonNode root = send("GET", path + query(pageParams), null);
            for (JsonNode item : root.path("items")) {
                items.add(item);
            }

            cursor = root.path("next_cursor").asText("");
            if (cursor.isBlank()) {
                return items;
            }
        }

        throw new ResponseStatusException(
            HttpStatus.BAD_GATEWAY,
            "Qargo " + getEnvironment() + " pagination did not terminate for " + path
        );
    }

    private JsonNode send(String method, String path, JsonNode payload) {
        URI uri = URI.create(normalizedBaseUrl() + path);

        HttpRequest.BodyPublisher body;
        try {
            body = payload == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new IllegalArgumentException("Failed to serialize Qargo request body", exception);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .method(method, body)
            .timeout(Duration.ofMillis(Math.max(properties.getReadTimeoutMs(), 3000)))
            .header("Accept", "application/json")
            .header("Authorization", "Bearer " + tokenProvider.getToken());
        if (payload != null) {
            builder.header("Content-Type", "application/json");
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException | InterruptedException exception) {
            if (exception instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Failed to call Qargo " + getEnvironment() + " " + method + " " + path + ": " + exception.getMessage(),
                exception
            );
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Qargo " + getEnvironment() + " " + method + " " + path + " returned status " + status
            );
        }

        String responseBody = response.body();
        if (responseBody == null || responseBody.isBlank()) {
            return objectMapper.createObjectNode();
        }

        try {
            return objectMapper.readTree(responseBody);
        } catch (IOException exception) {
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Failed to parse Qargo " + getEnvironment() + " response for " + path,
                exception
            );
        }
    }

    private String unavailabilityPath(String resourceId) {
        return "/resources/resource/" + encode(resourceId) + "/unavailability";
    }

    private String query(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }

        StringBuilder query = new StringBuilder("?");
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (query.length() > 1) {
                query.append('&');
            }
            query.append(encode(param.getKey())).append('=').append(encode(param.getValue()));
        }
        return query.toString();
    }

    private String normalizedBaseUrl() {
        String base = properties.getBaseUrl() == null ? "" : properties.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
