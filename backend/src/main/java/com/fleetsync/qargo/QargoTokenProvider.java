package com.fleetsync.qargo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Client-credentials session for one Qargo environment.
 *
 * <p>Tokens are kept in memory and, when a cache file is configured, shared across process
 * starts through a JSON file keyed by client id.
 */
public class QargoTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(QargoTokenProvider.class);

    private final String environment;
    private final QargoProperties.Credentials credentials;
    private final QargoProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Clock clock;

    private String token;
    private Instant expiresAt = Instant.EPOCH;

    public QargoTokenProvider(
        String environment,
        QargoProperties.Credentials credentials,
        QargoProperties properties,
        ObjectMapper objectMapper,
        HttpClient httpClient,
        Clock clock
    ) {
        this.environment = environment;
        this.credentials = credentials;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    public String getEnvironment() {
        return environment;
    }

    public synchronized String getToken() {
        if (!credentials.isConfigured()) {
            throw new ResponseStatusException(
                HttpStatus.BAD_REQUEST,
                "Qargo " + environment + " credentials are not configured"
            );
        }

        if (isValid()) {
            return token;
        }

        loadCachedToken();
        if (isValid()) {
            return token;
        }

        fetchToken();
        saveCachedToken();
        return token;
    }

    private boolean isValid() {
        return token != null && clock.instant().isBefore(expiresAt);
    }

    private void fetchToken() {
        String encoded = Base64.getEncoder().encodeToString(
            (credentials.getClientId() + ":" + credentials.getClientSecret()).getBytes(StandardCharsets.UTF_8)
        );

        HttpRequest request = HttpRequest.newBuilder(URI.create(properties.getAuthUrl()))
            .POST(HttpRequest.BodyPublishers.noBody())
            .timeout(Duration.ofMillis(Math.max(properties.getReadTimeoutMs(), 3000)))
            .header("Content-Type", "application/json")
            .header("Authorization", "Basic " + encoded)
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException | InterruptedException exception) {
            if (exception instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ResponseStatusException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Qargo auth endpoint unreachable for " + environment + ": " + exception.getMessage(),
                exception
            );
        }

        int status = response.statusCode();
        if (status == 400 || status == 401 || status == 403) {
            throw new ResponseStatusException(
                HttpStatus.UNAUTHORIZED,
                "Qargo " + environment + " credential rejected (status " + status + ")"
            );
        }
        if (status != 200) {
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Fetching Qargo " + environment + " token failed: " + status + " - " + response.body()
            );
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (IOException exception) {
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Failed to parse Qargo " + environment + " token response",
                exception
            );
        }

        String accessToken = root == null ? "" : root.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Qargo " + environment + " token response has no access_token"
            );
        }

        long expiresIn = root.path("expires_in").asLong(0);
        if (expiresIn <= 0) {
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Qargo " + environment + " token response has no expires_in"
            );
        }

        // buffer never eats more than half of the token lifetime
        long refreshBuffer = Math.min(Math.max(properties.getTokenRefreshBufferSeconds(), 0), expiresIn / 2);
        this.token = accessToken;
        this.expiresAt = clock.instant()
            .plusSeconds(expiresIn)
            .minusSeconds(refreshBuffer);
        log.debug("Fetched new Qargo {} token, expires at {}", environment, expiresAt);
    }

    private void loadCachedToken() {
        Path cacheFile = cacheFile();
        if (cacheFile == null) {
            return;
        }

        JsonNode entry = readCacheFile(cacheFile).path(credentials.getClientId());
        String cachedToken = entry.path("token").asText("");
        Instant cachedExpiry = Instant.ofEpochSecond(entry.path("token_expiry_time").asLong(0));
        if (!cachedToken.isBlank() && clock.instant().isBefore(cachedExpiry)) {
            this.token = cachedToken;
            this.expiresAt = cachedExpiry;
            log.debug("Loaded cached Qargo {} token, expires at {}", environment, cachedExpiry);
        }
    }

    private void saveCachedToken() {
        Path cacheFile = cacheFile();
        if (cacheFile == null) {
            return;
        }

        try {
            ObjectNode cache = readCacheFile(cacheFile);
            ObjectNode entry = cache.putObject(credentials.getClientId());
            entry.put("token", token);
            entry.put("token_expiry_time", expiresAt.getEpochSecond());
            Files.writeString(
                cacheFile,
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(cache),
                StandardCharsets.UTF_8
            );
            log.debug("Qargo {} token cached in {}", environment, cacheFile);
        } catch (IOException exception) {
            log.error("Could not write Qargo token cache {}: {}", cacheFile, exception.getMessage());
        }
    }

    private ObjectNode readCacheFile(Path cacheFile) {
        if (!Files.exists(cacheFile)) {
            return objectMapper.createObjectNode();
        }

        try {
            JsonNode root = objectMapper.readTree(Files.readString(cacheFile, StandardCharsets.UTF_8));
            if (root instanceof ObjectNode objectNode) {
                return objectNode;
            }
        } catch (IOException exception) {
            log.warn("Failed to read Qargo token cache {}: {}", cacheFile, exception.getMessage());
        }
        return objectMapper.createObjectNode();
    }

    private Path cacheFile() {
        String configured = properties.getTokenCacheFile();
        if (configured == null || configured.isBlank()) {
            return null;
        }
        return Path.of(configured).toAbsolutePath().normalize();
    }
}
