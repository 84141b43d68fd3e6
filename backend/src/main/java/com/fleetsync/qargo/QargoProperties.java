package com.fleetsync.qargo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "qargo")
public class QargoProperties {

    private String baseUrl = "https://api.qargo.io/v1";

    private String authUrl = "https://api.qargo.com/v1/auth/token";

    private int connectTimeoutMs = 5000;

    private int readTimeoutMs = 15000;

    /**
     * Seconds subtracted from expires_in so a token is renewed before the API rejects it
     */
    private long tokenRefreshBufferSeconds = 60;

    /**
     * JSON file shared between process starts; blank disables the file cache
     */
    private String tokenCacheFile = ".qargo_token.json";

    private Credentials master = new Credentials();

    private Credentials local = new Credentials();

    @Getter
    @Setter
    public static class Credentials {

        private String clientId = "";

        private String clientSecret = "";

        public boolean isConfigured() {
            return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
        }
    }
}
