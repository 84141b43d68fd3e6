package com.fleetsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetsync.qargo.QargoApiClient;
import com.fleetsync.qargo.QargoProperties;
import com.fleetsync.qargo.QargoTokenProvider;
import com.fleetsync.resource.repository.QargoResourceSource;
import com.fleetsync.resource.service.CustomFieldMatchStrategy;
import com.fleetsync.resource.service.LicensePlateMatchStrategy;
import com.fleetsync.resource.service.MatchStrategy;
import com.fleetsync.resource.service.NameMatchStrategy;
import com.fleetsync.resource.service.ResourceMatcher;
import com.fleetsync.sync.service.SyncProperties;
import com.fleetsync.sync.service.UnavailabilitySyncService;
import com.fleetsync.unavailability.repository.QargoUnavailabilityRepository;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SyncConfig {

    public static final String MASTER = "master";
    public static final String LOCAL = "local";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResourceMatcher resourceMatcher(SyncProperties syncProperties) {
        List<MatchStrategy> strategies = new ArrayList<>();
        Map<String, List<String>> groups = syncProperties.getMatching().getCustomFieldGroups();
        if (groups != null) {
            groups.forEach((name, keys) -> strategies.add(new CustomFieldMatchStrategy(name, keys)));
        }
        strategies.add(new LicensePlateMatchStrategy());
        strategies.add(new NameMatchStrategy());
        return new ResourceMatcher(strategies);
    }

    @Bean
    public UnavailabilitySyncService unavailabilitySyncService(
        QargoProperties qargoProperties,
        SyncProperties syncProperties,
        ResourceMatcher resourceMatcher,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(Math.max(qargoProperties.getConnectTimeoutMs(), 1000)))
            .build();

        QargoApiClient masterClient = client(MASTER, qargoProperties.getMaster(), qargoProperties, objectMapper, httpClient, clock);
        QargoApiClient localClient = client(LOCAL, qargoProperties.getLocal(), qargoProperties, objectMapper, httpClient, clock);

        return new UnavailabilitySyncService(
            new QargoResourceSource(masterClient),
            new QargoResourceSource(localClient),
            new QargoUnavailabilityRepository(masterClient, objectMapper),
            new QargoUnavailabilityRepository(localClient, objectMapper),
            resourceMatcher,
            syncProperties,
            clock
        );
    }

    private QargoApiClient client(
        String environment,
        QargoProperties.Credentials credentials,
        QargoProperties properties,
        ObjectMapper objectMapper,
        HttpClient httpClient,
        Clock clock
    ) {
        QargoTokenProvider tokenProvider = new QargoTokenProvider(
            environment,
            credentials,
            properties,
            objectMapper,
            httpClient,
            clock
        );
        return new QargoApiClient(tokenProvider, properties, objectMapper, httpClient);
    }
}
