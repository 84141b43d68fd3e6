package com.fleetsync.qargo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class QargoApiClientTest {

    @Mock
    private QargoTokenProvider tokenProvider;

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> firstPage;

    @Mock
    private HttpResponse<String> secondPage;

    private QargoApiClient client;

    @BeforeEach
    void setUp() {
        QargoProperties properties = new QargoProperties();
        properties.setBaseUrl("https://qargo.test/v1/");
        lenient().when(tokenProvider.getEnvironment()).thenReturn("local");
        lenient().when(tokenProvider.getToken()).thenReturn("token-123");
        client = new QargoApiClient(tokenProvider, properties, new ObjectMapper(), httpClient);
    }

    @Test
    void getResources_should_follow_cursor_until_exhausted() throws Exception {
        when(firstPage.statusCode()).thenReturn(200);
        when(firstPage.body()).thenReturn("{\"items\":[{\"id\":\"r1\"}],\"next_cursor\":\"c2\"}");
        when(secondPage.statusCode()).thenReturn(200);
        when(secondPage.body()).thenReturn("{\"items\":[{\"id\":\"r2\"},{\"id\":\"r3\"}],\"next_cursor\":null}");
        doReturn(firstPage, secondPage).when(httpClient).send(any(HttpRequest.class), any());

        List<JsonNode> resources = client.getResources();

        assertThat(resources).extracting(node -> node.path("id").asText()).containsExactly("r1", "r2", "r3");

        ArgumentCaptor<HttpRequest> requests = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(requests.capture(), any());
        assertThat(requests.getAllValues().get(0).uri().toString())
            .isEqualTo("https://qargo.test/v1/resources/resource");
        assertThat(requests.getAllValues().get(1).uri().toString())
            .isEqualTo("https://qargo.test/v1/resources/resource?cursor=c2");
        assertThat(requests.getAllValues().get(0).headers().firstValue("Authorization")).contains("Bearer token-123");
    }

    @Test
    void getUnavailabilities_should_filter_from_window_start() throws Exception {
        when(firstPage.statusCode()).thenReturn(200);
        when(firstPage.body()).thenReturn("{\"items\":[],\"next_cursor\":\"\"}");
        doReturn(firstPage).when(httpClient).send(any(HttpRequest.class), any());

        client.getUnavailabilities("L1", Instant.parse("2025-01-01T00:00:00Z"));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString())
            .isEqualTo("https://qargo.test/v1/resources/resource/L1/unavailability?start_time=2025-01-01T00%3A00%3A00Z");
    }

    @Test
    void createUnavailability_should_post_to_resource_collection() throws Exception {
        when(firstPage.statusCode()).thenReturn(201);
        when(firstPage.body()).thenReturn("{\"id\":\"u-1\"}");
        doReturn(firstPage).when(httpClient).send(any(HttpRequest.class), any());

        JsonNode created = client.createUnavailability("L1", new ObjectMapper().createObjectNode().put("reason", "sick"));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().headers().firstValue("Content-Type")).contains("application/json");
        assertThat(created.path("id").asText()).isEqualTo("u-1");
    }

    @Test
    void deleteUnavailability_should_accept_empty_body() throws Exception {
        when(firstPage.statusCode()).thenReturn(204);
        when(firstPage.body()).thenReturn("");
        doReturn(firstPage).when(httpClient).send(any(HttpRequest.class), any());

        client.deleteUnavailability("L1", "u-1");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("DELETE");
        assertThat(request.getValue().uri().getPath()).isEqualTo("/v1/resources/resource/L1/unavailability/u-1");
    }

    @Test
    void send_should_map_error_status_to_bad_gateway() throws Exception {
        when(firstPage.statusCode()).thenReturn(422);
        doReturn(firstPage).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.getResources())
            .isInstanceOf(ResponseStatusException.class)
            .satisfies(error -> assertThat(((ResponseStatusException) error).getStatusCode().value()).isEqualTo(502))
            .hasMessageContaining("422");
    }

    @Test
    void send_should_map_io_failure_to_bad_gateway() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.deleteUnavailability("L1", "u-1"))
            .isInstanceOf(ResponseStatusException.class)
            .hasMessageContaining("connection reset");
    }

    @Test
    void updateUnavailability_should_require_an_id() {
        assertThatThrownBy(() -> client.updateUnavailability("L1", null, new ObjectMapper().createObjectNode()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
