package com.fleetsync.sync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.fleetsync.sync.dto.SyncRunResponse;
import com.fleetsync.sync.dto.SyncStatusResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class SyncStatusServiceTest {

    @Mock
    private UnavailabilitySyncService unavailabilitySyncService;

    private SyncStatusService syncStatusService;

    @BeforeEach
    void setUp() {
        syncStatusService = new SyncStatusService(
            unavailabilitySyncService,
            Clock.fixed(Instant.parse("2025-06-01T02:00:00Z"), ZoneOffset.UTC)
        );
    }

    @Test
    void getSyncStatus_should_report_never_before_first_run() {
        SyncStatusResponse status = syncStatusService.getSyncStatus();

        assertThat(status.lastResult()).isEqualTo("NEVER");
        assertThat(status.lastRun()).isNull();
        assertThat(status.running()).isFalse();
    }

    @Test
    void runWithStatus_should_record_successful_run_summary() {
        SyncRunResponse run = new SyncRunResponse(2025, 1, 0, 1, 3, 0, 4, 5, 1);
        when(unavailabilitySyncService.run()).thenReturn(run);

        syncStatusService.runWithStatus("manual-api");
        SyncStatusResponse status = syncStatusService.getSyncStatus();

        assertThat(status.lastResult()).isEqualTo("SUCCESS");
        assertThat(status.lastTrigger()).isEqualTo("manual-api");
        assertThat(status.lastRun()).isEqualTo(run);
        assertThat(status.lastSuccessAt()).isNotNull();
        assertThat(status.consecutiveFailureCount()).isZero();
    }

    @Test
    void runWithStatus_should_record_failure_and_rethrow() {
        when(unavailabilitySyncService.run())
            .thenThrow(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Qargo master credential rejected (status 401)"));

        assertThatThrownBy(() -> syncStatusService.runWithStatus("scheduled"))
            .isInstanceOf(ResponseStatusException.class);
        assertThatThrownBy(() -> syncStatusService.runWithStatus("scheduled"))
            .isInstanceOf(ResponseStatusException.class);

        SyncStatusResponse status = syncStatusService.getSyncStatus();
        assertThat(status.lastResult()).isEqualTo("FAILURE");
        assertThat(status.lastMessage()).isEqualTo("Qargo master credential rejected (status 401)");
        assertThat(status.consecutiveFailureCount()).isEqualTo(2);
        assertThat(status.running()).isFalse();
    }

    @Test
    void runWithStatus_should_reject_a_second_run_while_one_is_in_flight() {
        AtomicReference<Throwable> nested = new AtomicReference<>();
        when(unavailabilitySyncService.run()).thenAnswer(invocation -> {
            try {
                syncStatusService.runWithStatus("manual-api");
            } catch (ResponseStatusException exception) {
                nested.set(exception);
            }
            return new SyncRunResponse(2025, 0, 0, 0, 0, 0, 0, 0, 0);
        });

        syncStatusService.runWithStatus("startup");

        assertThat(nested.get())
            .isInstanceOf(ResponseStatusException.class)
            .satisfies(error -> assertThat(((ResponseStatusException) error).getStatusCode().value()).isEqualTo(409));
    }
}
