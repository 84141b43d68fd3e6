package com.fleetsync.sync.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fleetsync.common.GlobalExceptionHandler;
import com.fleetsync.sync.dto.SyncRunResponse;
import com.fleetsync.sync.dto.SyncStatusResponse;
import com.fleetsync.sync.service.SyncStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class SyncControllerTest {

    @Mock
    private SyncStatusService syncStatusService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SyncController(syncStatusService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void runSync_should_return_run_summary() throws Exception {
        when(syncStatusService.runWithStatus("manual-api"))
            .thenReturn(new SyncRunResponse(2025, 1, 2, 3, 4, 0, 5, 6, 1));

        mockMvc.perform(post("/api/sync/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.targetYear").value(2025))
            .andExpect(jsonPath("$.created").value(1))
            .andExpect(jsonPath("$.deleted").value(3))
            .andExpect(jsonPath("$.matchedResources").value(5))
            .andExpect(jsonPath("$.totalMasterResources").value(6));
    }

    @Test
    void runSync_should_answer_conflict_while_a_run_is_in_flight() throws Exception {
        when(syncStatusService.runWithStatus("manual-api"))
            .thenThrow(new ResponseStatusException(HttpStatus.CONFLICT, "A sync run is already in progress"));

        mockMvc.perform(post("/api/sync/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value(409))
            .andExpect(jsonPath("$.error").value("Conflict"))
            .andExpect(jsonPath("$.message").value("A sync run is already in progress"))
            .andExpect(jsonPath("$.path").value("/api/sync/run"));
    }

    @Test
    void runSync_should_surface_authentication_failure() throws Exception {
        when(syncStatusService.runWithStatus("manual-api"))
            .thenThrow(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Qargo master credential rejected (status 401)"));

        mockMvc.perform(post("/api/sync/run"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("Qargo master credential rejected (status 401)"));
    }

    @Test
    void getSyncStatus_should_expose_last_run() throws Exception {
        when(syncStatusService.getSyncStatus()).thenReturn(new SyncStatusResponse(
            null,
            "FAILURE",
            "scheduled",
            null,
            null,
            null,
            "Qargo local auth endpoint unreachable",
            new SyncRunResponse(2025, 0, 0, 0, 7, 0, 3, 3, 0),
            2,
            false
        ));

        mockMvc.perform(get("/api/sync/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lastResult").value("FAILURE"))
            .andExpect(jsonPath("$.lastTrigger").value("scheduled"))
            .andExpect(jsonPath("$.lastMessage").value("Qargo local auth endpoint unreachable"))
            .andExpect(jsonPath("$.lastRun.unchanged").value(7))
            .andExpect(jsonPath("$.consecutiveFailureCount").value(2))
            .andExpect(jsonPath("$.running").value(false));
    }
}
