package com.fleetsync.sync.controller;

import com.fleetsync.sync.dto.SyncRunResponse;
import com.fleetsync.sync.dto.SyncStatusResponse;
import com.fleetsync.sync.service.SyncStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final SyncStatusService syncStatusService;

    public SyncController(SyncStatusService syncStatusService) {
        this.syncStatusService = syncStatusService;
    }

    @GetMapping("/status")
    public SyncStatusResponse getSyncStatus() {
        return syncStatusService.getSyncStatus();
    }

    @PostMapping("/run")
    public SyncRunResponse runSync() {
        return syncStatusService.runWithStatus("manual-api");
    }
}
