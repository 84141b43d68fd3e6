package com.fleetsync.sync.dto;

import java.time.OffsetDateTime;

public record SyncStatusResponse(
    OffsetDateTime checkedAt,
    String lastResult,
    String lastTrigger,
    OffsetDateTime lastRunAt,
    OffsetDateTime lastSuccessAt,
    OffsetDateTime lastFailureAt,
    String lastMessage,
    SyncRunResponse lastRun,
    int consecutiveFailureCount,
    boolean running
) {
}
