package com.fleetsync.sync.service;

import com.fleetsync.sync.dto.SyncRunResponse;
import java.time.OffsetDateTime;
import lombok.Getter;

@Getter
public class SyncRunStatus {

    private static final int MAX_MESSAGE_LENGTH = 2000;

    private String lastResult = "NEVER";
    private String lastTrigger = "";
    private OffsetDateTime lastRunAt;
    private OffsetDateTime lastSuccessAt;
    private OffsetDateTime lastFailureAt;
    private String lastMessage = "No sync has run yet";
    private SyncRunResponse lastRun;
    private int consecutiveFailureCount;

    public void markSuccess(String trigger, String message, SyncRunResponse run, OffsetDateTime runAt) {
        this.lastResult = "SUCCESS";
        this.lastTrigger = safe(trigger);
        this.lastRunAt = runAt;
        this.lastSuccessAt = runAt;
        this.lastMessage = trim(message);
        this.lastRun = run;
        this.consecutiveFailureCount = 0;
    }

    public void markFailure(String trigger, String message, OffsetDateTime runAt) {
        this.lastResult = "FAILURE";
        this.lastTrigger = safe(trigger);
        this.lastRunAt = runAt;
        this.lastFailureAt = runAt;
        this.lastMessage = trim(message);
        this.consecutiveFailureCount++;
    }

    private String safe(String value) {
        return value == null ? "" : value.trim();
    }

    private String trim(String message) {
        String value = safe(message);
        if (value.length() <= MAX_MESSAGE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_MESSAGE_LENGTH);
    }
}
