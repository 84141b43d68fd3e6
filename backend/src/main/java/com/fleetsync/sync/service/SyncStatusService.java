package com.fleetsync.sync.service;

import com.fleetsync.sync.dto.SyncRunResponse;
import com.fleetsync.sync.dto.SyncStatusResponse;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class SyncStatusService {

    private final UnavailabilitySyncService unavailabilitySyncService;
    private final Clock clock;
    private final SyncRunStatus status = new SyncRunStatus();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SyncStatusService(UnavailabilitySyncService unavailabilitySyncService, Clock clock) {
        this.unavailabilitySyncService = unavailabilitySyncService;
        this.clock = clock;
    }

    public SyncStatusResponse getSyncStatus() {
        synchronized (status) {
            return new SyncStatusResponse(
                OffsetDateTime.now(clock),
                status.getLastResult(),
                status.getLastTrigger(),
                status.getLastRunAt(),
                status.getLastSuccessAt(),
                status.getLastFailureAt(),
                status.getLastMessage(),
                status.getLastRun(),
                status.getConsecutiveFailureCount(),
                running.get()
            );
        }
    }

    public SyncRunResponse runWithStatus(String trigger) {
        if (!running.compareAndSet(false, true)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "A sync run is already in progress");
        }

        OffsetDateTime runAt = OffsetDateTime.now(clock);
        try {
            SyncRunResponse response = unavailabilitySyncService.run();
            synchronized (status) {
                status.markSuccess(trigger, "Unavailability sync completed", response, runAt);
            }
            return response;
        } catch (RuntimeException exception) {
            synchronized (status) {
                status.markFailure(trigger, rootMessage(exception), runAt);
            }
            throw exception;
        } finally {
            running.set(false);
        }
    }

    private String rootMessage(Throwable throwable) {
        if (throwable instanceof ResponseStatusException statusException && statusException.getReason() != null) {
            return statusException.getReason();
        }

        Throwable cursor = throwable;
        while (cursor.getCause() != null) {
            cursor = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getMessage();
        }
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }
}
