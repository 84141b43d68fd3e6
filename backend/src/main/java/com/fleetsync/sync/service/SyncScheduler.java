package com.fleetsync.sync.service;

import com.fleetsync.sync.dto.SyncRunResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

@Component
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncStatusService syncStatusService;
    private final SyncProperties properties;

    public SyncScheduler(SyncStatusService syncStatusService, SyncProperties properties) {
        this.syncStatusService = syncStatusService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runAtStartup() {
        if (!properties.isEnabled() || !properties.isStartupEnabled()) {
            log.info("Unavailability startup sync skipped (enabled={}, startupEnabled={})", properties.isEnabled(), properties.isStartupEnabled());
            return;
        }
        runSync("startup");
    }

    @Scheduled(cron = "#{@syncProperties.cron}", zone = "#{@syncProperties.zone}")
    public void runBySchedule() {
        if (!properties.isEnabled() || !properties.isScheduledEnabled()) {
            return;
        }
        runSync("scheduled");
    }

    void runSync(String trigger) {
        try {
            SyncRunResponse run = syncStatusService.runWithStatus(trigger);
            log.info(
                "Unavailability sync finished (trigger={}, created={}, updated={}, deleted={}, unchanged={}, errors={})",
                trigger,
                run.created(),
                run.updated(),
                run.deleted(),
                run.unchanged(),
                run.errors()
            );
        } catch (ResponseStatusException exception) {
            if (exception.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                log.warn("Unavailability sync skipped because previous sync is still running (trigger={})", trigger);
                return;
            }
            log.error("Unavailability sync aborted (trigger={}): {}", trigger, exception.getReason());
        } catch (Exception exception) {
            log.error("Unavailability sync aborted (trigger={}): {}", trigger, exception.getMessage(), exception);
        }
    }
}
