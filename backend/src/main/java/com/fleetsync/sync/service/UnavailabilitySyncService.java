package com.fleetsync.sync.service;

import com.fleetsync.resource.model.MatchResult;
import com.fleetsync.resource.model.Resource;
import com.fleetsync.resource.model.ResourcePair;
import com.fleetsync.resource.repository.ResourceSource;
import com.fleetsync.resource.service.ResourceMatcher;
import com.fleetsync.sync.dto.SyncRunResponse;
import com.fleetsync.unavailability.model.ReconciliationPlan;
import com.fleetsync.unavailability.model.SyncWindow;
import com.fleetsync.unavailability.model.Unavailability;
import com.fleetsync.unavailability.repository.UnavailabilityRepository;
import com.fleetsync.unavailability.repository.UnavailabilitySource;
import com.fleetsync.unavailability.service.UnavailabilityReconciler;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one master to destination unavailability sync.
 *
 * <p>Session and resource-list failures abort the run. Anything that goes wrong for a single
 * matched resource, or a single write, is recorded as an error and the run carries on.
 */
public class UnavailabilitySyncService {

    private static final Logger log = LoggerFactory.getLogger(UnavailabilitySyncService.class);

    private final ResourceSource masterResources;
    private final ResourceSource localResources;
    private final UnavailabilitySource masterUnavailabilities;
    private final UnavailabilityRepository localUnavailabilities;
    private final ResourceMatcher resourceMatcher;
    private final SyncProperties properties;
    private final Clock clock;

    public UnavailabilitySyncService(
        ResourceSource masterResources,
        ResourceSource localResources,
        UnavailabilitySource masterUnavailabilities,
        UnavailabilityRepository localUnavailabilities,
        ResourceMatcher resourceMatcher,
        SyncProperties properties,
        Clock clock
    ) {
        this.masterResources = masterResources;
        this.localResources = localResources;
        this.masterUnavailabilities = masterUnavailabilities;
        this.localUnavailabilities = localUnavailabilities;
        this.resourceMatcher = resourceMatcher;
        this.properties = properties;
        this.clock = clock;
    }

    public SyncRunResponse run() {
        SyncWindow window = SyncWindow.of(properties.getTargetYear(), properties.windowZoneId(), clock);

        masterResources.openSession();
        localResources.openSession();

        List<Resource> master = masterResources.listResources();
        List<Resource> local = localResources.listResources();
        MatchResult matchResult = resourceMatcher.match(master, local);

        UnavailabilityReconciler reconciler = new UnavailabilityReconciler(window);
        SyncStats stats = new SyncStats();
        for (ResourcePair pair : matchResult.pairs()) {
            stats.record(syncResource(pair, reconciler));
        }

        SyncRunResponse summary = stats.toResponse(window.year().getValue(), matchResult);
        log.info(
            "Sync complete (year={}, matched={}/{}, created={}, updated={}, deleted={}, unchanged={}, errors={})",
            summary.targetYear(),
            summary.matchedResources(),
            summary.totalMasterResources(),
            summary.created(),
            summary.updated(),
            summary.deleted(),
            summary.unchanged(),
            summary.errors()
        );
        return summary;
    }

    PairOutcome syncResource(ResourcePair pair, UnavailabilityReconciler reconciler) {
        ReconciliationPlan plan;
        try {
            List<Unavailability> master = masterUnavailabilities.getAllForResource(
                pair.masterId(),
                reconciler.getWindow().start()
            );
            List<Unavailability> local = localUnavailabilities.getAllForResource(
                pair.localId(),
                reconciler.getWindow().start()
            );
            plan = reconciler.reconcile(pair, master, local);
        } catch (RuntimeException exception) {
            log.warn(
                "Failed to sync unavailabilities for resource (master={}, local={}): {}",
                pair.masterId(),
                pair.localId(),
                exception.getMessage()
            );
            return PairOutcome.failed(pair, exception.getMessage());
        }

        List<ActionOutcome> actions = new ArrayList<>();
        for (Unavailability create : plan.creates()) {
            actions.add(apply(ActionType.CREATE, pair, create, () -> localUnavailabilities.create(create).id()));
        }
        for (Unavailability update : plan.updates()) {
            actions.add(apply(ActionType.UPDATE, pair, update, () -> localUnavailabilities.update(update).id()));
        }
        for (Unavailability delete : plan.deletes()) {
            actions.add(apply(ActionType.DELETE, pair, delete, () -> {
                localUnavailabilities.delete(delete.resourceId(), delete.id());
                return delete.id();
            }));
        }

        return PairOutcome.completed(pair, plan.unchangedCount(), actions);
    }

    private ActionOutcome apply(ActionType type, ResourcePair pair, Unavailability unavailability, Write write) {
        try {
            String unavailabilityId = write.apply();
            log.debug(
                "{} unavailability {} for resource {} ({} - {})",
                type,
                unavailabilityId,
                pair.localId(),
                unavailability.startTime(),
                unavailability.endTime()
            );
            return ActionOutcome.succeeded(type, unavailabilityId);
        } catch (RuntimeException exception) {
            log.warn(
                "Failed to {} unavailability {} for resource {} ({} - {}): {}",
                type.name().toLowerCase(Locale.ROOT),
                unavailability.id(),
                pair.localId(),
                unavailability.startTime(),
                unavailability.endTime(),
                exception.getMessage()
            );
            return ActionOutcome.failed(type, unavailability.id(), exception.getMessage());
        }
    }

    @FunctionalInterface
    private interface Write {

        String apply();
    }
}
