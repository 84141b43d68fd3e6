package com.fleetsync.unavailability.service;

import com.fleetsync.resource.model.ResourcePair;
import com.fleetsync.unavailability.model.ReconciliationPlan;
import com.fleetsync.unavailability.model.SyncWindow;
import com.fleetsync.unavailability.model.Unavailability;
import com.fleetsync.unavailability.model.UnavailabilityKey;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diffs the master and destination unavailabilities of one matched resource by equality key.
 *
 * <p>Pure computation: no I/O, and timestamps are passed through as given. Records starting
 * outside the window are ignored on both sides, so destination records outside it are never deleted.
 */
public class UnavailabilityReconciler {

    private static final Logger log = LoggerFactory.getLogger(UnavailabilityReconciler.class);

    private final SyncWindow window;

    public UnavailabilityReconciler(SyncWindow window) {
        this.window = window;
    }

    public SyncWindow getWindow() {
        return window;
    }

    public ReconciliationPlan reconcile(
        ResourcePair pair,
        List<Unavailability> masterUnavailabilities,
        List<Unavailability> destinationUnavailabilities
    ) {
        List<Unavailability> destinationInScope = destinationUnavailabilities.stream()
            .filter(window::contains)
            .toList();

        Map<UnavailabilityKey, Unavailability> destinationByKey = new LinkedHashMap<>();
        for (Unavailability destination : destinationInScope) {
            destinationByKey.putIfAbsent(destination.key(), destination);
        }

        List<Unavailability> creates = new ArrayList<>();
        List<Unavailability> updates = new ArrayList<>();
        Set<UnavailabilityKey> consumed = new HashSet<>();
        int unchanged = 0;

        for (Unavailability master : masterUnavailabilities) {
            if (!window.contains(master)) {
                continue;
            }

            Unavailability desired = master.toDestination(pair.localId(), null);
            UnavailabilityKey key = desired.key();
            if (!consumed.add(key)) {
                log.debug("Ignoring duplicate master unavailability {} for resource {}", master.id(), pair.masterId());
                continue;
            }

            Unavailability existing = destinationByKey.get(key);
            if (existing == null) {
                creates.add(desired);
            } else if (existing.sameMutableFields(desired)) {
                unchanged++;
            } else {
                updates.add(desired.withId(existing.id()));
            }
        }

        List<Unavailability> deletes = new ArrayList<>();
        for (Unavailability destination : destinationInScope) {
            boolean kept = consumed.contains(destination.key()) && destinationByKey.get(destination.key()) == destination;
            if (!kept && destination.id() != null) {
                deletes.add(destination);
            }
        }

        return new ReconciliationPlan(creates, updates, deletes, unchanged);
    }
}
