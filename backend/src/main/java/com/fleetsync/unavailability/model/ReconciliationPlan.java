package com.fleetsync.unavailability.model;

import java.util.List;

/**
 * Writes that bring one destination resource in line with its master, applied creates first, then updates, then deletes.
 */
public record ReconciliationPlan(
    List<Unavailability> creates,
    List<Unavailability> updates,
    List<Unavailability> deletes,
    int unchangedCount
) {

    public ReconciliationPlan {
        creates = List.copyOf(creates);
        updates = List.copyOf(updates);
        deletes = List.copyOf(deletes);
    }

    public boolean isEmpty() {
        return creates.isEmpty() && updates.isEmpty() && deletes.isEmpty();
    }
}
