package com.fleetsync.sync.service;

import com.fleetsync.resource.model.ResourcePair;
import java.util.List;

/**
 * Result of syncing one matched resource. A non-null failure message means nothing was applied for the pair.
 */
public record PairOutcome(
    ResourcePair pair,
    int unchangedCount,
    List<ActionOutcome> actions,
    String failureMessage
) {

    public PairOutcome {
        actions = List.copyOf(actions);
    }

    public static PairOutcome completed(ResourcePair pair, int unchangedCount, List<ActionOutcome> actions) {
        return new PairOutcome(pair, unchangedCount, actions, null);
    }

    public static PairOutcome failed(ResourcePair pair, String failureMessage) {
        return new PairOutcome(pair, 0, List.of(), failureMessage);
    }

    public boolean isFailed() {
        return failureMessage != null;
    }
}
