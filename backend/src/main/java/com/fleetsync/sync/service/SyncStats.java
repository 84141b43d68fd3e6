package com.fleetsync.sync.service;

import com.fleetsync.resource.model.MatchResult;
import com.fleetsync.sync.dto.SyncRunResponse;
import lombok.Getter;

/**
 * Run-wide counters. Only ever incremented.
 */
@Getter
public class SyncStats {

    private int created;
    private int updated;
    private int deleted;
    private int unchanged;
    private int errors;

    public void record(PairOutcome outcome) {
        if (outcome.isFailed()) {
            errors++;
            return;
        }

        unchanged += outcome.unchangedCount();
        for (ActionOutcome action : outcome.actions()) {
            record(action);
        }
    }

    public void record(ActionOutcome action) {
        if (!action.success()) {
            errors++;
            return;
        }

        switch (action.type()) {
            case CREATE -> created++;
            case UPDATE -> updated++;
            case DELETE -> deleted++;
        }
    }

    public SyncRunResponse toResponse(int targetYear, MatchResult matchResult) {
        return new SyncRunResponse(
            targetYear,
            created,
            updated,
            deleted,
            unchanged,
            errors,
            matchResult.matchedCount(),
            matchResult.totalMasterCount(),
            matchResult.unmatchedMasterIds().size()
        );
    }
}
