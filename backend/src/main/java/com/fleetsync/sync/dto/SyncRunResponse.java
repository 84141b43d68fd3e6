package com.fleetsync.sync.dto;

public record SyncRunResponse(
    int targetYear,
    int created,
    int updated,
    int deleted,
    int unchanged,
    int errors,
    int matchedResources,
    int totalMasterResources,
    int unmatchedResources
) {
}
