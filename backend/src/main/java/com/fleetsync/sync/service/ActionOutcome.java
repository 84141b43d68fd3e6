package com.fleetsync.sync.service;

public record ActionOutcome(
    ActionType type,
    String unavailabilityId,
    boolean success,
    String failureMessage
) {

    public static ActionOutcome succeeded(ActionType type, String unavailabilityId) {
        return new ActionOutcome(type, unavailabilityId, true, null);
    }

    public static ActionOutcome failed(ActionType type, String unavailabilityId, String failureMessage) {
        return new ActionOutcome(type, unavailabilityId, false, failureMessage);
    }
}
