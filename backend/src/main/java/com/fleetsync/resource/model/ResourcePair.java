package com.fleetsync.resource.model;

public record ResourcePair(
    String masterId,
    String localId
) {
}
