package com.desweep.core.model;

import java.time.Instant;

/**
 * Item counts of a loaded metadata aggregate.
 */
public record DatasetSummary(
    int workflows,
    int filters,
    int queries,
    int imports,
    int triggeredMessages,
    int journeys,
    int dataExtracts,
    Instant loadedAt
) {

    public int total() {
        return workflows + filters + queries + imports + triggeredMessages + journeys + dataExtracts;
    }
}
