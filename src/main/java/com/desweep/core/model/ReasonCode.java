package com.desweep.core.model;

/**
 * Why a {@link ClassificationVerdict} was reached.
 */
public enum ReasonCode {
    NEVER_RUN("Workflow has never been run"),
    STALE_WORKFLOW("Workflow has not run since the staleness threshold"),
    INACTIVE_WORKFLOW("Workflow is inactive/paused but was recently used"),
    ACTIVE_WORKFLOW("Workflow is active and recently used"),
    STANDALONE_FILTER("Filter is not used in any workflow"),
    FILTER_IN_STALE_WORKFLOWS("Filter is only used in stale, inactive or never-run workflows"),
    FILTER_IN_ACTIVE_WORKFLOW("Filter is used in an active workflow"),
    FILTER_IN_UNDETERMINED_WORKFLOW("Filter is used in a workflow whose activity could not be determined"),
    QUERY_REVIEW("Query requires manual review"),
    IMPORT_REVIEW("Import requires manual review"),
    TRIGGERED_MESSAGE_REVIEW("Triggered message requires manual review"),
    JOURNEY_REVIEW("Journey requires manual review"),
    DATA_EXTRACT_REVIEW("Data extract requires manual review"),
    INSUFFICIENT_METADATA("Could not retrieve metadata to assess");

    private final String description;

    ReasonCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
