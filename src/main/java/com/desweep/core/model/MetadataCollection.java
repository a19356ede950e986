package com.desweep.core.model;

/**
 * The seven metadata collections pulled from the platform.
 */
public enum MetadataCollection {
    WORKFLOWS("workflows", "workflows", DependencyType.WORKFLOW),
    FILTERS("filters", "filters", DependencyType.FILTER),
    QUERIES("queries", "queries", DependencyType.QUERY),
    IMPORTS("imports", "imports", DependencyType.IMPORT),
    TRIGGERED_MESSAGES("triggeredMessages", "triggered-messages", DependencyType.TRIGGERED_MESSAGE),
    JOURNEYS("journeys", "journeys", DependencyType.JOURNEY),
    DATA_EXTRACTS("dataExtracts", "data-extracts", DependencyType.DATA_EXTRACT);

    private final String jsonField;
    private final String stage;
    private final DependencyType dependencyType;

    MetadataCollection(String jsonField, String stage, DependencyType dependencyType) {
        this.jsonField = jsonField;
        this.stage = stage;
        this.dependencyType = dependencyType;
    }

    /** Field name in the persisted aggregate. */
    public String jsonField() {
        return jsonField;
    }

    /** Progress stage name. */
    public String stage() {
        return stage;
    }

    public DependencyType dependencyType() {
        return dependencyType;
    }
}
