package com.desweep.core.model;

/**
 * Kind of platform object that can depend on a data extension.
 */
public enum DependencyType {
    WORKFLOW("Workflow"),
    FILTER("Filter"),
    QUERY("Query"),
    IMPORT("Import"),
    TRIGGERED_MESSAGE("Triggered Message"),
    JOURNEY("Journey"),
    DATA_EXTRACT("Data Extract");

    private final String label;

    DependencyType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
