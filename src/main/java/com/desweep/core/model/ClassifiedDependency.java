package com.desweep.core.model;

/**
 * A deduplicated dependency paired with its verdict.
 */
public record ClassifiedDependency(
    DependencyRecord dependency,
    ClassificationVerdict verdict
) {

    public Classification classification() {
        return verdict.classification();
    }

    public DependencyType type() {
        return dependency.type();
    }
}
