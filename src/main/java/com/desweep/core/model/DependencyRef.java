package com.desweep.core.model;

/**
 * Lightweight pointer to a dependency, used in per-entity mappings.
 */
public record DependencyRef(DependencyType type, String id, String name) {}
