package com.desweep.core.loader;

/**
 * Receives progress callbacks during a load.
 */
@FunctionalInterface
public interface LoadProgressListener {

    LoadProgressListener NONE = (stage, current, total, message) -> { };

    /**
     * @param stage   e.g. "workflows", "workflow-details", "query-text", "cached"
     * @param current items completed in this stage
     * @param total   items expected in this stage
     */
    void onProgress(String stage, int current, int total, String message);
}
