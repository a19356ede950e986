package com.desweep.core.loader;

/**
 * Options for a single {@link BulkMetadataLoader#load} call.
 *
 * @param forceRefresh          skip the memory and disk caches and fetch live
 * @param includeWorkflowDetail fetch the full definition of every workflow (steps, last run time)
 * @param includeQueryText      fetch the SQL text of every query that lacks it
 * @param onProgress            progress callback, never null
 */
public record LoadOptions(
    boolean forceRefresh,
    boolean includeWorkflowDetail,
    boolean includeQueryText,
    LoadProgressListener onProgress
) {

    public LoadOptions {
        onProgress = onProgress == null ? LoadProgressListener.NONE : onProgress;
    }

    public static LoadOptions defaults() {
        return new LoadOptions(false, true, true, LoadProgressListener.NONE);
    }

    public static LoadOptions from(LoaderProperties properties) {
        return new LoadOptions(false, properties.isIncludeWorkflowDetail(), properties.isIncludeQueryText(),
                LoadProgressListener.NONE);
    }

    public LoadOptions withForceRefresh(boolean forceRefresh) {
        return new LoadOptions(forceRefresh, includeWorkflowDetail, includeQueryText, onProgress);
    }

    public LoadOptions withProgress(LoadProgressListener listener) {
        return new LoadOptions(forceRefresh, includeWorkflowDetail, includeQueryText, listener);
    }
}
