package com.desweep.core.analysis;

import com.desweep.core.loader.LoadOptions;
import com.desweep.core.model.StalenessThreshold;

/**
 * @param staleDays   age in days after which a workflow's last run counts as stale
 * @param loadOptions how the shared dataset is loaded
 */
public record AnalysisOptions(int staleDays, LoadOptions loadOptions) {

    public AnalysisOptions {
        if (staleDays < 0) {
            throw new IllegalArgumentException("staleDays must be >= 0, got " + staleDays);
        }
        loadOptions = loadOptions == null ? LoadOptions.defaults() : loadOptions;
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(StalenessThreshold.DEFAULT_STALE_DAYS, LoadOptions.defaults());
    }
}
