package com.desweep.core.analysis;

import com.desweep.core.model.StalenessThreshold;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "desweep.analysis")
public class AnalysisProperties {

    /** Workflows whose last run is older than this many days are stale. */
    private int staleDays = StalenessThreshold.DEFAULT_STALE_DAYS;

    public int getStaleDays() {
        return staleDays;
    }

    public void setStaleDays(int staleDays) {
        this.staleDays = staleDays;
    }
}
