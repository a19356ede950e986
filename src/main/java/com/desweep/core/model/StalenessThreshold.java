package com.desweep.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cutoff beyond which a workflow's last run is treated as evidence of abandonment.
 * <p>
 * Carries the instant it was computed at so that derived values such as
 * "days since last run" do not depend on the wall clock at classification time.
 *
 * @param asOf   when the analysis run started
 * @param cutoff last-run instants strictly before this are stale
 */
public record StalenessThreshold(Instant asOf, Instant cutoff) {

    public static final int DEFAULT_STALE_DAYS = 365;

    public StalenessThreshold {
        if (asOf == null || cutoff == null) {
            throw new IllegalArgumentException("asOf and cutoff are required");
        }
        if (cutoff.isAfter(asOf)) {
            throw new IllegalArgumentException("cutoff must not be after asOf");
        }
    }

    public static StalenessThreshold ofDays(int staleDays, Clock clock) {
        if (staleDays < 0) {
            throw new IllegalArgumentException("staleDays must be >= 0, got " + staleDays);
        }
        Instant now = clock.instant();
        return new StalenessThreshold(now, now.minus(Duration.ofDays(staleDays)));
    }

    public static StalenessThreshold ofDays(int staleDays) {
        return ofDays(staleDays, Clock.systemUTC());
    }

    public boolean isStale(Instant lastRun) {
        return lastRun.isBefore(cutoff);
    }

    public long daysSince(Instant instant) {
        return Duration.between(instant, asOf).toDays();
    }
}
