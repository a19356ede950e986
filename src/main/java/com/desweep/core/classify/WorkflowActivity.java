package com.desweep.core.classify;

import com.desweep.core.model.StalenessThreshold;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Staleness evaluation of a single workflow, shared by the workflow and filter rules.
 */
public final class WorkflowActivity {

    /** Status ids the platform uses for Paused, Stopped and Inactive. */
    static final Set<Integer> INACTIVE_STATUS_IDS = Set.of(4, 5, 8);

    public enum State {
        NEVER_RUN,
        STALE,
        INACTIVE_RECENT,
        ACTIVE_RECENT,
        /** Last run time present but unreadable, or detail fetch failed with no last run time. */
        UNDETERMINED;

        /** Never run, stale, or inactive: does not block deleting what it references. */
        public boolean isDormant() {
            return this == NEVER_RUN || this == STALE || this == INACTIVE_RECENT;
        }
    }

    public record Assessment(State state, Instant lastRun) {

        public Optional<Instant> lastRunTime() {
            return Optional.ofNullable(lastRun);
        }
    }

    private WorkflowActivity() {}

    public static Assessment assess(JsonNode workflow, StalenessThreshold threshold) {
        JsonNode lastRunNode = workflow.get("lastRunTime");
        boolean hasLastRun = lastRunNode != null && !lastRunNode.isNull() && !lastRunNode.asText().isBlank();
        if (!hasLastRun) {
            return workflow.hasNonNull("detailsError")
                    ? new Assessment(State.UNDETERMINED, null)
                    : new Assessment(State.NEVER_RUN, null);
        }

        Optional<Instant> lastRun = parseInstant(lastRunNode);
        if (lastRun.isEmpty()) {
            return new Assessment(State.UNDETERMINED, null);
        }
        if (threshold.isStale(lastRun.get())) {
            return new Assessment(State.STALE, lastRun.get());
        }
        return isInactive(workflow)
                ? new Assessment(State.INACTIVE_RECENT, lastRun.get())
                : new Assessment(State.ACTIVE_RECENT, lastRun.get());
    }

    /** Status id 4, 5 or 8, or status text mentioning paused, stopped or inactive. */
    public static boolean isInactive(JsonNode workflow) {
        Optional<Integer> statusId = statusId(workflow);
        if (statusId.isPresent() && INACTIVE_STATUS_IDS.contains(statusId.get())) {
            return true;
        }
        String status = workflow.path("status").asText("").toLowerCase(Locale.ROOT);
        return status.contains("paused") || status.contains("stopped") || status.contains("inactive");
    }

    static Optional<Integer> statusId(JsonNode workflow) {
        JsonNode statusId = workflow.get("statusId");
        if (statusId == null || statusId.isNull()) {
            return Optional.empty();
        }
        if (statusId.canConvertToInt()) {
            return Optional.of(statusId.asInt());
        }
        return tryParse(statusId.asText().trim(), Integer::valueOf);
    }

    /**
     * Accepts ISO instants, offset date-times, zone-less date-times (read as UTC),
     * plain dates and epoch milliseconds.
     */
    static Optional<Instant> parseInstant(JsonNode value) {
        if (value.isNumber()) {
            return Optional.of(Instant.ofEpochMilli(value.asLong()));
        }
        String text = value.asText().trim();
        return tryParse(text, t -> OffsetDateTime.parse(t).toInstant())
                .or(() -> tryParse(text, t -> LocalDateTime.parse(t).toInstant(ZoneOffset.UTC)))
                .or(() -> tryParse(text, t -> LocalDate.parse(t).atStartOfDay().toInstant(ZoneOffset.UTC)));
    }

    private static <T> Optional<T> tryParse(String text, Function<String, T> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
