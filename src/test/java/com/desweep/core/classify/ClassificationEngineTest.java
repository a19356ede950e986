package com.desweep.core.classify;

import com.desweep.core.loader.BulkDataset;
import com.desweep.core.model.Classification;
import com.desweep.core.model.ClassificationVerdict;
import com.desweep.core.model.DependencyRecord;
import com.desweep.core.model.DependencyType;
import com.desweep.core.model.MetadataCollection;
import com.desweep.core.model.ReasonCode;
import com.desweep.core.model.StalenessThreshold;
import com.desweep.core.model.TargetEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.desweep.core.loader.DatasetFixtures.dataset;
import static com.desweep.core.loader.DatasetFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

class ClassificationEngineTest {

    private static final StalenessThreshold THRESHOLD =
            StalenessThreshold.ofDays(365, Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC));

    /** 400 days before the threshold's asOf. */
    private static final String LONG_AGO = "2024-04-27T00:00:00Z";
    /** 2 days before the threshold's asOf. */
    private static final String RECENT = "2025-05-30T00:00:00Z";

    private final ClassificationEngine engine = new ClassificationEngine();

    private static DependencyRecord record(DependencyType type, String id, String rawJson) {
        return new DependencyRecord(type, id, "name-" + id, null, "detail", json(rawJson),
                List.of(TargetEntity.ofKey("DE1")));
    }

    private static BulkDataset empty() {
        return dataset().build();
    }

    @Nested
    @DisplayName("workflows")
    class Workflows {

        @Test
        @DisplayName("last run 400 days ago with a 365-day threshold is safe as stale")
        void stale() {
            var record = record(DependencyType.WORKFLOW, "A",
                    "{\"id\":\"A\",\"status\":\"Scheduled\",\"statusId\":6,\"lastRunTime\":\"" + LONG_AGO + "\"}");

            ClassificationVerdict verdict = engine.classify(record, empty(), THRESHOLD);

            assertEquals(Classification.SAFE_TO_DELETE, verdict.classification());
            assertEquals(ReasonCode.STALE_WORKFLOW, verdict.reasonCode());
            assertTrue(verdict.canDelete());
            assertEquals(400L, verdict.metadata().get("daysSinceLastRun"));
            assertEquals(6L, verdict.metadata().get("statusId"));
            assertEquals("Scheduled", verdict.metadata().get("status"));
        }

        @Test
        @DisplayName("never run is safe")
        void neverRun() {
            var verdict = engine.classify(record(DependencyType.WORKFLOW, "A", "{\"id\":\"A\",\"status\":\"Building\"}"),
                    empty(), THRESHOLD);

            assertEquals(Classification.SAFE_TO_DELETE, verdict.classification());
            assertEquals(ReasonCode.NEVER_RUN, verdict.reasonCode());
            assertFalse(verdict.metadata().containsKey("daysSinceLastRun"));
        }

        @Test
        @DisplayName("recently run and active needs review")
        void activeRecent() {
            var verdict = engine.classify(record(DependencyType.WORKFLOW, "A",
                    "{\"id\":\"A\",\"status\":\"Scheduled\",\"lastRunTime\":\"" + RECENT + "\"}"), empty(), THRESHOLD);

            assertEquals(Classification.REQUIRES_REVIEW, verdict.classification());
            assertEquals(ReasonCode.ACTIVE_WORKFLOW, verdict.reasonCode());
            assertEquals(2L, verdict.metadata().get("daysSinceLastRun"));
        }

        @ParameterizedTest(name = "statusId={0}, status={1}")
        @CsvSource({"4, Scheduled", "5, Ready", "8, Ready", "6, Paused", "2, Stopped", "2, Inactive"})
        @DisplayName("recently run but paused, stopped or inactive still needs review")
        void inactiveRecent(int statusId, String status) {
            var verdict = engine.classify(record(DependencyType.WORKFLOW, "A",
                    "{\"id\":\"A\",\"statusId\":" + statusId + ",\"status\":\"" + status
                            + "\",\"lastRunTime\":\"" + RECENT + "\"}"), empty(), THRESHOLD);

            assertEquals(Classification.REQUIRES_REVIEW, verdict.classification());
            assertEquals(ReasonCode.INACTIVE_WORKFLOW, verdict.reasonCode());
        }

        @Test
        @DisplayName("unreadable last run time is unknown, not never-run")
        void unparseableLastRun() {
            var verdict = engine.classify(record(DependencyType.WORKFLOW, "A",
                    "{\"id\":\"A\",\"lastRunTime\":\"last Tuesday\"}"), empty(), THRESHOLD);

            assertEquals(Classification.UNKNOWN, verdict.classification());
            assertEquals(ReasonCode.INSUFFICIENT_METADATA, verdict.reasonCode());
            assertFalse(verdict.canDelete());
        }

        @Test
        @DisplayName("failed detail fetch without last run time is unknown")
        void detailsErrorWithoutLastRun() {
            var verdict = engine.classify(record(DependencyType.WORKFLOW, "A",
                    "{\"id\":\"A\",\"detailsError\":\"HTTP 500\"}"), empty(), THRESHOLD);

            assertEquals(Classification.UNKNOWN, verdict.classification());
            assertEquals("HTTP 500", verdict.metadata().get("detailsError"));
        }

        @Test
        @DisplayName("missing id is unknown")
        void missingId() {
            var verdict = engine.classify(record(DependencyType.WORKFLOW, null, "{\"name\":\"x\"}"), empty(), THRESHOLD);
            assertEquals(Classification.UNKNOWN, verdict.classification());
        }

        @Test
        @DisplayName("the loaded workflow takes precedence over the record's projection")
        void usesDatasetWorkflow() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS,
                    "[{\"id\":\"A\",\"status\":\"Scheduled\",\"lastRunTime\":\"" + RECENT + "\"}]").build();

            var verdict = engine.classify(record(DependencyType.WORKFLOW, "A", "{\"id\":\"A\"}"), dataset, THRESHOLD);

            assertEquals(ReasonCode.ACTIVE_WORKFLOW, verdict.reasonCode());
        }
    }

    @Nested
    @DisplayName("filters")
    class Filters {

        private final DependencyRecord filter = record(DependencyType.FILTER, "F",
                "{\"filterActivityId\":\"F\",\"destinationObjectId\":\"obj-1\",\"customerKey\":\"fk\"}");

        @Test
        @DisplayName("not used by any workflow is safe")
        void standalone() {
            var verdict = engine.classify(filter, empty(), THRESHOLD);

            assertEquals(Classification.SAFE_TO_DELETE, verdict.classification());
            assertEquals(ReasonCode.STANDALONE_FILTER, verdict.reasonCode());
            assertEquals(List.of(), verdict.metadata().get("usedInWorkflows"));
            assertEquals("obj-1", verdict.metadata().get("destinationObjectId"));
        }

        @Test
        @DisplayName("nested in a workflow that ran 2 days ago needs review")
        void inActiveWorkflow() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS, """
                    [{"id": "A", "name": "Workflow A", "status": "Scheduled", "lastRunTime": "%s",
                      "steps": [{"activities": [{"activityObjectId": "F"}]}]}]
                    """.formatted(RECENT)).build();

            var verdict = engine.classify(filter, dataset, THRESHOLD);

            assertEquals(Classification.REQUIRES_REVIEW, verdict.classification());
            assertEquals(ReasonCode.FILTER_IN_ACTIVE_WORKFLOW, verdict.reasonCode());
            assertEquals("Filter used in active workflow(s): Workflow A", verdict.reason());
            @SuppressWarnings("unchecked")
            var usedIn = (List<Map<String, Object>>) verdict.metadata().get("usedInWorkflows");
            assertEquals("A", usedIn.get(0).get("id"));
            assertEquals(RECENT, usedIn.get(0).get("lastRunTime"));
        }

        @Test
        @DisplayName("used only by stale, never-run or inactive workflows is safe")
        void onlyDormantWorkflows() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS, """
                    [{"id": "w1", "name": "Stale", "lastRunTime": "%s", "activityIds": ["F"]},
                     {"id": "w2", "name": "Never", "activityIds": ["F"]},
                     {"id": "w3", "name": "Paused", "statusId": 4, "lastRunTime": "%s", "activityIds": ["F"]}]
                    """.formatted(LONG_AGO, RECENT)).build();

            var verdict = engine.classify(filter, dataset, THRESHOLD);

            assertEquals(Classification.SAFE_TO_DELETE, verdict.classification());
            assertEquals(ReasonCode.FILTER_IN_STALE_WORKFLOWS, verdict.reasonCode());
            assertEquals(3, ((List<?>) verdict.metadata().get("usedInWorkflows")).size());
        }

        @Test
        @DisplayName("a workflow with unreadable run data blocks deletion without being called active")
        void undeterminedWorkflowBlocks() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS, """
                    [{"id": "w1", "name": "Broken", "detailsError": "HTTP 500", "activityIds": ["F"]}]
                    """).build();

            var verdict = engine.classify(filter, dataset, THRESHOLD);

            assertEquals(Classification.REQUIRES_REVIEW, verdict.classification());
            assertEquals(ReasonCode.FILTER_IN_UNDETERMINED_WORKFLOW, verdict.reasonCode());
            assertEquals("Filter used in workflow(s) of unknown state: Broken", verdict.reason());
            assertEquals(List.of("Broken"), verdict.metadata().get("undeterminedWorkflows"));
        }

        @Test
        @DisplayName("active and unknown-state workflows are named separately")
        void activeAndUndetermined() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS, """
                    [{"id": "w1", "name": "Daily", "lastRunTime": "%s", "activityIds": ["F"]},
                     {"id": "w2", "name": "Odd", "lastRunTime": "not a date", "activityIds": ["F"]}]
                    """.formatted(RECENT)).build();

            var verdict = engine.classify(filter, dataset, THRESHOLD);

            assertEquals(ReasonCode.FILTER_IN_ACTIVE_WORKFLOW, verdict.reasonCode());
            assertEquals("Filter used in active workflow(s): Daily; "
                    + "Filter used in workflow(s) of unknown state: Odd", verdict.reason());
            assertEquals(List.of("Odd"), verdict.metadata().get("undeterminedWorkflows"));
        }

        @Test
        @DisplayName("names at most two blocking workflows")
        void manyBlocking() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS, """
                    [{"id": "w1", "name": "One", "lastRunTime": "%1$s", "activityIds": ["F"]},
                     {"id": "w2", "name": "Two", "lastRunTime": "%1$s", "activityIds": ["F"]},
                     {"id": "w3", "name": "Three", "lastRunTime": "%1$s", "activityIds": ["F"]}]
                    """.formatted(RECENT)).build();

            assertEquals("Filter used in active workflow(s): One, Two +more",
                    engine.classify(filter, dataset, THRESHOLD).reason());
        }

        @Test
        @DisplayName("missing id is unknown")
        void missingId() {
            var noId = record(DependencyType.FILTER, null, "{\"destinationObjectId\":\"obj-1\"}");
            assertEquals(Classification.UNKNOWN, engine.classify(noId, empty(), THRESHOLD).classification());
        }
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
            "QUERY, QUERY_REVIEW",
            "IMPORT, IMPORT_REVIEW",
            "TRIGGERED_MESSAGE, TRIGGERED_MESSAGE_REVIEW",
            "JOURNEY, JOURNEY_REVIEW",
            "DATA_EXTRACT, DATA_EXTRACT_REVIEW"
    })
    @DisplayName("every other type always needs review")
    void alwaysReview(DependencyType type, ReasonCode expected) {
        var record = record(type, "x1", "{\"id\":\"x1\",\"createdDate\":\"" + LONG_AGO + "\",\"version\":3,"
                + "\"nested\":{\"a\":1}}");

        var verdict = engine.classify(record, empty(), THRESHOLD);

        assertEquals(Classification.REQUIRES_REVIEW, verdict.classification());
        assertEquals(expected, verdict.reasonCode());
        assertEquals(LONG_AGO, verdict.metadata().get("createdDate"));
        assertEquals(3L, verdict.metadata().get("version"));
        assertEquals("{\"a\":1}", verdict.metadata().get("nested"));
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(value = DependencyType.class, names = {"QUERY", "IMPORT", "TRIGGERED_MESSAGE", "JOURNEY", "DATA_EXTRACT"})
    @DisplayName("every other type without an id is unknown, not review")
    void missingIdIsUnknownForReviewTypes(DependencyType type) {
        var noId = new DependencyRecord(type, null, "orphan", null, "detail", json("{\"name\":\"orphan\"}"),
                List.of(TargetEntity.ofKey("DE1")));

        var verdict = engine.classify(noId, empty(), THRESHOLD);

        assertEquals(Classification.UNKNOWN, verdict.classification());
        assertEquals(ReasonCode.INSUFFICIENT_METADATA, verdict.reasonCode());
        assertFalse(verdict.canDelete());
        assertEquals("orphan", verdict.metadata().get("name"));
    }

    @Test
    @DisplayName("query referenced only by name in SQL still needs review")
    void queryByNameReview() {
        var record = new DependencyRecord(DependencyType.QUERY, "Q", "Segment", null,
                "Referenced in SQL (by Name)", json("{}"), List.of(TargetEntity.ofKey("DE1")));

        var verdict = engine.classify(record, empty(), THRESHOLD);
        assertEquals(Classification.REQUIRES_REVIEW, verdict.classification());
        assertTrue(verdict.metadata().isEmpty());
    }

    @Test
    @DisplayName("classifying the same record twice gives the same verdict")
    void idempotent() {
        BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS,
                "[{\"id\":\"A\",\"name\":\"A\",\"lastRunTime\":\"" + RECENT + "\",\"activityIds\":[\"F\"]}]").build();
        var filter = record(DependencyType.FILTER, "F", "{\"filterActivityId\":\"F\"}");
        var workflow = record(DependencyType.WORKFLOW, "A", "{\"id\":\"A\"}");

        assertEquals(engine.classify(filter, dataset, THRESHOLD), engine.classify(filter, dataset, THRESHOLD));
        assertEquals(engine.classify(workflow, dataset, THRESHOLD), engine.classify(workflow, dataset, THRESHOLD));
    }
}
