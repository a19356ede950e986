package com.desweep.core.classify;

import com.desweep.core.classify.WorkflowActivity.Assessment;
import com.desweep.core.loader.BulkDataset;
import com.desweep.core.model.ClassificationVerdict;
import com.desweep.core.model.DependencyRecord;
import com.desweep.core.model.ReasonCode;
import com.desweep.core.model.StalenessThreshold;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns a deletion-safety verdict to a dependency record.
 *
 * <p>Pure: the verdict depends only on the record, the dataset and the threshold.
 * Nothing here performs I/O or reads the clock.
 *
 * <p>Workflows are judged by staleness of their last run. Filters are judged by the
 * workflows that embed them: a filter used only by dormant workflows is reported as
 * safe. That rule is advisory, since a workflow can still be started by means its
 * last-run metadata does not show. Every other type always needs review.
 */
@Service
public class ClassificationEngine {

    private static final int BLOCKING_NAMES_SHOWN = 2;

    public ClassificationVerdict classify(DependencyRecord record, BulkDataset dataset, StalenessThreshold threshold) {
        return switch (record.type()) {
            case WORKFLOW -> classifyWorkflow(record, dataset, threshold);
            case FILTER -> classifyFilter(record, dataset, threshold);
            case QUERY -> review(record, ReasonCode.QUERY_REVIEW);
            case IMPORT -> review(record, ReasonCode.IMPORT_REVIEW);
            case TRIGGERED_MESSAGE -> review(record, ReasonCode.TRIGGERED_MESSAGE_REVIEW);
            case JOURNEY -> review(record, ReasonCode.JOURNEY_REVIEW);
            case DATA_EXTRACT -> review(record, ReasonCode.DATA_EXTRACT_REVIEW);
        };
    }

    private ClassificationVerdict classifyWorkflow(DependencyRecord record, BulkDataset dataset,
                                                   StalenessThreshold threshold) {
        JsonNode workflow = dataset.workflowById(record.id()).orElse(record.rawMetadata());
        if (!record.hasId() || workflow == null || workflow.isEmpty()) {
            return ClassificationVerdict.unknown(Map.of());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        putScalar(metadata, "status", workflow.get("status"));
        putScalar(metadata, "statusId", workflow.get("statusId"));
        putScalar(metadata, "lastRunTime", workflow.get("lastRunTime"));
        putScalar(metadata, "createdDate", workflow.get("createdDate"));
        putScalar(metadata, "modifiedDate", workflow.get("modifiedDate"));

        Assessment assessment = WorkflowActivity.assess(workflow, threshold);
        assessment.lastRunTime().ifPresent(lastRun -> metadata.put("daysSinceLastRun", threshold.daysSince(lastRun)));

        return switch (assessment.state()) {
            case NEVER_RUN -> ClassificationVerdict.safe(ReasonCode.NEVER_RUN, metadata);
            case STALE -> ClassificationVerdict.safe(ReasonCode.STALE_WORKFLOW, metadata);
            case INACTIVE_RECENT -> ClassificationVerdict.review(ReasonCode.INACTIVE_WORKFLOW, metadata);
            case ACTIVE_RECENT -> ClassificationVerdict.review(ReasonCode.ACTIVE_WORKFLOW, metadata);
            case UNDETERMINED -> {
                putScalar(metadata, "detailsError", workflow.get("detailsError"));
                yield ClassificationVerdict.unknown(metadata);
            }
        };
    }

    private ClassificationVerdict classifyFilter(DependencyRecord record, BulkDataset dataset,
                                                 StalenessThreshold threshold) {
        JsonNode filter = record.rawMetadata();
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (filter != null) {
            for (String field : List.of("sourceObjectId", "destinationObjectId", "customerKey",
                    "createdDate", "modifiedDate")) {
                putScalar(metadata, field, filter.get(field));
            }
        }
        if (!record.hasId()) {
            return ClassificationVerdict.unknown(metadata);
        }

        List<JsonNode> containing = dataset.findWorkflowsContainingActivity(record.id());
        List<Map<String, Object>> usedIn = new ArrayList<>();
        List<String> active = new ArrayList<>();
        List<String> undetermined = new ArrayList<>();
        for (JsonNode workflow : containing) {
            Map<String, Object> ref = new LinkedHashMap<>();
            putScalar(ref, "id", workflow.get("id"));
            putScalar(ref, "name", workflow.get("name"));
            putScalar(ref, "status", workflow.get("status"));
            putScalar(ref, "lastRunTime", workflow.get("lastRunTime"));
            usedIn.add(ref);

            WorkflowActivity.State state = WorkflowActivity.assess(workflow, threshold).state();
            String label = workflow.path("name").asText(workflow.path("id").asText("?"));
            if (state == WorkflowActivity.State.UNDETERMINED) {
                undetermined.add(label);
            } else if (!state.isDormant()) {
                active.add(label);
            }
        }
        metadata.put("usedInWorkflows", usedIn);
        if (!undetermined.isEmpty()) {
            metadata.put("undeterminedWorkflows", undetermined);
        }

        if (containing.isEmpty()) {
            return ClassificationVerdict.safe(ReasonCode.STANDALONE_FILTER, metadata);
        }
        if (active.isEmpty() && undetermined.isEmpty()) {
            return ClassificationVerdict.safe(ReasonCode.FILTER_IN_STALE_WORKFLOWS, metadata);
        }
        List<String> reasons = new ArrayList<>();
        if (!active.isEmpty()) {
            reasons.add("Filter used in active workflow(s): " + shortList(active));
        }
        if (!undetermined.isEmpty()) {
            reasons.add("Filter used in workflow(s) of unknown state: " + shortList(undetermined));
        }
        ReasonCode code = active.isEmpty()
                ? ReasonCode.FILTER_IN_UNDETERMINED_WORKFLOW
                : ReasonCode.FILTER_IN_ACTIVE_WORKFLOW;
        return ClassificationVerdict.review(code, String.join("; ", reasons), metadata);
    }

    private static String shortList(List<String> names) {
        return String.join(", ", names.subList(0, Math.min(BLOCKING_NAMES_SHOWN, names.size())))
                + (names.size() > BLOCKING_NAMES_SHOWN ? " +more" : "");
    }

    private static ClassificationVerdict review(DependencyRecord record, ReasonCode reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode raw = record.rawMetadata();
        if (raw != null && raw.isObject()) {
            raw.fields().forEachRemaining(field -> putScalar(metadata, field.getKey(), field.getValue()));
        }
        if (!record.hasId()) {
            return ClassificationVerdict.unknown(metadata);
        }
        return ClassificationVerdict.review(reason, metadata);
    }

    /** Copies a JSON scalar as String, Long, Double or Boolean; containers as their JSON text. */
    private static void putScalar(Map<String, Object> target, String key, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        if (value.isIntegralNumber()) {
            target.put(key, value.asLong());
        } else if (value.isNumber()) {
            target.put(key, value.asDouble());
        } else if (value.isBoolean()) {
            target.put(key, value.asBoolean());
        } else if (value.isContainerNode()) {
            target.put(key, value.toString());
        } else {
            target.put(key, value.asText());
        }
    }
}
