package com.desweep.core.scanner;

import com.desweep.core.model.MetadataCollection;
import com.desweep.core.scanner.MatchStrategy.ExactField;
import com.desweep.core.scanner.MatchStrategy.FieldRule;
import com.desweep.core.scanner.MatchStrategy.Needle;
import com.desweep.core.scanner.MatchStrategy.SerializedContains;
import com.desweep.core.scanner.MatchStrategy.TextContains;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The rule for every metadata collection, in scan order.
 * <p>
 * Field aliases cover both the REST shape (camelCase) and the SOAP-style shape
 * (PascalCase, sometimes flattened with dots) of the same objects.
 */
public final class SourceRules {

    static final String SOURCE_DE = "Source DE";
    static final String DESTINATION_DE = "Destination DE";
    static final String SOURCE_AND_DESTINATION_DE = "Source & Destination DE";

    private SourceRules() {}

    static final SourceRule FILTERS = new SourceRule(
            MetadataCollection.FILTERS,
            List.of(ExactField.of(
                    FieldRule.of(SOURCE_DE, Needle.OPAQUE_ID, "sourceObjectId"),
                    FieldRule.of(DESTINATION_DE, Needle.OPAQUE_ID, "destinationObjectId"))),
            Optional.empty(),
            List.of("filterActivityId", "id"),
            List.of("name", "Name"),
            SourceRules::filterStatus,
            List.of("filterActivityId", "sourceObjectId", "destinationObjectId", "customerKey",
                    "createdDate", "modifiedDate"));

    static final SourceRule QUERIES = new SourceRule(
            MetadataCollection.QUERIES,
            List.of(
                    ExactField.of(
                            FieldRule.of("Query Target", Needle.PRIMARY_KEY,
                                    "DataExtensionTarget.CustomerKey", "targetKey"),
                            FieldRule.of("Query Target", Needle.PRIMARY_KEY,
                                    "DataExtensionTarget.Name", "targetName"),
                            FieldRule.of("Query Target", Needle.ALTERNATE_NAME,
                                    "DataExtensionTarget.Name", "targetName")),
                    new TextContains(List.of("QueryText", "queryText"), "Referenced in SQL")),
            Optional.empty(),
            List.of("ObjectID", "queryDefinitionId", "id"),
            List.of("Name", "name"),
            SourceRule.statusFrom("Status", "status"),
            List.of("ObjectID", "queryDefinitionId", "CustomerKey", "key", "DataExtensionTarget.CustomerKey",
                    "targetKey", "CreatedDate", "createdDate", "ModifiedDate", "modifiedDate"));

    static final SourceRule IMPORTS = new SourceRule(
            MetadataCollection.IMPORTS,
            List.of(ExactField.of(
                    FieldRule.of("Import Destination", Needle.PRIMARY_KEY, "DestinationObject.CustomerKey"),
                    FieldRule.of("Import Destination", Needle.OPAQUE_ID, "destinationObjectId"))),
            Optional.empty(),
            List.of("ObjectID", "importDefinitionId", "id"),
            List.of("Name", "name"),
            SourceRule.statusFrom("Status", "status"),
            List.of("ObjectID", "importDefinitionId", "CustomerKey", "customerKey", "CreatedDate", "createdDate",
                    "ModifiedDate", "modifiedDate"));

    static final SourceRule TRIGGERED_MESSAGES = new SourceRule(
            MetadataCollection.TRIGGERED_MESSAGES,
            List.of(ExactField.of(
                    FieldRule.of("Triggered Message Audience", Needle.PRIMARY_KEY,
                            "subscriptions.dataExtension", "SendableDataExtension.CustomerKey"))),
            Optional.of(new SerializedContains("Referenced in Triggered Message")),
            List.of("ObjectID", "definitionId", "id"),
            List.of("Name", "name"),
            SourceRule.statusFrom("TriggeredSendStatus", "status"),
            List.of("ObjectID", "definitionId", "CustomerKey", "definitionKey", "TriggeredSendStatus", "status"));

    static final SourceRule WORKFLOWS = new SourceRule(
            MetadataCollection.WORKFLOWS,
            List.of(new SerializedContains("Referenced in Workflow")),
            Optional.empty(),
            List.of("id"),
            List.of("name"),
            SourceRule.statusFrom("status"),
            List.of("id", "key", "status", "statusId", "lastRunTime", "createdDate", "modifiedDate",
                    "detailsError"));

    static final SourceRule JOURNEYS = new SourceRule(
            MetadataCollection.JOURNEYS,
            List.of(new SerializedContains("Referenced in Journey")),
            Optional.empty(),
            List.of("id"),
            List.of("name"),
            SourceRule.statusFrom("status"),
            List.of("id", "key", "status", "version"));

    static final SourceRule DATA_EXTRACTS = new SourceRule(
            MetadataCollection.DATA_EXTRACTS,
            List.of(new SerializedContains("Referenced in Data Extract")),
            Optional.empty(),
            List.of("dataExtractDefinitionId", "id"),
            List.of("name"),
            SourceRule.statusFrom("status"),
            List.of());

    public static List<SourceRule> all() {
        return List.of(FILTERS, QUERIES, IMPORTS, TRIGGERED_MESSAGES, WORKFLOWS, JOURNEYS, DATA_EXTRACTS);
    }

    /** Joins match labels; a filter matching on both sides gets one combined label. */
    static String describe(Collection<String> labels) {
        List<String> parts = new ArrayList<>(labels);
        int source = parts.indexOf(SOURCE_DE);
        int destination = parts.indexOf(DESTINATION_DE);
        if (source >= 0 && destination >= 0) {
            parts.set(Math.min(source, destination), SOURCE_AND_DESTINATION_DE);
            parts.remove(Math.max(source, destination));
        }
        return String.join(", ", parts);
    }

    /** "Active" for statusId 1, otherwise "Status N". */
    static String filterStatus(JsonNode filter) {
        JsonNode statusId = filter.get("statusId");
        if (statusId == null || statusId.isNull()) {
            return "Unknown";
        }
        return statusId.asInt() == 1 ? "Active" : "Status " + statusId.asText();
    }
}
