package com.desweep.core.scanner;

import com.desweep.core.model.DependencyType;
import com.desweep.core.model.MetadataCollection;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Matching and extraction rules for one metadata collection.
 *
 * @param collection       collection the rule scans
 * @param strategies       strategies whose labels are combined
 * @param fallback         strategy tried only when {@code strategies} found nothing
 * @param idFields         aliases of the record id
 * @param nameFields       aliases of the record name
 * @param status           derives the reported status text
 * @param projectionFields fields copied into the record's raw metadata; empty copies the whole record
 */
public record SourceRule(
    MetadataCollection collection,
    List<MatchStrategy> strategies,
    Optional<MatchStrategy> fallback,
    List<String> idFields,
    List<String> nameFields,
    Function<JsonNode, String> status,
    List<String> projectionFields
) {

    public SourceRule {
        strategies = List.copyOf(strategies);
        idFields = List.copyOf(idFields);
        nameFields = List.copyOf(nameFields);
        projectionFields = List.copyOf(projectionFields);
    }

    public DependencyType type() {
        return collection.dependencyType();
    }

    static Function<JsonNode, String> statusFrom(String... paths) {
        List<String> aliases = List.of(paths);
        return record -> JsonFields.firstText(record, aliases).orElse(null);
    }
}
