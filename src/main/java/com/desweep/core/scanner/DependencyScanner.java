package com.desweep.core.scanner;

import com.desweep.core.loader.BulkDataset;
import com.desweep.core.metrics.DesweepMetrics;
import com.desweep.core.model.DependencyRecord;
import com.desweep.core.model.TargetEntity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds every metadata object that references a target entity.
 * <p>
 * Pure over its inputs: no network or file access. Records that cannot be read
 * are skipped with a warning.
 */
@Service
public class DependencyScanner {

    private static final Logger log = LoggerFactory.getLogger(DependencyScanner.class);

    private final List<SourceRule> rules;
    private final DesweepMetrics metrics;

    @Autowired
    public DependencyScanner(DesweepMetrics metrics) {
        this(SourceRules.all(), metrics);
    }

    DependencyScanner(List<SourceRule> rules, DesweepMetrics metrics) {
        this.rules = List.copyOf(rules);
        this.metrics = metrics;
    }

    /**
     * @return one record per referencing object, each listing {@code entity} as affected
     */
    public List<DependencyRecord> scan(TargetEntity entity, BulkDataset dataset) {
        List<DependencyRecord> found = new ArrayList<>();
        for (SourceRule rule : rules) {
            int index = 0;
            for (JsonNode record : dataset.records(rule.collection())) {
                try {
                    scanRecord(rule, record, index, entity).ifPresent(found::add);
                } catch (MalformedRecordException e) {
                    log.warn("Skipping malformed {} record #{}: {}", rule.type().label(), index, e.getMessage());
                    metrics.recordMalformedRecord(rule.type());
                }
                index++;
            }
        }
        log.debug("Entity {} has {} dependencies", entity.primaryKey(), found.size());
        return found;
    }

    private Optional<DependencyRecord> scanRecord(SourceRule rule, JsonNode record, int index, TargetEntity entity) {
        if (record == null || !record.isObject()) {
            throw new MalformedRecordException(rule.type(),
                    "expected an object but got " + (record == null ? "null" : record.getNodeType()));
        }

        Set<String> labels = new LinkedHashSet<>();
        for (MatchStrategy strategy : rule.strategies()) {
            labels.addAll(strategy.match(record, entity));
        }
        if (labels.isEmpty() && rule.fallback().isPresent()) {
            labels.addAll(rule.fallback().get().match(record, entity));
        }
        if (labels.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new DependencyRecord(
                rule.type(),
                JsonFields.firstText(record, rule.idFields()).orElse(null),
                JsonFields.firstText(record, rule.nameFields()).orElse(null),
                rule.status().apply(record),
                SourceRules.describe(labels),
                project(record, rule.projectionFields()),
                List.of(entity),
                rule.collection().jsonField() + "#" + index));
    }

    private static JsonNode project(JsonNode record, List<String> fields) {
        if (fields.isEmpty()) {
            return record;
        }
        ObjectNode projection = JsonNodeFactory.instance.objectNode();
        for (String field : fields) {
            JsonNode value = JsonFields.node(record, field);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                projection.set(field, value);
            }
        }
        return projection;
    }
}
