package com.desweep.core.scanner;

import com.desweep.core.model.TargetEntity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * How one metadata source is searched for references to a target entity.
 * <p>
 * All comparisons are case-insensitive. Each variant returns the labels of what
 * matched, in a stable order, or an empty list.
 */
public sealed interface MatchStrategy
        permits MatchStrategy.ExactField, MatchStrategy.TextContains, MatchStrategy.SerializedContains {

    List<String> match(JsonNode record, TargetEntity entity);

    /** Which attribute of the target entity a field is compared with. */
    enum Needle {
        PRIMARY_KEY, ALTERNATE_NAME, OPAQUE_ID;

        Optional<String> of(TargetEntity entity) {
            String value = switch (this) {
                case PRIMARY_KEY -> entity.primaryKey();
                case ALTERNATE_NAME -> entity.alternateName();
                case OPAQUE_ID -> entity.opaqueId();
            };
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
        }
    }

    /**
     * @param paths  aliases of one logical field, first present wins
     * @param needle entity attribute to compare with
     * @param label  detail reported on a match
     */
    record FieldRule(List<String> paths, Needle needle, String label) {

        public FieldRule {
            paths = List.copyOf(paths);
        }

        public static FieldRule of(String label, Needle needle, String... paths) {
            return new FieldRule(List.of(paths), needle, label);
        }
    }

    /**
     * Equality of explicit reference fields. The most reliable strategy.
     */
    record ExactField(List<FieldRule> rules) implements MatchStrategy {

        public ExactField {
            rules = List.copyOf(rules);
        }

        public static ExactField of(FieldRule... rules) {
            return new ExactField(List.of(rules));
        }

        @Override
        public List<String> match(JsonNode record, TargetEntity entity) {
            List<String> labels = new ArrayList<>();
            for (FieldRule rule : rules) {
                Optional<String> needle = rule.needle().of(entity);
                if (needle.isEmpty() || labels.contains(rule.label())) {
                    continue;
                }
                Optional<String> value = JsonFields.firstText(record, rule.paths());
                if (value.isPresent() && value.get().equalsIgnoreCase(needle.get())) {
                    labels.add(rule.label());
                }
            }
            return labels;
        }
    }

    /**
     * Substring search of the entity's key, then its name, inside a text body such as SQL.
     * No parsing is attempted.
     *
     * @param textPaths aliases of the text field
     * @param label     prefix of the reported detail, e.g. "Referenced in SQL"
     */
    record TextContains(List<String> textPaths, String label) implements MatchStrategy {

        public TextContains {
            textPaths = List.copyOf(textPaths);
        }

        @Override
        public List<String> match(JsonNode record, TargetEntity entity) {
            Optional<String> text = JsonFields.firstText(record, textPaths);
            if (text.isEmpty()) {
                return List.of();
            }
            String body = text.get().toLowerCase(Locale.ROOT);
            List<String> labels = new ArrayList<>();
            if (body.contains(entity.primaryKey().toLowerCase(Locale.ROOT))) {
                labels.add(label + " (by Key)");
            }
            Optional<String> name = Needle.ALTERNATE_NAME.of(entity);
            if (name.isPresent() && body.contains(name.get().toLowerCase(Locale.ROOT))) {
                labels.add(label + " (by Name)");
            }
            return labels;
        }
    }

    /**
     * Substring search of the entity's primary key in the whole serialised record.
     * Coarse: favours recall over precision.
     */
    record SerializedContains(String label) implements MatchStrategy {

        @Override
        public List<String> match(JsonNode record, TargetEntity entity) {
            String serialized = record.toString().toLowerCase(Locale.ROOT);
            return serialized.contains(entity.primaryKey().toLowerCase(Locale.ROOT))
                    ? List.of(label)
                    : List.of();
        }
    }
}
