package io.surveylogic.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Survey field (question). Immutable, thread-safe.
 *
 * @param id                  unique id within the survey
 * @param type                declared answer type
 * @param label               display label, may be null
 * @param options             declared option values for choice fields; empty means unrestricted
 * @param caseInsensitive     text comparisons on this field ignore case (text fields only)
 * @param visibilityCondition condition that must be TRUE for the field to show, or null for
 *                            always visible
 * @param rules               validation rules in declaration order
 */
public record Field(
        String id,
        FieldType type,
        String label,
        List<String> options,
        boolean caseInsensitive,
        Condition visibilityCondition,
        List<ValidationRule> rules) {

    public Field {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        options = options == null ? List.of() : List.copyOf(options);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /** Convenience constructor for an unconditional field with no options. */
    public Field(String id, FieldType type, List<ValidationRule> rules) {
        this(id, type, null, List.of(), false, null, rules);
    }

    public boolean hasVisibilityCondition() {
        return visibilityCondition != null;
    }

    public boolean isRequired() {
        return rule(ValidationRule.Kind.REQUIRED).isPresent();
    }

    /** Returns the rule of the given kind, if declared. A field declares each kind at most once. */
    public Optional<ValidationRule> rule(ValidationRule.Kind kind) {
        return rules.stream().filter(r -> r.kind() == kind).findFirst();
    }
}
