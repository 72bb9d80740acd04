package io.surveylogic.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Leaf comparison operators. Each operator declares the operand shape it expects and the field
 * types it can be applied to; both are enforced when a condition is parsed, never during
 * evaluation.
 */
public enum Operator {
    EQUALS("equals", null, Arity.SINGLE, EnumSet.allOf(FieldType.class)),
    NOT_EQUALS("notEquals", "not_equals", Arity.SINGLE, EnumSet.allOf(FieldType.class)),
    IN("in", null, Arity.LIST, EnumSet.of(FieldType.TEXT, FieldType.NUMBER, FieldType.CHOICE, FieldType.DATE)),
    NOT_IN(
            "notIn",
            "not_in",
            Arity.LIST,
            EnumSet.of(FieldType.TEXT, FieldType.NUMBER, FieldType.CHOICE, FieldType.DATE)),
    GREATER_THAN("greaterThan", "greater_than", Arity.SINGLE, EnumSet.of(FieldType.NUMBER, FieldType.DATE)),
    LESS_THAN("lessThan", "less_than", Arity.SINGLE, EnumSet.of(FieldType.NUMBER, FieldType.DATE)),
    GREATER_THAN_OR_EQUAL(
            "greaterThanOrEqual", "greater_than_or_equal", Arity.SINGLE, EnumSet.of(FieldType.NUMBER, FieldType.DATE)),
    LESS_THAN_OR_EQUAL(
            "lessThanOrEqual", "less_than_or_equal", Arity.SINGLE, EnumSet.of(FieldType.NUMBER, FieldType.DATE)),
    BETWEEN("between", null, Arity.RANGE, EnumSet.of(FieldType.NUMBER, FieldType.DATE)),
    CONTAINS("contains", null, Arity.SINGLE, EnumSet.of(FieldType.TEXT, FieldType.MULTICHOICE)),
    NOT_CONTAINS("notContains", "not_contains", Arity.SINGLE, EnumSet.of(FieldType.TEXT, FieldType.MULTICHOICE)),
    STARTS_WITH("startsWith", "starts_with", Arity.SINGLE, EnumSet.of(FieldType.TEXT)),
    ENDS_WITH("endsWith", "ends_with", Arity.SINGLE, EnumSet.of(FieldType.TEXT)),
    MATCHES_PATTERN("matchesPattern", "matches_regex", Arity.SINGLE, EnumSet.of(FieldType.TEXT)),
    IS_EMPTY("isEmpty", "is_empty", Arity.NONE, EnumSet.allOf(FieldType.class)),
    IS_NOT_EMPTY("isNotEmpty", "is_not_empty", Arity.NONE, EnumSet.allOf(FieldType.class));

    /** Operand shape expected by an operator. */
    public enum Arity {
        /** No operand ({@code isEmpty}). */
        NONE,
        /** One value of the field's type. */
        SINGLE,
        /** Non-empty list of values of the field's type. */
        LIST,
        /** Two-element ascending list {@code [low, high]}, inclusive. */
        RANGE
    }

    private final String wireName;
    private final String alias;
    private final Arity arity;
    private final Set<FieldType> applicableTypes;

    Operator(String wireName, String alias, Arity arity, Set<FieldType> applicableTypes) {
        this.wireName = wireName;
        this.alias = alias;
        this.arity = arity;
        this.applicableTypes = Collections.unmodifiableSet(applicableTypes);
    }

    /** Canonical camelCase name, e.g. {@code greaterThan}. */
    public String wireName() {
        return wireName;
    }

    public Arity arity() {
        return arity;
    }

    public Set<FieldType> applicableTypes() {
        return applicableTypes;
    }

    public boolean appliesTo(FieldType type) {
        return applicableTypes.contains(type);
    }

    /**
     * Presence operators decide on answered-ness itself and never yield {@link
     * Truth#INDETERMINATE}.
     */
    public boolean testsPresence() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    /**
     * Resolves an operator by its camelCase name or its snake_case alias.
     *
     * @param name operator name as written in a definition
     * @return the operator, or empty if unknown
     */
    public static Optional<Operator> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(name) || name.equals(op.alias))
                .findFirst();
    }
}
