package io.surveylogic.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Boolean condition over survey answers. A closed hierarchy: either a {@link Leaf} predicate on a
 * single field or a {@link Composite} of child conditions.
 *
 * <p>
 * Instances are produced by {@code ConditionParser} (or assembled directly in tests) and are
 * immutable and thread-safe.
 */
public sealed interface Condition {

    /** Boolean composition kind. */
    enum Kind {
        AND,
        OR,
        NOT
    }

    /** Nesting depth; a leaf has depth 1. */
    int depth();

    /** Ids of all fields referenced by leaves under this node, in first-seen order. */
    default Set<String> referencedFields() {
        Set<String> refs = new LinkedHashSet<>();
        collectReferences(this, refs);
        return refs;
    }

    private static void collectReferences(Condition condition, Set<String> refs) {
        if (condition instanceof Leaf leaf) {
            refs.add(leaf.fieldRef());
        } else if (condition instanceof Composite composite) {
            for (Condition child : composite.children()) {
                collectReferences(child, refs);
            }
        }
    }

    /**
     * Predicate on one field. {@code fieldType} and {@code caseInsensitive} are copied from the
     * referenced field at parse time so evaluation needs no definition lookup.
     *
     * @param operator        comparison operator
     * @param fieldRef        id of the referenced field
     * @param fieldType       declared type of the referenced field
     * @param caseInsensitive whether text comparison ignores case
     * @param operands        typed operands; empty for presence operators
     */
    record Leaf(
            Operator operator, String fieldRef, FieldType fieldType, boolean caseInsensitive, List<Operand> operands)
            implements Condition {

        public Leaf {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(fieldRef, "fieldRef must not be null");
            Objects.requireNonNull(fieldType, "fieldType must not be null");
            operands = operands == null ? List.of() : List.copyOf(operands);
        }

        @Override
        public int depth() {
            return 1;
        }
    }

    /**
     * Boolean combination of child conditions. {@code NOT} takes exactly one child, {@code
     * AND}/{@code OR} at least one.
     *
     * @param kind     composition kind
     * @param children ordered child conditions
     */
    record Composite(Kind kind, List<Condition> children) implements Condition {

        public Composite {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(children, "children must not be null");
            if (kind == Kind.NOT && children.size() != 1) {
                throw new IllegalArgumentException("NOT requires exactly one child, got: " + children.size());
            }
            if (children.isEmpty()) {
                throw new IllegalArgumentException(kind + " requires at least one child");
            }
            children = List.copyOf(children);
        }

        @Override
        public int depth() {
            int max = 0;
            for (Condition child : children) {
                max = Math.max(max, child.depth());
            }
            return max + 1;
        }
    }
}
