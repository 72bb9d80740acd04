package io.surveylogic.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Explanation of a condition evaluation: mirrors the condition tree and records the outcome of
 * every node. Leaves also record the answer they saw ({@code null} when unanswered). Useful to
 * show why a field or section is hidden.
 *
 * @param condition evaluated node
 * @param outcome   outcome of this node
 * @param actual    answer seen by a leaf, null for composites and unanswered fields
 * @param children  traces of child nodes, empty for leaves
 */
public record ConditionTrace(Condition condition, Truth outcome, JsonNode actual, List<ConditionTrace> children) {

    public ConditionTrace {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** Leaf traces under this node whose outcome equals {@code outcome}, in tree order. */
    public List<ConditionTrace> leaves(Truth outcome) {
        List<ConditionTrace> out = new ArrayList<>();
        collectLeaves(this, outcome, out);
        return out;
    }

    private static void collectLeaves(ConditionTrace trace, Truth outcome, List<ConditionTrace> out) {
        if (trace.condition() instanceof Condition.Leaf) {
            if (trace.outcome() == outcome) {
                out.add(trace);
            }
            return;
        }
        for (ConditionTrace child : trace.children()) {
            collectLeaves(child, outcome, out);
        }
    }
}
