package io.surveylogic.core.engine;

import io.surveylogic.core.model.AnswerSet;
import io.surveylogic.core.model.Condition;
import io.surveylogic.core.model.ConditionTrace;
import io.surveylogic.core.model.Truth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Three-valued evaluation of condition trees.
 *
 * <p>
 * {@code AND} stops at the first {@link Truth#FALSE} child, {@code OR} at the first
 * {@link Truth#TRUE}; otherwise any {@link Truth#INDETERMINATE} child makes the result
 * indeterminate. {@code NOT} swaps TRUE and FALSE and keeps INDETERMINATE.
 *
 * <p>
 * Pure function of its inputs: no clock, no randomness, no shared state.
 */
public final class ConditionEvaluator {

    public Truth evaluate(Condition condition, AnswerSet answers) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(answers, "answers must not be null");
        return eval(condition, answers);
    }

    /**
     * Evaluates a condition and records the outcome of every node. Unlike {@link #evaluate} all
     * children are visited so the trace is complete; the root outcome is the same.
     */
    public ConditionTrace explain(Condition condition, AnswerSet answers) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(answers, "answers must not be null");
        return trace(condition, answers);
    }

    private static Truth eval(Condition condition, AnswerSet answers) {
        if (condition instanceof Condition.Leaf leaf) {
            return PredicateEvaluator.evaluate(leaf, answers);
        }
        Condition.Composite composite = (Condition.Composite) condition;
        return switch (composite.kind()) {
            case NOT -> eval(composite.children().get(0), answers).not();
            case AND -> {
                Truth result = Truth.TRUE;
                for (Condition child : composite.children()) {
                    result = result.and(eval(child, answers));
                    if (result == Truth.FALSE) {
                        break;
                    }
                }
                yield result;
            }
            case OR -> {
                Truth result = Truth.FALSE;
                for (Condition child : composite.children()) {
                    result = result.or(eval(child, answers));
                    if (result == Truth.TRUE) {
                        break;
                    }
                }
                yield result;
            }
        };
    }

    private static ConditionTrace trace(Condition condition, AnswerSet answers) {
        if (condition instanceof Condition.Leaf leaf) {
            return new ConditionTrace(
                    leaf,
                    PredicateEvaluator.evaluate(leaf, answers),
                    answers.get(leaf.fieldRef()).orElse(null),
                    List.of());
        }
        Condition.Composite composite = (Condition.Composite) condition;
        List<ConditionTrace> children = new ArrayList<>(composite.children().size());
        for (Condition child : composite.children()) {
            children.add(trace(child, answers));
        }
        Truth outcome =
                switch (composite.kind()) {
                    case NOT -> children.get(0).outcome().not();
                    case AND -> children.stream().map(ConditionTrace::outcome).reduce(Truth.TRUE, Truth::and);
                    case OR -> children.stream().map(ConditionTrace::outcome).reduce(Truth.FALSE, Truth::or);
                };
        return new ConditionTrace(composite, outcome, null, children);
    }
}
