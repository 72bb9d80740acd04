package io.surveylogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.surveylogic.core.model.AnswerSet;
import io.surveylogic.core.model.Condition;
import io.surveylogic.core.model.Operand;
import io.surveylogic.core.model.Operator;
import io.surveylogic.core.model.Truth;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Evaluates one leaf comparison against an answer set.
 *
 * <p>
 * The answer is read as the field's declared type first. An unanswered field, or an answer that
 * cannot be read as that type, yields {@link Truth#INDETERMINATE}; only {@code isEmpty} and
 * {@code isNotEmpty} decide on presence alone and are always definite.
 */
final class PredicateEvaluator {

    private PredicateEvaluator() {}

    static Truth evaluate(Condition.Leaf leaf, AnswerSet answers) {
        Optional<JsonNode> answer = answers.get(leaf.fieldRef());
        if (leaf.operator().testsPresence()) {
            boolean empty = answer.isEmpty();
            return Truth.of(leaf.operator() == Operator.IS_EMPTY ? empty : !empty);
        }
        if (answer.isEmpty()) {
            return Truth.INDETERMINATE;
        }
        JsonNode value = answer.get();
        Optional<Boolean> result =
                switch (leaf.fieldType()) {
                    case TEXT, CHOICE -> AnswerValues.asText(value).map(text -> scalar(leaf, new Operand.Text(text)));
                    case NUMBER -> AnswerValues.asNumber(value).map(number -> scalar(leaf, new Operand.Number(number)));
                    case BOOLEAN -> AnswerValues.asBoolean(value).map(flag -> scalar(leaf, new Operand.Flag(flag)));
                    case DATE -> AnswerValues.asDate(value).map(date -> scalar(leaf, new Operand.Date(date)));
                    case MULTICHOICE -> AnswerValues.asSelections(value).map(selected -> selection(leaf, selected));
                };
        return result.map(Truth::of).orElse(Truth.INDETERMINATE);
    }

    private static boolean scalar(Condition.Leaf leaf, Operand actual) {
        List<Operand> operands = leaf.operands();
        boolean ignoreCase = leaf.caseInsensitive();
        return switch (leaf.operator()) {
            case EQUALS -> same(actual, operands.get(0), ignoreCase);
            case NOT_EQUALS -> !same(actual, operands.get(0), ignoreCase);
            case IN -> operands.stream().anyMatch(operand -> same(actual, operand, ignoreCase));
            case NOT_IN -> operands.stream().noneMatch(operand -> same(actual, operand, ignoreCase));
            case GREATER_THAN -> compare(actual, operands.get(0)) > 0;
            case GREATER_THAN_OR_EQUAL -> compare(actual, operands.get(0)) >= 0;
            case LESS_THAN -> compare(actual, operands.get(0)) < 0;
            case LESS_THAN_OR_EQUAL -> compare(actual, operands.get(0)) <= 0;
            case BETWEEN -> compare(actual, operands.get(0)) >= 0 && compare(actual, operands.get(1)) <= 0;
            case CONTAINS -> text(actual, ignoreCase).contains(text(operands.get(0), ignoreCase));
            case NOT_CONTAINS -> !text(actual, ignoreCase).contains(text(operands.get(0), ignoreCase));
            case STARTS_WITH -> text(actual, ignoreCase).startsWith(text(operands.get(0), ignoreCase));
            case ENDS_WITH -> text(actual, ignoreCase).endsWith(text(operands.get(0), ignoreCase));
            case MATCHES_PATTERN -> matches(actual, (Operand.Regex) operands.get(0));
            case IS_EMPTY, IS_NOT_EMPTY -> throw new IllegalStateException("Presence operator reached value path");
        };
    }

    private static boolean selection(Condition.Leaf leaf, List<String> selected) {
        List<Operand> operands = leaf.operands();
        return switch (leaf.operator()) {
            case CONTAINS -> selected.contains(text(operands.get(0), false));
            case NOT_CONTAINS -> !selected.contains(text(operands.get(0), false));
            case EQUALS -> new HashSet<>(selected).equals(optionSet(operands));
            case NOT_EQUALS -> !new HashSet<>(selected).equals(optionSet(operands));
            default -> throw new IllegalStateException(
                    "Operator " + leaf.operator().wireName() + " is not applicable to multichoice fields");
        };
    }

    private static Set<String> optionSet(List<Operand> operands) {
        Set<String> options = new HashSet<>();
        for (Operand operand : operands) {
            options.add(text(operand, false));
        }
        return options;
    }

    private static boolean same(Operand actual, Operand expected, boolean ignoreCase) {
        if (actual instanceof Operand.Number a && expected instanceof Operand.Number e) {
            return a.value().compareTo(e.value()) == 0;
        }
        if (ignoreCase && actual instanceof Operand.Text a && expected instanceof Operand.Text e) {
            return a.value().equalsIgnoreCase(e.value());
        }
        return actual.equals(expected);
    }

    private static int compare(Operand actual, Operand bound) {
        if (actual instanceof Operand.Number a && bound instanceof Operand.Number b) {
            return a.value().compareTo(b.value());
        }
        if (actual instanceof Operand.Date a && bound instanceof Operand.Date b) {
            return a.value().compareTo(b.value());
        }
        throw new IllegalStateException("Cannot order " + actual + " against " + bound);
    }

    private static String text(Operand operand, boolean ignoreCase) {
        if (!(operand instanceof Operand.Text t)) {
            throw new IllegalStateException("Expected a text operand, got " + operand);
        }
        return ignoreCase ? t.value().toLowerCase(Locale.ROOT) : t.value();
    }

    private static boolean matches(Operand actual, Operand.Regex regex) {
        Matcher matcher = regex.pattern().matcher(text(actual, false));
        return regex.anchored() ? matcher.matches() : matcher.find();
    }
}
