package io.surveylogic.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.surveylogic.core.model.AnswerSet;
import io.surveylogic.core.model.Field;
import io.surveylogic.core.model.SurveyDefinition;
import io.surveylogic.core.model.ValidationError;
import io.surveylogic.core.model.ValidationRule;
import io.surveylogic.core.model.VisibilitySnapshot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks answers against the rules of the visible fields. Hidden fields are never validated, so a
 * required field that is hidden never produces an error.
 *
 * <p>
 * Every rule of a field is checked; there is no fail-fast. Only a {@code TYPE_MISMATCH} stops
 * the remaining value rules of that field, since they cannot be read against an unreadable
 * answer.
 */
public final class ValidationEngine {

    /**
     * @param definition survey definition
     * @param snapshot   visibility computed for {@code answers}
     * @param answers    answers to validate
     * @return violations in field declaration order, empty when valid
     */
    public List<ValidationError> validate(SurveyDefinition definition, VisibilitySnapshot snapshot, AnswerSet answers) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(answers, "answers must not be null");

        List<ValidationError> errors = new ArrayList<>();
        for (String fieldId : snapshot.visibleFieldIds()) {
            Field field = definition.field(fieldId).orElseThrow();
            Optional<JsonNode> answer = answers.get(fieldId);
            if (answer.isEmpty()) {
                field.rule(ValidationRule.Kind.REQUIRED)
                        .ifPresent(rule -> errors.add(error(field, rule, "This field is required")));
                continue;
            }
            validateAnswer(field, answer.get(), errors);
        }
        return List.copyOf(errors);
    }

    private static void validateAnswer(Field field, JsonNode value, List<ValidationError> errors) {
        switch (field.type()) {
            case TEXT -> AnswerValues.asText(value).ifPresentOrElse(
                    text -> checkText(field, text, errors), () -> errors.add(mismatch(field, value)));
            case NUMBER -> AnswerValues.asNumber(value).ifPresentOrElse(
                    number -> checkNumber(field, number, errors), () -> errors.add(mismatch(field, value)));
            case BOOLEAN -> {
                if (AnswerValues.asBoolean(value).isEmpty()) {
                    errors.add(mismatch(field, value));
                }
            }
            case DATE -> {
                if (AnswerValues.asDate(value).isEmpty()) {
                    errors.add(mismatch(field, value));
                }
            }
            case CHOICE -> AnswerValues.asText(value).ifPresentOrElse(
                    option -> checkOptions(field, List.of(option), errors), () -> errors.add(mismatch(field, value)));
            case MULTICHOICE -> AnswerValues.asSelections(value).ifPresentOrElse(
                    selected -> {
                        checkOptions(field, selected, errors);
                        checkLength(field, selected.size(), "selections", errors);
                    },
                    () -> errors.add(mismatch(field, value)));
        }
    }

    private static void checkText(Field field, String text, List<ValidationError> errors) {
        checkLength(field, text.codePointCount(0, text.length()), "characters", errors);
        field.rule(ValidationRule.Kind.PATTERN)
                .filter(rule -> !rule.pattern().matcher(text).matches())
                .ifPresent(rule -> errors.add(
                        error(field, rule, "Must match the pattern " + rule.pattern().pattern())));
    }

    private static void checkNumber(Field field, BigDecimal number, List<ValidationError> errors) {
        field.rule(ValidationRule.Kind.MIN_VALUE)
                .filter(rule -> number.compareTo(rule.limit()) < 0)
                .ifPresent(rule -> errors.add(
                        error(field, rule, "Must be at least " + rule.limit().toPlainString())));
        field.rule(ValidationRule.Kind.MAX_VALUE)
                .filter(rule -> number.compareTo(rule.limit()) > 0)
                .ifPresent(rule -> errors.add(
                        error(field, rule, "Must be at most " + rule.limit().toPlainString())));
    }

    private static void checkLength(Field field, int length, String unit, List<ValidationError> errors) {
        BigDecimal actual = BigDecimal.valueOf(length);
        field.rule(ValidationRule.Kind.MIN_LENGTH)
                .filter(rule -> actual.compareTo(rule.limit()) < 0)
                .ifPresent(rule -> errors.add(
                        error(field, rule, "Must have at least " + rule.limit().toPlainString() + " " + unit)));
        field.rule(ValidationRule.Kind.MAX_LENGTH)
                .filter(rule -> actual.compareTo(rule.limit()) > 0)
                .ifPresent(rule -> errors.add(
                        error(field, rule, "Must have at most " + rule.limit().toPlainString() + " " + unit)));
    }

    private static void checkOptions(Field field, List<String> selected, List<ValidationError> errors) {
        if (field.options().isEmpty()) {
            return;
        }
        List<String> unknown = selected.stream()
                .filter(option -> !field.options().contains(option))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            errors.add(new ValidationError(
                    field.id(),
                    ValidationError.Code.UNKNOWN_OPTION,
                    "Not a valid option: " + String.join(", ", unknown)));
        }
    }

    private static ValidationError mismatch(Field field, JsonNode value) {
        return new ValidationError(
                field.id(),
                ValidationError.Code.TYPE_MISMATCH,
                "Expected a " + field.type().wireName() + " value, got: " + value);
    }

    private static ValidationError error(Field field, ValidationRule rule, String defaultMessage) {
        String message = rule.message() != null ? rule.message() : defaultMessage;
        return new ValidationError(field.id(), ValidationError.Code.of(rule.kind()), message);
    }
}
