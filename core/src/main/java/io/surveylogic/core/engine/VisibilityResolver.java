package io.surveylogic.core.engine;

import io.surveylogic.core.error.UnknownSectionException;
import io.surveylogic.core.model.AnswerSet;
import io.surveylogic.core.model.Field;
import io.surveylogic.core.model.Section;
import io.surveylogic.core.model.SurveyDefinition;
import io.surveylogic.core.model.Truth;
import io.surveylogic.core.model.VisibilitySnapshot;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes which sections and fields are visible for an answer set. A section shows when its
 * entry condition is absent or TRUE; a field shows when its section shows and its own
 * visibility condition is absent or TRUE. Indeterminate conditions hide.
 */
public final class VisibilityResolver {

    private final ConditionEvaluator evaluator;

    public VisibilityResolver(ConditionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * @throws UnknownSectionException if {@code currentSectionId} is not a section of the survey
     */
    public VisibilitySnapshot computeVisibility(
            SurveyDefinition definition, AnswerSet answers, String currentSectionId) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(answers, "answers must not be null");
        if (definition.section(currentSectionId).isEmpty()) {
            throw new UnknownSectionException(currentSectionId, definition.id());
        }

        List<String> visibleSections = new ArrayList<>();
        List<String> visibleFields = new ArrayList<>();
        Map<String, Truth> sectionOutcomes = new LinkedHashMap<>();
        Map<String, Truth> fieldOutcomes = new LinkedHashMap<>();

        for (Section section : definition.sections()) {
            Truth sectionOutcome = section.hasEntryCondition()
                    ? evaluator.evaluate(section.entryCondition(), answers)
                    : Truth.TRUE;
            sectionOutcomes.put(section.id(), sectionOutcome);
            boolean sectionVisible = sectionOutcome.isTrue();
            if (sectionVisible) {
                visibleSections.add(section.id());
            }
            for (String fieldId : section.fieldIds()) {
                Field field = definition.field(fieldId).orElseThrow();
                Truth fieldOutcome = field.hasVisibilityCondition()
                        ? evaluator.evaluate(field.visibilityCondition(), answers)
                        : Truth.TRUE;
                fieldOutcomes.put(fieldId, fieldOutcome);
                if (sectionVisible && fieldOutcome.isTrue()) {
                    visibleFields.add(fieldId);
                }
            }
        }

        return new VisibilitySnapshot(
                definition.id(),
                definition.version(),
                currentSectionId,
                visibleSections,
                visibleFields,
                sectionOutcomes,
                fieldOutcomes,
                answers);
    }
}
