package io.surveylogic.core.engine;

import io.surveylogic.core.error.UnknownSectionException;
import io.surveylogic.core.model.NavigationResult;
import io.surveylogic.core.model.NextSectionRule;
import io.surveylogic.core.model.Section;
import io.surveylogic.core.model.SurveyDefinition;
import io.surveylogic.core.model.VisibilitySnapshot;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the section that follows the current one.
 *
 * <ol>
 * <li>The first {@code nextSection} override whose guard is TRUE wins, in declaration order. A
 * {@code complete} override ends the survey; an override to a hidden section lands on the first
 * visible section at or after its target.</li>
 * <li>Otherwise the next visible section in declared order.</li>
 * <li>Otherwise the survey is complete.</li>
 * </ol>
 *
 * <p>
 * Each call resolves one step. Cycles made only of overrides are rejected when a definition is
 * loaded; a single backward override is allowed and returns the respondent to an earlier section.
 */
public final class NavigationResolver {

    private final ConditionEvaluator evaluator;

    public NavigationResolver(ConditionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * @throws UnknownSectionException if {@code currentSectionId} is not a section of the survey
     */
    public NavigationResult resolveNext(
            SurveyDefinition definition, VisibilitySnapshot snapshot, String currentSectionId) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Section current = definition
                .section(currentSectionId)
                .orElseThrow(() -> new UnknownSectionException(currentSectionId, definition.id()));

        for (NextSectionRule rule : current.nextSections()) {
            if (!evaluator.evaluate(rule.when(), snapshot.answers()).isTrue()) {
                continue;
            }
            if (rule.completesSurvey()) {
                return NavigationResult.complete(NavigationResult.Reason.OVERRIDE);
            }
            return firstVisibleFrom(definition, snapshot, definition.sectionIndex(rule.target()))
                    .map(id -> NavigationResult.section(id, NavigationResult.Reason.OVERRIDE))
                    .orElseGet(() -> NavigationResult.complete(NavigationResult.Reason.OVERRIDE));
        }

        return firstVisibleFrom(definition, snapshot, definition.sectionIndex(currentSectionId) + 1)
                .map(id -> NavigationResult.section(id, NavigationResult.Reason.SEQUENTIAL))
                .orElseGet(() -> NavigationResult.complete(NavigationResult.Reason.END_OF_SURVEY));
    }

    private static Optional<String> firstVisibleFrom(
            SurveyDefinition definition, VisibilitySnapshot snapshot, int fromIndex) {
        List<Section> sections = definition.sections();
        for (int i = fromIndex; i < sections.size(); i++) {
            String id = sections.get(i).id();
            if (snapshot.isSectionVisible(id)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
