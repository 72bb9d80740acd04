package io.surveylogic.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Visible sections and fields for one answer set, as computed by {@code VisibilityResolver}.
 * Immutable; produced once per call and owned by the caller.
 *
 * <p>
 * Besides the visible ids (in declared order) the snapshot keeps the raw outcome of every entry
 * and visibility condition, so callers can tell a field hidden by a definite {@link Truth#FALSE}
 * from one hidden while its upstream answers are still missing.
 *
 * @param surveyId          survey id
 * @param surveyVersion     survey version
 * @param currentSectionId  section the respondent is on
 * @param visibleSectionIds visible sections in declared order
 * @param visibleFieldIds   visible fields in declared order
 * @param sectionOutcomes   entry-condition outcome per section (TRUE when unconditional)
 * @param fieldOutcomes     visibility-condition outcome per field (TRUE when unconditional)
 * @param answers           answer set the snapshot was computed from
 */
public record VisibilitySnapshot(
        String surveyId,
        String surveyVersion,
        String currentSectionId,
        List<String> visibleSectionIds,
        List<String> visibleFieldIds,
        Map<String, Truth> sectionOutcomes,
        Map<String, Truth> fieldOutcomes,
        AnswerSet answers) {

    public VisibilitySnapshot {
        Objects.requireNonNull(surveyId, "surveyId must not be null");
        Objects.requireNonNull(currentSectionId, "currentSectionId must not be null");
        Objects.requireNonNull(answers, "answers must not be null");
        visibleSectionIds = List.copyOf(visibleSectionIds);
        visibleFieldIds = List.copyOf(visibleFieldIds);
        sectionOutcomes = Map.copyOf(sectionOutcomes);
        fieldOutcomes = Map.copyOf(fieldOutcomes);
    }

    public boolean isSectionVisible(String sectionId) {
        return visibleSectionIds.contains(sectionId);
    }

    public boolean isFieldVisible(String fieldId) {
        return visibleFieldIds.contains(fieldId);
    }

    public boolean isCurrentSectionVisible() {
        return isSectionVisible(currentSectionId);
    }

    /** Outcome of the field's own visibility condition, ignoring its section. */
    public Truth fieldOutcome(String fieldId) {
        return fieldOutcomes.getOrDefault(fieldId, Truth.TRUE);
    }

    /** Outcome of the section's entry condition. */
    public Truth sectionOutcome(String sectionId) {
        return sectionOutcomes.getOrDefault(sectionId, Truth.TRUE);
    }

    /** Visible field ids as a set, for membership-heavy callers. */
    public Set<String> visibleFieldSet() {
        return new LinkedHashSet<>(visibleFieldIds);
    }
}
