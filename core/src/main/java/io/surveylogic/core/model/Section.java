package io.surveylogic.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Survey section grouping fields. Immutable, thread-safe.
 *
 * @param id             unique id within the survey
 * @param title          display title, may be null
 * @param fieldIds       ids of the fields shown in this section, in declared order
 * @param entryCondition condition that must be TRUE for the section to show, or null
 * @param nextSections   navigation overrides, first TRUE guard wins
 */
public record Section(
        String id, String title, List<String> fieldIds, Condition entryCondition, List<NextSectionRule> nextSections) {

    public Section {
        Objects.requireNonNull(id, "id must not be null");
        fieldIds = fieldIds == null ? List.of() : List.copyOf(fieldIds);
        nextSections = nextSections == null ? List.of() : List.copyOf(nextSections);
    }

    /** Convenience constructor for an unconditional section without overrides. */
    public Section(String id, List<String> fieldIds) {
        this(id, null, fieldIds, null, List.of());
    }

    public boolean hasEntryCondition() {
        return entryCondition != null;
    }
}
