package io.surveylogic.core.model;

import java.util.Objects;

/**
 * Outcome of {@code NavigationResolver.resolveNext}: either a next section or the terminal
 * "survey complete" marker.
 *
 * @param sectionId next section id, or {@code null} when the survey is complete
 * @param reason    how the outcome was chosen
 */
public record NavigationResult(String sectionId, Reason reason) {

    /** How navigation arrived at its outcome. */
    public enum Reason {
        /** A {@code nextSection} override on the current section matched. */
        OVERRIDE,
        /** The next visible section in declared order. */
        SEQUENTIAL,
        /** No visible section remains after the current one. */
        END_OF_SURVEY
    }

    public NavigationResult {
        Objects.requireNonNull(reason, "reason must not be null");
        if (sectionId == null && reason == Reason.SEQUENTIAL) {
            throw new IllegalArgumentException("SEQUENTIAL navigation requires a section id");
        }
        if (sectionId != null && reason == Reason.END_OF_SURVEY) {
            throw new IllegalArgumentException("END_OF_SURVEY navigation cannot carry a section id");
        }
    }

    public static NavigationResult section(String sectionId, Reason reason) {
        return new NavigationResult(Objects.requireNonNull(sectionId, "sectionId must not be null"), reason);
    }

    public static NavigationResult complete(Reason reason) {
        return new NavigationResult(null, reason);
    }

    public boolean isComplete() {
        return sectionId == null;
    }

    @Override
    public String toString() {
        return isComplete()
                ? "NavigationResult[COMPLETE, " + reason + "]"
                : "NavigationResult[" + sectionId + ", " + reason + "]";
    }
}
