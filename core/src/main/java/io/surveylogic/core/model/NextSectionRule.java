package io.surveylogic.core.model;

import java.util.Objects;

/**
 * Explicit navigation override on a section: when {@code when} evaluates TRUE, navigation jumps
 * to {@code target}. A {@code null} target completes the survey.
 *
 * @param when   guarding condition
 * @param target target section id, or null to complete the survey
 */
public record NextSectionRule(Condition when, String target) {

    public NextSectionRule {
        Objects.requireNonNull(when, "when must not be null");
    }

    public static NextSectionRule goTo(Condition when, String target) {
        return new NextSectionRule(when, Objects.requireNonNull(target, "target must not be null"));
    }

    public static NextSectionRule complete(Condition when) {
        return new NextSectionRule(when, null);
    }

    public boolean completesSurvey() {
        return target == null;
    }
}
